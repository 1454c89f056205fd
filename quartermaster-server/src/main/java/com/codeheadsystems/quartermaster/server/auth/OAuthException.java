package com.codeheadsystems.quartermaster.server.auth;

/**
 * A request rejected by the authorization server with a canonical OAuth error code.
 * <p>
 * Extends {@link IllegalArgumentException}: every OAuth error here is a client mistake and maps
 * to HTTP 400.
 */
public class OAuthException extends IllegalArgumentException {

  private final OAuthError error;

  public OAuthException(OAuthError error, String description) {
    super(description);
    this.error = error;
  }

  public OAuthError error() {
    return error;
  }

  public String description() {
    return getMessage();
  }
}
