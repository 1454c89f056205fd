package com.codeheadsystems.quartermaster.server.auth;

/**
 * OAuth 2.1 error codes returned in the {@code error} member. The wire values are canonical and
 * must not change.
 */
public enum OAuthError {
  INVALID_REQUEST("invalid_request"),
  INVALID_GRANT("invalid_grant"),
  UNSUPPORTED_GRANT_TYPE("unsupported_grant_type"),
  ACCESS_DENIED("access_denied"),
  INVALID_REDIRECT_URI("invalid_redirect_uri"),
  TEMPORARILY_UNAVAILABLE("temporarily_unavailable");

  private final String code;

  OAuthError(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
