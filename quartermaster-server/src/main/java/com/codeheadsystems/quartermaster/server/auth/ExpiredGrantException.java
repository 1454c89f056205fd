package com.codeheadsystems.quartermaster.server.auth;

/**
 * The authorization code existed but its lifetime had elapsed. The record is deleted when this
 * is thrown. Reported to clients as {@code invalid_grant}.
 */
public class ExpiredGrantException extends OAuthException {

  public ExpiredGrantException() {
    super(OAuthError.INVALID_GRANT, "Authorization code expired");
  }
}
