package com.codeheadsystems.quartermaster.server.auth;

/**
 * Missing, malformed, unknown or expired bearer credential.
 * <p>
 * Resources translate this to HTTP 401 with a {@code WWW-Authenticate} challenge that points at
 * the protected-resource metadata document.
 */
public class UnauthenticatedException extends SecurityException {

  public UnauthenticatedException(String message) {
    super(message);
  }
}
