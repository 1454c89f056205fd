package com.codeheadsystems.quartermaster.server.auth;

/**
 * Turns the raw {@code Authorization} header of a request into an {@link AuthContext}.
 */
public interface AuthContextResolver {

  /**
   * Resolves the caller's identity.
   *
   * @param authorizationHeader the header value, or null if the header was absent
   * @return the authenticated context
   * @throws UnauthenticatedException if the header is missing, malformed, or carries an unknown
   *                                  or expired token
   */
  AuthContext resolve(String authorizationHeader);
}
