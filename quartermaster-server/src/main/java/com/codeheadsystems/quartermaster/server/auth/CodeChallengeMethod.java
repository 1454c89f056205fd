package com.codeheadsystems.quartermaster.server.auth;

import java.util.Optional;

/**
 * PKCE code challenge transformation methods (RFC 7636 §4.2).
 */
public enum CodeChallengeMethod {

  /**
   * {@code BASE64URL(SHA-256(ASCII(code_verifier)))}, no padding.
   */
  S256("S256"),

  /**
   * The challenge is the verifier itself.
   */
  PLAIN("plain");

  private final String wireName;

  CodeChallengeMethod(String wireName) {
    this.wireName = wireName;
  }

  /**
   * The exact value used in the {@code code_challenge_method} parameter.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire value. Matching is exact, so {@code s256} is not accepted.
   *
   * @param value the request parameter
   * @return the method, or empty if unsupported
   */
  public static Optional<CodeChallengeMethod> fromWireName(String value) {
    for (CodeChallengeMethod method : values()) {
      if (method.wireName.equals(value)) {
        return Optional.of(method);
      }
    }
    return Optional.empty();
  }
}
