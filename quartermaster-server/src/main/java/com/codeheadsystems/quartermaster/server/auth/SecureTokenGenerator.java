package com.codeheadsystems.quartermaster.server.auth;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates opaque, unguessable identifiers for authorization codes, access tokens and sessions.
 * <p>
 * Each value carries 256 bits from {@link SecureRandom}, encoded as URL-safe base64 without padding.
 */
public class SecureTokenGenerator {

  private static final int TOKEN_BYTES = 32;
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final SecureRandom random;

  public SecureTokenGenerator() {
    this(new SecureRandom());
  }

  public SecureTokenGenerator(SecureRandom random) {
    this.random = random;
  }

  /**
   * Generates a fresh value.
   *
   * @return a 43-character URL-safe string
   */
  public String generate() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return B64URL.encodeToString(bytes);
  }
}
