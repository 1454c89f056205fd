package com.codeheadsystems.quartermaster.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Validates a PKCE {@code code_verifier} against a stored {@code code_challenge}.
 * <p>
 * Stateless and thread-safe.
 */
public class PkceVerifier {

  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  /**
   * Computes the S256 challenge for a verifier.
   *
   * @param verifier the code verifier
   * @return base64url(sha256(verifier)) without padding
   */
  public static String s256Challenge(String verifier) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
      return B64URL.encodeToString(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Returns true when the verifier transforms to the expected challenge under the given method.
   *
   * @param verifier  the code verifier presented at the token endpoint
   * @param challenge the challenge recorded at the authorization endpoint
   * @param method    the recorded challenge method
   * @return whether the verifier matches
   */
  public boolean verify(String verifier, String challenge, CodeChallengeMethod method) {
    if (verifier == null || challenge == null || method == null) {
      return false;
    }
    String computed = switch (method) {
      case S256 -> s256Challenge(verifier);
      case PLAIN -> verifier;
    };
    // Constant time, so the comparison does not leak how many leading characters matched.
    return MessageDigest.isEqual(
        computed.getBytes(StandardCharsets.US_ASCII),
        challenge.getBytes(StandardCharsets.US_ASCII));
  }
}
