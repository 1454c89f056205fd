package com.codeheadsystems.quartermaster.server.store;

import com.codeheadsystems.quartermaster.server.auth.CodeChallengeMethod;
import java.util.Set;

/**
 * Storage for short-lived authorization codes.
 * <p>
 * Implementations must be thread-safe, and a code must be redeemable at most once even when
 * redemptions race.
 */
public interface AuthorizationCodeStore {

  /**
   * Issues a new code.
   *
   * @param clientId            requesting client
   * @param redirectUri         redirect URI the code will be delivered to
   * @param scopes              requested scopes
   * @param codeChallenge       PKCE challenge, nullable
   * @param codeChallengeMethod PKCE method, ignored without a challenge
   * @param subject             approving resource owner
   * @return the opaque code
   * @throws IllegalStateException if the store is at capacity
   */
  String issue(String clientId, String redirectUri, Set<String> scopes,
               String codeChallenge, CodeChallengeMethod codeChallengeMethod, String subject);

  /**
   * Redeems a code, consuming it on success.
   * <p>
   * Unknown codes fail with {@code invalid_grant}. Expired codes are deleted and fail with
   * {@link com.codeheadsystems.quartermaster.server.auth.ExpiredGrantException}. When a
   * challenge was recorded, a missing verifier fails with {@code invalid_request} and a wrong
   * one with {@code invalid_grant}. A non-null {@code clientId} or {@code redirectUri} must equal
   * the recorded value, else {@code invalid_grant}. These verification failures leave the code
   * in place.
   *
   * @param code         the code
   * @param codeVerifier PKCE verifier, nullable
   * @param clientId     client presenting the code, or null to skip the check
   * @param redirectUri  redirect URI presented with the code, or null to skip the check
   * @return the consumed record
   * @throws com.codeheadsystems.quartermaster.server.auth.OAuthException on any failure
   */
  AuthorizationCodeData redeem(String code, String codeVerifier, String clientId, String redirectUri);

  /**
   * Redeems a code without client binding checks.
   *
   * @param code         the code
   * @param codeVerifier PKCE verifier, nullable
   * @return the consumed record
   */
  default AuthorizationCodeData redeem(String code, String codeVerifier) {
    return redeem(code, codeVerifier, null, null);
  }

  /**
   * Removes every expired code.
   *
   * @return number of codes removed
   */
  int purgeExpired();

  /**
   * Number of codes currently held, expired or not.
   *
   * @return the count
   */
  int size();
}
