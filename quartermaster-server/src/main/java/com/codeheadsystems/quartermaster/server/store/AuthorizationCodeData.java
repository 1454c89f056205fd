package com.codeheadsystems.quartermaster.server.store;

import com.codeheadsystems.quartermaster.server.auth.CodeChallengeMethod;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A pending grant, recorded when the resource owner approves an authorization request.
 *
 * @param clientId            client the code was issued to
 * @param redirectUri         redirect URI the code was delivered to
 * @param scopes              requested scopes
 * @param codeChallenge       PKCE challenge, or null when the client sent none
 * @param codeChallengeMethod PKCE method; meaningful only with a challenge
 * @param subject             approving resource owner
 * @param createdAt           issue time
 * @param expiresAt           the code may not be redeemed at or after this instant
 */
public record AuthorizationCodeData(
    String clientId,
    String redirectUri,
    Set<String> scopes,
    String codeChallenge,
    CodeChallengeMethod codeChallengeMethod,
    String subject,
    Instant createdAt,
    Instant expiresAt) {

  public AuthorizationCodeData {
    scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
  }

  /**
   * Whether the code has expired at the given instant.
   *
   * @param now the current time
   * @return true once {@code now >= expiresAt}
   */
  public boolean isExpiredAt(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
