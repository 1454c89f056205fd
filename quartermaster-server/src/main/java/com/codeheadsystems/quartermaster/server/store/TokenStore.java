package com.codeheadsystems.quartermaster.server.store;

import com.codeheadsystems.quartermaster.server.auth.UnauthenticatedException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for opaque bearer access tokens.
 * <p>
 * Implementations must be thread-safe. A token is valid iff it is present and the current time
 * is before its expiry; an expired token must never be returned, even if not yet purged.
 */
public interface TokenStore {

  /**
   * Issues a token.
   *
   * @param subject  resource owner
   * @param clientId client
   * @param scopes   granted scopes
   * @param ttl      lifetime
   * @return the opaque token
   */
  String issue(String subject, String clientId, Set<String> scopes, Duration ttl);

  /**
   * Looks up a token, returning empty if unknown or expired. Expired tokens are evicted.
   *
   * @param token the token
   * @return the grant metadata, or empty
   */
  Optional<AccessTokenData> find(String token);

  /**
   * Looks up a token, failing if unknown or expired.
   *
   * @param token the token
   * @return the grant metadata
   * @throws UnauthenticatedException if the token is not valid
   */
  default AccessTokenData validate(String token) {
    return find(token).orElseThrow(() -> new UnauthenticatedException("Invalid or expired token"));
  }

  /**
   * Deletes a token. Unknown tokens are ignored.
   *
   * @param token the token
   */
  void revoke(String token);

  /**
   * Removes every expired token.
   *
   * @return number of tokens removed
   */
  int purgeExpired();
}
