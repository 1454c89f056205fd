package com.codeheadsystems.quartermaster.server.store;

import com.codeheadsystems.quartermaster.server.auth.SecureTokenGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link TokenStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired tokens are lazily evicted on {@link #find}. All tokens are lost on server restart.
 * Suitable for development and integration testing only.
 */
public class InMemoryTokenStore implements TokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTokenStore.class);

  private final ConcurrentHashMap<String, AccessTokenData> tokens = new ConcurrentHashMap<>();
  private final Clock clock;
  private final SecureTokenGenerator generator;

  public InMemoryTokenStore() {
    this(Clock.systemUTC(), new SecureTokenGenerator());
  }

  public InMemoryTokenStore(Clock clock, SecureTokenGenerator generator) {
    this.clock = clock;
    this.generator = generator;
    log.warn("InMemoryTokenStore: access tokens will NOT survive restarts");
  }

  @Override
  public String issue(String subject, String clientId, Set<String> scopes, Duration ttl) {
    Instant now = clock.instant();
    String token = generator.generate();
    tokens.put(token, new AccessTokenData(subject, clientId, scopes, now, now.plus(ttl)));
    log.debug("Issued access token for subject={} client_id={}", subject, clientId);
    return token;
  }

  @Override
  public Optional<AccessTokenData> find(String token) {
    if (token == null) {
      return Optional.empty();
    }
    AccessTokenData data = tokens.get(token);
    if (data == null) {
      return Optional.empty();
    }
    if (!data.isValidAt(clock.instant())) {
      tokens.remove(token, data);
      log.debug("Evicted expired access token for subject={}", data.subject());
      return Optional.empty();
    }
    return Optional.of(data);
  }

  @Override
  public void revoke(String token) {
    if (token != null && tokens.remove(token) != null) {
      log.debug("Revoked access token");
    }
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, AccessTokenData> entry : tokens.entrySet()) {
      if (!entry.getValue().isValidAt(now) && tokens.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Purged {} expired access token(s)", removed);
    }
    return removed;
  }
}
