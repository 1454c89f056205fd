package com.codeheadsystems.quartermaster.server.store;

import com.codeheadsystems.quartermaster.server.auth.CodeChallengeMethod;
import com.codeheadsystems.quartermaster.server.auth.ExpiredGrantException;
import com.codeheadsystems.quartermaster.server.auth.OAuthError;
import com.codeheadsystems.quartermaster.server.auth.OAuthException;
import com.codeheadsystems.quartermaster.server.auth.PkceVerifier;
import com.codeheadsystems.quartermaster.server.auth.SecureTokenGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AuthorizationCodeStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Single use is enforced with {@link ConcurrentHashMap#remove(Object, Object)}: of two racing
 * redemptions only one removes the record, the other sees {@code invalid_grant}.
 * Expired codes are lazily evicted on {@link #redeem} and in bulk by {@link #purgeExpired()}.
 */
public class InMemoryAuthorizationCodeStore implements AuthorizationCodeStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAuthorizationCodeStore.class);

  /**
   * Default code lifetime.
   */
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

  /**
   * Default maximum of outstanding codes.
   * A client spamming /authorize without ever calling /token could otherwise cause OOM.
   */
  public static final int DEFAULT_MAX_PENDING = 10_000;

  private final ConcurrentHashMap<String, AuthorizationCodeData> codes = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration ttl;
  private final int maxPending;
  private final SecureTokenGenerator generator;
  private final PkceVerifier pkceVerifier;

  public InMemoryAuthorizationCodeStore() {
    this(Clock.systemUTC(), DEFAULT_TTL, DEFAULT_MAX_PENDING,
        new SecureTokenGenerator(), new PkceVerifier());
  }

  public InMemoryAuthorizationCodeStore(Clock clock, Duration ttl, int maxPending,
                                        SecureTokenGenerator generator, PkceVerifier pkceVerifier) {
    this.clock = clock;
    this.ttl = ttl;
    this.maxPending = maxPending;
    this.generator = generator;
    this.pkceVerifier = pkceVerifier;
    log.warn("InMemoryAuthorizationCodeStore: pending codes will NOT survive restarts");
  }

  @Override
  public String issue(String clientId, String redirectUri, Set<String> scopes,
                      String codeChallenge, CodeChallengeMethod codeChallengeMethod, String subject) {
    if (codes.size() >= maxPending) {
      throw new IllegalStateException("Too many pending authorization codes");
    }
    Instant now = clock.instant();
    CodeChallengeMethod method = codeChallenge == null ? null
        : (codeChallengeMethod == null ? CodeChallengeMethod.S256 : codeChallengeMethod);
    AuthorizationCodeData data = new AuthorizationCodeData(clientId, redirectUri, scopes,
        codeChallenge, method, subject, now, now.plus(ttl));
    String code = generator.generate();
    codes.put(code, data);
    log.debug("Issued authorization code for client_id={} subject={} pkce={}",
        clientId, subject, method);
    return code;
  }

  @Override
  public AuthorizationCodeData redeem(String code, String codeVerifier,
                                      String clientId, String redirectUri) {
    AuthorizationCodeData data = code == null ? null : codes.get(code);
    if (data == null) {
      throw new OAuthException(OAuthError.INVALID_GRANT, "Invalid authorization code");
    }
    if (data.isExpiredAt(clock.instant())) {
      codes.remove(code, data);
      log.debug("Expired authorization code presented by client_id={}", data.clientId());
      throw new ExpiredGrantException();
    }
    if (clientId != null && !clientId.equals(data.clientId())) {
      throw new OAuthException(OAuthError.INVALID_GRANT, "client_id does not match the authorization code");
    }
    if (redirectUri != null && !redirectUri.equals(data.redirectUri())) {
      throw new OAuthException(OAuthError.INVALID_GRANT, "redirect_uri does not match the authorization code");
    }
    if (data.codeChallenge() != null) {
      if (codeVerifier == null || codeVerifier.isEmpty()) {
        throw new OAuthException(OAuthError.INVALID_REQUEST, "code_verifier is required");
      }
      if (!pkceVerifier.verify(codeVerifier, data.codeChallenge(), data.codeChallengeMethod())) {
        log.debug("PKCE verification failed for client_id={}", data.clientId());
        throw new OAuthException(OAuthError.INVALID_GRANT, "PKCE verification failed");
      }
    }
    if (!codes.remove(code, data)) {
      throw new OAuthException(OAuthError.INVALID_GRANT, "Invalid authorization code");
    }
    log.debug("Redeemed authorization code for client_id={}", data.clientId());
    return data;
  }

  @Override
  public int purgeExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, AuthorizationCodeData> entry : codes.entrySet()) {
      if (entry.getValue().isExpiredAt(now) && codes.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("Purged {} expired authorization code(s)", removed);
    }
    return removed;
  }

  @Override
  public int size() {
    return codes.size();
  }
}
