package com.codeheadsystems.quartermaster.server.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Grant metadata behind an access token.
 *
 * @param subject   resource owner
 * @param clientId  client the token was issued to
 * @param scopes    granted scopes
 * @param createdAt issue time
 * @param expiresAt the token is valid strictly before this instant
 */
public record AccessTokenData(
    String subject,
    String clientId,
    Set<String> scopes,
    Instant createdAt,
    Instant expiresAt) {

  public AccessTokenData {
    scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
  }

  public boolean isValidAt(Instant now) {
    return now.isBefore(expiresAt);
  }
}
