package com.codeheadsystems.quartermaster.server.auth;

import com.codeheadsystems.quartermaster.server.store.AccessTokenData;
import com.codeheadsystems.quartermaster.server.store.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates {@code Authorization: Bearer <token>} headers against the {@link TokenStore}.
 */
public class BearerAuthenticator implements AuthContextResolver {

  private static final Logger log = LoggerFactory.getLogger(BearerAuthenticator.class);
  private static final String PREFIX = "Bearer ";

  private final TokenStore tokenStore;

  public BearerAuthenticator(TokenStore tokenStore) {
    this.tokenStore = tokenStore;
  }

  @Override
  public AuthContext resolve(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      throw new UnauthenticatedException("Missing Authorization header");
    }
    if (!authorizationHeader.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      log.debug("Rejected non-bearer Authorization header");
      throw new UnauthenticatedException("Authorization scheme must be Bearer");
    }
    String token = authorizationHeader.substring(PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw new UnauthenticatedException("Empty bearer token");
    }
    AccessTokenData data = tokenStore.validate(token);
    return new AuthContext(data.subject(), data.clientId(), data.scopes());
  }
}
