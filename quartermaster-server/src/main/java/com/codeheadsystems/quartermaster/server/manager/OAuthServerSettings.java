package com.codeheadsystems.quartermaster.server.manager;

import java.time.Duration;
import java.util.List;

/**
 * Tunables of the authorization server.
 *
 * @param accessTokenTtl  lifetime of issued access tokens
 * @param defaultScope    scope granted when {@code /authorize} names none
 * @param scopesSupported scopes advertised in discovery documents
 */
public record OAuthServerSettings(
    Duration accessTokenTtl,
    String defaultScope,
    List<String> scopesSupported) {

  /**
   * 30 days.
   */
  public static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofDays(30);

  public static final String DEFAULT_SCOPE = "inventory";

  public OAuthServerSettings {
    scopesSupported = List.copyOf(scopesSupported);
  }

  public static OAuthServerSettings defaults() {
    return new OAuthServerSettings(DEFAULT_ACCESS_TOKEN_TTL, DEFAULT_SCOPE,
        List.of("inventory", "search", "fetch"));
  }
}
