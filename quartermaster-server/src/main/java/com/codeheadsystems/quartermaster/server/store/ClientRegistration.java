package com.codeheadsystems.quartermaster.server.store;

import java.time.Instant;
import java.util.List;

/**
 * A dynamically registered OAuth client.
 *
 * @param clientId     server-assigned id
 * @param clientName   display name, nullable
 * @param redirectUris allowed redirect URIs, compared exactly
 * @param createdAt    registration time
 */
public record ClientRegistration(
    String clientId,
    String clientName,
    List<String> redirectUris,
    Instant createdAt) {

  public ClientRegistration {
    redirectUris = List.copyOf(redirectUris);
  }

  public boolean allowsRedirectUri(String redirectUri) {
    return redirectUris.contains(redirectUri);
  }
}
