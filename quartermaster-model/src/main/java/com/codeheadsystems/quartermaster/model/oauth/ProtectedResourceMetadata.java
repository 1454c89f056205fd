package com.codeheadsystems.quartermaster.model.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Protected resource metadata document served from
 * {@code GET /.well-known/oauth-protected-resource}.
 * <p>
 * Clients that receive a 401 from {@code /mcp} follow the {@code resource_metadata} hint in the
 * {@code WWW-Authenticate} header to this document, and from here to the authorization server.
 *
 * @param resource               the protected resource identifier (the MCP endpoint URL)
 * @param authorizationServers   authorization servers able to issue tokens for this resource
 * @param bearerMethodsSupported always {@code ["header"]}
 * @param scopesSupported        scopes understood by the resource
 */
public record ProtectedResourceMetadata(
    @JsonProperty("resource") String resource,
    @JsonProperty("authorization_servers") List<AuthorizationServerReference> authorizationServers,
    @JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported,
    @JsonProperty("scopes_supported") List<String> scopesSupported) {

  /**
   * Pointer to an authorization server.
   *
   * @param issuer                the issuer identifier
   * @param authorizationEndpoint the authorization endpoint URL
   */
  public record AuthorizationServerReference(
      @JsonProperty("issuer") String issuer,
      @JsonProperty("authorization_endpoint") String authorizationEndpoint) {
  }
}
