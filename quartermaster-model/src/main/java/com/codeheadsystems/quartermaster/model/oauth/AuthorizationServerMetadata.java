package com.codeheadsystems.quartermaster.model.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OAuth 2.1 authorization server metadata document (RFC 8414 §2), served from
 * {@code GET /.well-known/oauth-authorization-server}.
 *
 * @param issuer                            the issuer identifier (base URL)
 * @param authorizationEndpoint             URL of {@code /authorize}
 * @param tokenEndpoint                     URL of {@code /token}
 * @param registrationEndpoint              URL of {@code /register}
 * @param scopesSupported                   scopes a client may request
 * @param responseTypesSupported            always {@code ["code"]}
 * @param responseModesSupported            always {@code ["query"]}
 * @param grantTypesSupported               always {@code ["authorization_code"]}
 * @param tokenEndpointAuthMethodsSupported always {@code ["none"]}; clients are public
 * @param codeChallengeMethodsSupported     {@code ["S256", "plain"]}
 */
public record AuthorizationServerMetadata(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("registration_endpoint") String registrationEndpoint,
    @JsonProperty("scopes_supported") List<String> scopesSupported,
    @JsonProperty("response_types_supported") List<String> responseTypesSupported,
    @JsonProperty("response_modes_supported") List<String> responseModesSupported,
    @JsonProperty("grant_types_supported") List<String> grantTypesSupported,
    @JsonProperty("token_endpoint_auth_methods_supported") List<String> tokenEndpointAuthMethodsSupported,
    @JsonProperty("code_challenge_methods_supported") List<String> codeChallengeMethodsSupported) {
}
