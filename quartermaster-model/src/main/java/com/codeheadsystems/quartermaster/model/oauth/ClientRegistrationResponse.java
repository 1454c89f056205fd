package com.codeheadsystems.quartermaster.model.oauth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for a dynamic client registration response (RFC 7591 §3.2.1).
 * Registered clients are public clients: {@code token_endpoint_auth_method} is always {@code none}.
 *
 * @param clientId                the newly assigned client identifier
 * @param clientName              echo of the requested client name, omitted when absent
 * @param tokenEndpointAuthMethod always {@code none}
 * @param redirectUris            the registered redirect URIs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientRegistrationResponse(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_name") String clientName,
    @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
    @JsonProperty("redirect_uris") List<String> redirectUris) {
}
