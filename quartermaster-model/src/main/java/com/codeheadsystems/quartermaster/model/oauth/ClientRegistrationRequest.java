package com.codeheadsystems.quartermaster.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for a dynamic client registration request (RFC 7591 §2).
 * Unknown metadata fields are ignored.
 *
 * @param clientName   human-readable client name, optional
 * @param redirectUris redirect URIs the client will use at the authorization endpoint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientRegistrationRequest(
    @JsonProperty("client_name") String clientName,
    @JsonProperty("redirect_uris") List<String> redirectUris) {
}
