package com.codeheadsystems.quartermaster.model.oauth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for an OAuth error body (RFC 6749 §5.2).
 * <p>
 * The {@code error} value is one of the canonical OAuth error codes and must be preserved
 * verbatim; clients branch on it.
 *
 * @param error            canonical error code, e.g. {@code invalid_grant}
 * @param errorDescription human-readable explanation, omitted when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription) {
}
