package com.codeheadsystems.quartermaster.model.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful {@code POST /token} response (OAuth 2.1 §3.2.3).
 * <p>
 * Field names are the canonical snake_case OAuth names so that off-the-shelf clients can
 * parse the response without configuration.
 *
 * @param accessToken opaque bearer credential to present in {@code Authorization: Bearer}
 * @param tokenType   always {@code bearer}
 * @param expiresIn   lifetime of the access token in seconds
 * @param scope       space-delimited list of granted scopes
 */
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("scope") String scope) {

  /**
   * Token type returned for every issued token.
   */
  public static final String BEARER = "bearer";

  /**
   * Creates a bearer token response.
   *
   * @param accessToken the access token
   * @param expiresIn   lifetime in seconds
   * @param scope       space-delimited granted scopes
   * @return the response
   */
  public static TokenResponse bearer(String accessToken, long expiresIn, String scope) {
    return new TokenResponse(accessToken, BEARER, expiresIn, scope);
  }
}
