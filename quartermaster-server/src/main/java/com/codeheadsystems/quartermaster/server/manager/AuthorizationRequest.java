package com.codeheadsystems.quartermaster.server.manager;

/**
 * Query parameters of {@code GET /authorize}, unvalidated.
 *
 * @param clientId            {@code client_id}
 * @param redirectUri         {@code redirect_uri}
 * @param responseType        {@code response_type}; only {@code code} is supported
 * @param state               opaque client state echoed on the redirect
 * @param codeChallenge       PKCE challenge
 * @param codeChallengeMethod PKCE method; {@code S256} when absent
 * @param scope               space-separated scopes
 */
public record AuthorizationRequest(
    String clientId,
    String redirectUri,
    String responseType,
    String state,
    String codeChallenge,
    String codeChallengeMethod,
    String scope) {
}
