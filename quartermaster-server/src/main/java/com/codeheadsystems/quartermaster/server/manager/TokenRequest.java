package com.codeheadsystems.quartermaster.server.manager;

/**
 * Form parameters of {@code POST /token}, unvalidated.
 *
 * @param grantType    {@code grant_type}
 * @param code         {@code code}
 * @param redirectUri  {@code redirect_uri}
 * @param clientId     {@code client_id}
 * @param codeVerifier {@code code_verifier}
 */
public record TokenRequest(
    String grantType,
    String code,
    String redirectUri,
    String clientId,
    String codeVerifier) {
}
