package com.codeheadsystems.quartermaster.server.auth;

import java.util.Set;

/**
 * What the resource owner is asked to approve at the authorization endpoint.
 *
 * @param clientId    requesting client
 * @param redirectUri where the result will be delivered
 * @param scopes      requested scopes
 */
public record ConsentRequest(String clientId, String redirectUri, Set<String> scopes) {
}
