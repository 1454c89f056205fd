package com.codeheadsystems.quartermaster.server.auth;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The identity attached to an authenticated request.
 *
 * @param subject  the resource owner the token was issued to
 * @param clientId the OAuth client that obtained the token
 * @param scopes   granted scopes
 */
public record AuthContext(String subject, String clientId, Set<String> scopes) {

  public AuthContext {
    scopes = scopes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
  }
}
