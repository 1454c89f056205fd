package com.codeheadsystems.quartermaster.dropwizard.auth;

import java.security.Principal;
import java.util.Set;

/**
 * Principal representing the resource owner behind a bearer access token.
 *
 * @param subject  resource owner
 * @param clientId OAuth client that obtained the token
 * @param scopes   granted scopes
 */
public record QuartermasterPrincipal(String subject, String clientId, Set<String> scopes)
    implements Principal {

  @Override
  public String getName() {
    return subject;
  }
}
