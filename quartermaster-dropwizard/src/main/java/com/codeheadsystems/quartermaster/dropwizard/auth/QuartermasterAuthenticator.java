package com.codeheadsystems.quartermaster.dropwizard.auth;

import com.codeheadsystems.quartermaster.server.store.TokenStore;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates opaque bearer tokens against the
 * {@link TokenStore}, for application routes annotated with {@code @Auth}.
 */
public class QuartermasterAuthenticator implements Authenticator<String, QuartermasterPrincipal> {

  private final TokenStore tokenStore;

  public QuartermasterAuthenticator(TokenStore tokenStore) {
    this.tokenStore = tokenStore;
  }

  @Override
  public Optional<QuartermasterPrincipal> authenticate(String token) throws AuthenticationException {
    return tokenStore.find(token)
        .map(data -> new QuartermasterPrincipal(data.subject(), data.clientId(), data.scopes()));
  }
}
