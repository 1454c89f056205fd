package com.codeheadsystems.quartermaster.testserver;

import com.codeheadsystems.quartermaster.dropwizard.auth.QuartermasterPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Bearer-protected endpoint that returns who a token was issued to.
 * Use it to check a client end to end: register, authorize, exchange the code, then call
 * GET /api/whoami with the access token.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  /**
   * Returns the subject, client and scopes of the authenticated token.
   *
   * @param principal the principal injected by the Dropwizard auth filter
   * @return a map containing {@code subject}, {@code clientId} and {@code scope}
   */
  @GET
  public Map<String, String> whoAmI(@Auth QuartermasterPrincipal principal) {
    return Map.of(
        "subject", principal.subject(),
        "clientId", principal.clientId(),
        "scope", String.join(" ", principal.scopes()));
  }
}
