package com.codeheadsystems.quartermaster.server.auth;

import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolver that accepts every request as a fixed synthetic identity.
 * <p>
 * Local debugging only. It is chosen once at startup in place of {@link BearerAuthenticator}
 * and never toggled per request, so a bypassed request cannot affect the auth decision of a
 * concurrent one.
 */
public class DebugBypassAuthenticator implements AuthContextResolver {

  private static final Logger log = LoggerFactory.getLogger(DebugBypassAuthenticator.class);

  /**
   * Client id reported for bypassed requests.
   */
  public static final String BYPASS_CLIENT_ID = "auth-bypass";

  private final AuthContext context;

  public DebugBypassAuthenticator(String subject, Set<String> scopes) {
    this.context = new AuthContext(subject, BYPASS_CLIENT_ID, scopes);
    log.warn("""
        #################################################################
        # WARNING: Bearer authentication is BYPASSED.                   #
        # Every request runs as '{}'.
        # Do not enable authBypassEnabled outside local debugging.      #
        #################################################################
        """, subject);
  }

  @Override
  public AuthContext resolve(String authorizationHeader) {
    log.warn("Authentication bypassed, request runs as subject={}", context.subject());
    return context;
  }
}
