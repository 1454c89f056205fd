package com.codeheadsystems.quartermaster.server.resource;

import com.codeheadsystems.quartermaster.model.oauth.ClientRegistrationRequest;
import com.codeheadsystems.quartermaster.model.oauth.ClientRegistrationResponse;
import com.codeheadsystems.quartermaster.model.oauth.OAuthErrorResponse;
import com.codeheadsystems.quartermaster.model.oauth.TokenResponse;
import com.codeheadsystems.quartermaster.server.auth.OAuthError;
import com.codeheadsystems.quartermaster.server.auth.OAuthException;
import com.codeheadsystems.quartermaster.server.manager.AuthorizationRequest;
import com.codeheadsystems.quartermaster.server.manager.OAuthServerManager;
import com.codeheadsystems.quartermaster.server.manager.TokenRequest;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS adapter for the OAuth 2.1 endpoints.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /authorize}  : consent, then 302 to the client's redirect URI</li>
 *   <li>{@code POST /token}     : form-encoded code exchange</li>
 *   <li>{@code POST /register}  : dynamic client registration</li>
 * </ul>
 * Errors are returned as {@code {error, error_description}} JSON. An invalid authorization
 * request is answered directly with 400 and is never redirected.
 */
@Singleton
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class OAuthResource {

  private static final Logger log = LoggerFactory.getLogger(OAuthResource.class);

  private final OAuthServerManager manager;

  @Inject
  public OAuthResource(OAuthServerManager manager) {
    this.manager = manager;
    log.info("OAuthResource({})", manager);
  }

  @GET
  @Path("authorize")
  public Response authorize(@QueryParam("client_id") String clientId,
                            @QueryParam("redirect_uri") String redirectUri,
                            @QueryParam("response_type") String responseType,
                            @QueryParam("state") String state,
                            @QueryParam("code_challenge") String codeChallenge,
                            @QueryParam("code_challenge_method") String codeChallengeMethod,
                            @QueryParam("scope") String scope) {
    try {
      URI location = manager.authorize(new AuthorizationRequest(clientId, redirectUri, responseType,
          state, codeChallenge, codeChallengeMethod, scope));
      return Response.status(Response.Status.FOUND).location(location).build();
    } catch (OAuthException e) {
      return error(e);
    } catch (IllegalStateException e) {
      return unavailable(e);
    }
  }

  @POST
  @Path("token")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  public Response token(@FormParam("grant_type") String grantType,
                        @FormParam("code") String code,
                        @FormParam("redirect_uri") String redirectUri,
                        @FormParam("client_id") String clientId,
                        @FormParam("code_verifier") String codeVerifier) {
    try {
      TokenResponse response = manager.exchange(
          new TokenRequest(grantType, code, redirectUri, clientId, codeVerifier));
      return Response.ok(response)
          .header("Cache-Control", "no-store")
          .header("Pragma", "no-cache")
          .build();
    } catch (OAuthException e) {
      return error(e);
    }
  }

  @POST
  @Path("register")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response register(ClientRegistrationRequest request) {
    try {
      ClientRegistrationResponse response = manager.register(request);
      return Response.status(Response.Status.CREATED).entity(response).build();
    } catch (OAuthException e) {
      return error(e);
    }
  }

  private static Response error(OAuthException e) {
    log.debug("OAuth request rejected: {} ({})", e.error().code(), e.description());
    return Response.status(Response.Status.BAD_REQUEST)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new OAuthErrorResponse(e.error().code(), e.description()))
        .build();
  }

  private static Response unavailable(IllegalStateException e) {
    log.warn("Authorization request refused: {}", e.getMessage());
    return Response.status(Response.Status.SERVICE_UNAVAILABLE)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new OAuthErrorResponse(OAuthError.TEMPORARILY_UNAVAILABLE.code(), e.getMessage()))
        .build();
  }
}
