package com.codeheadsystems.quartermaster.server.resource;

import com.codeheadsystems.quartermaster.model.oauth.OAuthErrorResponse;
import com.codeheadsystems.quartermaster.server.auth.AuthContext;
import com.codeheadsystems.quartermaster.server.auth.AuthContextResolver;
import com.codeheadsystems.quartermaster.server.auth.UnauthenticatedException;
import com.codeheadsystems.quartermaster.server.manager.DiscoveryManager;
import com.codeheadsystems.quartermaster.server.manager.McpSessionManager;
import com.codeheadsystems.quartermaster.server.manager.SessionOwnershipException;
import com.codeheadsystems.quartermaster.server.mcp.DispatchResult;
import com.codeheadsystems.quartermaster.server.mcp.JsonRpcDispatcher;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The MCP streamable-HTTP endpoint.
 * <p>
 * {@code POST /mcp} carries one JSON-RPC message and is handled by {@link JsonRpcDispatcher}.
 * {@code DELETE /mcp} terminates the session named in {@code Mcp-Session-Id}.
 */
@Singleton
@Path("/mcp")
public class McpResource {

  private static final Logger log = LoggerFactory.getLogger(McpResource.class);

  public static final String SESSION_HEADER = "Mcp-Session-Id";

  private final JsonRpcDispatcher dispatcher;
  private final AuthContextResolver authContextResolver;
  private final McpSessionManager sessionManager;
  private final DiscoveryManager discoveryManager;

  @Inject
  public McpResource(JsonRpcDispatcher dispatcher,
                     AuthContextResolver authContextResolver,
                     McpSessionManager sessionManager,
                     DiscoveryManager discoveryManager) {
    this.dispatcher = dispatcher;
    this.authContextResolver = authContextResolver;
    this.sessionManager = sessionManager;
    this.discoveryManager = discoveryManager;
  }

  @POST
  @Produces(MediaType.APPLICATION_JSON)
  public Response post(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                       @HeaderParam(SESSION_HEADER) String sessionId,
                       @Context UriInfo uriInfo,
                       String body) {
    DispatchResult result = dispatcher.dispatch(authorization, sessionId, body);
    Response.ResponseBuilder builder = Response.status(result.status());
    if (result.sessionId() != null) {
      builder.header(SESSION_HEADER, result.sessionId());
    }
    if (result.unauthenticated()) {
      builder.header(HttpHeaders.WWW_AUTHENTICATE, challenge(uriInfo));
    }
    if (result.body() != null) {
      builder.type(MediaType.APPLICATION_JSON_TYPE).entity(result.body());
    }
    return builder.build();
  }

  @DELETE
  @Produces(MediaType.APPLICATION_JSON)
  public Response delete(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                         @HeaderParam(SESSION_HEADER) String sessionId,
                         @Context UriInfo uriInfo) {
    AuthContext context;
    try {
      context = authContextResolver.resolve(authorization);
    } catch (UnauthenticatedException e) {
      return Response.status(Response.Status.UNAUTHORIZED)
          .header(HttpHeaders.WWW_AUTHENTICATE, challenge(uriInfo))
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(new OAuthErrorResponse("invalid_token", e.getMessage()))
          .build();
    }
    if (sessionId == null || sessionId.isBlank()) {
      return Response.status(Response.Status.BAD_REQUEST)
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(Map.of("error", SESSION_HEADER + " header is required"))
          .build();
    }
    try {
      sessionManager.terminate(sessionId, context);
    } catch (SessionOwnershipException e) {
      return Response.status(Response.Status.FORBIDDEN)
          .type(MediaType.APPLICATION_JSON_TYPE)
          .entity(Map.of("error", e.getMessage()))
          .build();
    }
    log.debug("DELETE /mcp session id={} by subject={}", sessionId, context.subject());
    return Response.noContent().build();
  }

  private String challenge(UriInfo uriInfo) {
    return discoveryManager.challenge(discoveryManager.resolveIssuer(uriInfo.getBaseUri()));
  }
}
