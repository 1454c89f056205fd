package com.codeheadsystems.quartermaster.server.resource;

import com.codeheadsystems.quartermaster.model.oauth.AuthorizationServerMetadata;
import com.codeheadsystems.quartermaster.model.oauth.ProtectedResourceMetadata;
import com.codeheadsystems.quartermaster.server.manager.DiscoveryManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

/**
 * OAuth discovery documents (RFC 8414 and RFC 9728).
 */
@Singleton
@Path("/.well-known")
@Produces(MediaType.APPLICATION_JSON)
public class DiscoveryResource {

  private final DiscoveryManager discoveryManager;

  @Inject
  public DiscoveryResource(DiscoveryManager discoveryManager) {
    this.discoveryManager = discoveryManager;
  }

  @GET
  @Path("oauth-authorization-server")
  public AuthorizationServerMetadata authorizationServer(@Context UriInfo uriInfo) {
    return discoveryManager.authorizationServerMetadata(
        discoveryManager.resolveIssuer(uriInfo.getBaseUri()));
  }

  @GET
  @Path("oauth-protected-resource")
  public ProtectedResourceMetadata protectedResource(@Context UriInfo uriInfo) {
    return discoveryManager.protectedResourceMetadata(
        discoveryManager.resolveIssuer(uriInfo.getBaseUri()));
  }
}
