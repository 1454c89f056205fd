package com.codeheadsystems.quartermaster.server.resource;

import com.codeheadsystems.quartermaster.server.tool.inventory.InventoryStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public liveness of the inventory store. Unauthenticated.
 */
@Singleton
@Path("/health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

  private final InventoryStore inventoryStore;
  private final Clock clock;

  @Inject
  public HealthResource(InventoryStore inventoryStore) {
    this(inventoryStore, Clock.systemUTC());
  }

  public HealthResource(InventoryStore inventoryStore, Clock clock) {
    this.inventoryStore = inventoryStore;
    this.clock = clock;
  }

  @GET
  public Response health() {
    boolean alive = inventoryStore.isAlive();
    Map<String, String> body = new LinkedHashMap<>();
    body.put("status", alive ? "healthy" : "unhealthy");
    body.put("store", alive ? "connected" : "unavailable");
    body.put("timestamp", clock.instant().toString());
    return Response.status(alive ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
        .entity(body)
        .build();
  }
}
