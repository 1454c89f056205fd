package com.codeheadsystems.quartermaster.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.quartermaster.server.tool.inventory.InventoryStore;

/**
 * Reports whether the inventory store behind the MCP tools is reachable.
 */
public class InventoryStoreHealthCheck extends HealthCheck {

  private final InventoryStore inventoryStore;

  public InventoryStoreHealthCheck(InventoryStore inventoryStore) {
    this.inventoryStore = inventoryStore;
  }

  @Override
  protected Result check() {
    if (!inventoryStore.isAlive()) {
      return Result.unhealthy("Inventory store is not reachable");
    }
    return Result.healthy("store=%s", inventoryStore.getClass().getSimpleName());
  }
}
