package com.codeheadsystems.quartermaster.server.tool.inventory;

import java.util.List;
import java.util.Optional;

/**
 * The inventory data store the tools read from.
 */
public interface InventoryStore {

  /**
   * Case-insensitive substring search over name, category and location, ordered by name.
   *
   * @param query the search text
   * @param limit maximum results
   * @return matching items
   */
  List<InventoryItem> search(String query, int limit);

  Optional<InventoryItem> find(long id);

  /**
   * Whether the store can currently serve requests.
   *
   * @return liveness
   */
  boolean isAlive();
}
