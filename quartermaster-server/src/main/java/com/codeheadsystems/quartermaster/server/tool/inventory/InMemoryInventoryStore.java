package com.codeheadsystems.quartermaster.server.tool.inventory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link InventoryStore} for development and tests.
 */
public class InMemoryInventoryStore implements InventoryStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryInventoryStore.class);

  private final ConcurrentHashMap<Long, InventoryItem> items = new ConcurrentHashMap<>();

  public InMemoryInventoryStore() {
    log.warn("InMemoryInventoryStore: inventory will NOT survive restarts");
  }

  /**
   * A store pre-loaded with a few pantry items.
   *
   * @return the store
   */
  public static InMemoryInventoryStore seeded() {
    InMemoryInventoryStore store = new InMemoryInventoryStore();
    store.put(new InventoryItem(1, "Milk", new BigDecimal("2"), "l", "dairy", "fridge",
        LocalDate.now().plusDays(5)));
    store.put(new InventoryItem(2, "Parmesan", new BigDecimal("0.5"), "kg", "dairy", "fridge",
        LocalDate.now().plusDays(60)));
    store.put(new InventoryItem(3, "Spaghetti", new BigDecimal("3"), "pack", "pasta", "pantry",
        null));
    store.put(new InventoryItem(4, "Tomato passata", new BigDecimal("4"), "jar", "preserves",
        "pantry", LocalDate.now().plusDays(300)));
    store.put(new InventoryItem(5, "Peas", new BigDecimal("1"), "kg", "vegetables", "freezer",
        LocalDate.now().plusDays(180)));
    return store;
  }

  public void put(InventoryItem item) {
    items.put(item.id(), item);
  }

  @Override
  public List<InventoryItem> search(String query, int limit) {
    String needle = query.toLowerCase(Locale.ROOT);
    return items.values().stream()
        .filter(item -> contains(item.name(), needle)
            || contains(item.category(), needle)
            || contains(item.location(), needle))
        .sorted(Comparator.comparing(InventoryItem::name))
        .limit(limit)
        .toList();
  }

  @Override
  public Optional<InventoryItem> find(long id) {
    return Optional.ofNullable(items.get(id));
  }

  @Override
  public boolean isAlive() {
    return true;
  }

  private static boolean contains(String field, String needle) {
    return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
  }
}
