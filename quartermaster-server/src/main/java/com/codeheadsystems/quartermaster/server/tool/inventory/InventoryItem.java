package com.codeheadsystems.quartermaster.server.tool.inventory;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A stocked item.
 *
 * @param id        numeric id
 * @param name      item name
 * @param quantity  amount on hand
 * @param unit      unit of measure, e.g. {@code kg}
 * @param category  category, e.g. {@code dairy}
 * @param location  storage location, e.g. {@code fridge}
 * @param expiresOn best-before date, nullable
 */
public record InventoryItem(
    long id,
    String name,
    BigDecimal quantity,
    String unit,
    String category,
    String location,
    LocalDate expiresOn) {
}
