package com.codeheadsystems.quartermaster.server.tool.inventory;

import com.codeheadsystems.quartermaster.model.mcp.ContentBlock;
import com.codeheadsystems.quartermaster.model.mcp.ToolDescriptor;
import com.codeheadsystems.quartermaster.server.auth.AuthContext;
import com.codeheadsystems.quartermaster.server.tool.RegisteredTool;
import com.codeheadsystems.quartermaster.server.tool.ToolExecutionException;
import com.codeheadsystems.quartermaster.server.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code search} and {@code fetch} tools over an {@link InventoryStore}.
 * <p>
 * Both return a single text block holding a JSON document, the shape expected by connectors
 * that only understand search and fetch: {@code search} yields {@code {"results":[{id,title,url}]}}
 * and {@code fetch} yields {@code {id,title,text,url,metadata}}. Item ids on the wire look like
 * {@code item-42}.
 */
public class InventoryTools {

  private static final Logger log = LoggerFactory.getLogger(InventoryTools.class);

  public static final String SEARCH = "search";
  public static final String FETCH = "fetch";
  public static final String ID_PREFIX = "item-";
  public static final int SEARCH_LIMIT = 10;

  private final InventoryStore store;
  private final ObjectMapper objectMapper;
  private final String baseUrl;

  /**
   * @param store        the inventory
   * @param objectMapper used to render result documents and schemas
   * @param baseUrl      prefix for item URLs; blank yields relative URLs
   */
  public InventoryTools(InventoryStore store, ObjectMapper objectMapper, String baseUrl) {
    this.store = store;
    this.objectMapper = objectMapper;
    this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
  }

  /**
   * Registers both tools.
   *
   * @param registry the target registry
   */
  public void registerWith(ToolRegistry registry) {
    registry.register(new RegisteredTool(searchDescriptor(), this::search));
    registry.register(new RegisteredTool(fetchDescriptor(), this::fetch));
  }

  List<ContentBlock> search(JsonNode arguments, AuthContext context) throws ToolExecutionException {
    String query = arguments.path("query").asText("").trim();
    log.debug("search(subject={}, query={})", context.subject(), query);
    List<SearchHit> hits = query.isEmpty() ? List.of()
        : store.search(query, SEARCH_LIMIT).stream()
            .map(item -> new SearchHit(ID_PREFIX + item.id(),
                item.name() + " (" + item.quantity().toPlainString() + " " + item.unit() + ")",
                itemUrl(item)))
            .toList();
    return List.of(ContentBlock.text(toJson(Map.of("results", hits))));
  }

  List<ContentBlock> fetch(JsonNode arguments, AuthContext context) throws ToolExecutionException {
    String id = arguments.path("id").asText("");
    log.debug("fetch(subject={}, id={})", context.subject(), id);
    if (!id.startsWith(ID_PREFIX)) {
      throw new ToolExecutionException("Invalid ID format: expected '" + ID_PREFIX + "<number>'");
    }
    long numericId;
    try {
      numericId = Long.parseLong(id.substring(ID_PREFIX.length()));
    } catch (NumberFormatException e) {
      throw new ToolExecutionException("Invalid ID format: expected '" + ID_PREFIX + "<number>'", e);
    }
    InventoryItem item = store.find(numericId)
        .orElseThrow(() -> new ToolExecutionException("Item not found: " + id));

    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("type", "item");
    metadata.put("category", item.category());
    metadata.put("location", item.location());
    Document document = new Document(id, "Item: " + item.name(), describe(item), itemUrl(item),
        metadata);
    return List.of(ContentBlock.text(toJson(document)));
  }

  private String describe(InventoryItem item) {
    return "ITEM: " + item.name() + "\n\n"
        + "Details:\n"
        + "- Quantity: " + item.quantity().toPlainString() + " " + item.unit() + "\n"
        + "- Category: " + item.category() + "\n"
        + "- Location: " + item.location() + "\n"
        + "- Expires: " + (item.expiresOn() == null ? "not specified" : item.expiresOn()) + "\n";
  }

  private String itemUrl(InventoryItem item) {
    return baseUrl + "/api/items/" + item.id();
  }

  private String toJson(Object value) throws ToolExecutionException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new ToolExecutionException("Could not render result", e);
    }
  }

  private ToolDescriptor searchDescriptor() {
    return new ToolDescriptor(SEARCH, "Search inventory",
        "Search stocked items by name, category or storage location",
        singleStringSchema("query", "Search text matched against item names, categories and locations"));
  }

  private ToolDescriptor fetchDescriptor() {
    return new ToolDescriptor(FETCH, "Fetch item",
        "Retrieve the complete record of one item by id",
        singleStringSchema("id", "Item identifier in the form 'item-<number>'"));
  }

  private JsonNode singleStringSchema(String property, String description) {
    ObjectNode schema = objectMapper.createObjectNode();
    schema.put("type", "object");
    ObjectNode prop = schema.putObject("properties").putObject(property);
    prop.put("type", "string");
    prop.put("description", description);
    schema.putArray("required").add(property);
    return schema;
  }

  record SearchHit(String id, String title, String url) {
  }

  record Document(String id, String title, String text, String url,
      Map<String, String> metadata) {
  }
}
