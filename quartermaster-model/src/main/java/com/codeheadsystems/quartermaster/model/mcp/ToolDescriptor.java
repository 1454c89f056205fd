package com.codeheadsystems.quartermaster.model.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Catalog entry for a tool as returned by {@code tools/list}.
 *
 * @param name        unique tool name, used in {@code tools/call}
 * @param title       short display title, omitted when null
 * @param description what the tool does, written for the model
 * @param inputSchema JSON schema of the {@code arguments} object
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("inputSchema") JsonNode inputSchema) {
}
