package com.codeheadsystems.quartermaster.model.mcp;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result payload of {@code tools/list}.
 *
 * @param tools the full tool catalog
 */
public record ListToolsResult(
    @JsonProperty("tools") List<ToolDescriptor> tools) {
}
