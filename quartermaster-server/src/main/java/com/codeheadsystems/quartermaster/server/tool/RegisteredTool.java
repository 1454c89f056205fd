package com.codeheadsystems.quartermaster.server.tool;

import com.codeheadsystems.quartermaster.model.mcp.ToolDescriptor;

/**
 * A catalog entry paired with its handler.
 *
 * @param descriptor what {@code tools/list} reports
 * @param handler    what {@code tools/call} runs
 */
public record RegisteredTool(ToolDescriptor descriptor, ToolHandler handler) {

  public String name() {
    return descriptor.name();
  }
}
