package com.codeheadsystems.quartermaster.server.tool;

import com.codeheadsystems.quartermaster.model.mcp.ToolDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * Catalog of tools the MCP endpoint can dispatch to. Adding a tool is a registration.
 */
public interface ToolRegistry {

  /**
   * Adds a tool.
   *
   * @param tool the tool
   * @throws IllegalArgumentException if a tool with the same name is already registered
   */
  void register(RegisteredTool tool);

  /**
   * All descriptors, sorted by name.
   *
   * @return the catalog
   */
  List<ToolDescriptor> list();

  Optional<RegisteredTool> find(String name);
}
