package com.codeheadsystems.quartermaster.server.tool;

import com.codeheadsystems.quartermaster.model.mcp.ToolDescriptor;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ToolRegistry} backed by a {@link ConcurrentHashMap}.
 */
public class InMemoryToolRegistry implements ToolRegistry {

  private static final Logger log = LoggerFactory.getLogger(InMemoryToolRegistry.class);

  private final ConcurrentHashMap<String, RegisteredTool> tools = new ConcurrentHashMap<>();

  @Override
  public void register(RegisteredTool tool) {
    if (tools.putIfAbsent(tool.name(), tool) != null) {
      throw new IllegalArgumentException("Tool already registered: " + tool.name());
    }
    log.info("Registered tool {}", tool.name());
  }

  @Override
  public List<ToolDescriptor> list() {
    return tools.values().stream()
        .map(RegisteredTool::descriptor)
        .sorted(Comparator.comparing(ToolDescriptor::name))
        .toList();
  }

  @Override
  public Optional<RegisteredTool> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
  }
}
