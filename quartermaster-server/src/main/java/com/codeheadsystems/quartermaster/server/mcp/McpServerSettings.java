package com.codeheadsystems.quartermaster.server.mcp;

import java.util.List;

/**
 * Server identity and session policy of the MCP endpoint.
 *
 * @param serverName                reported in {@code serverInfo.name}
 * @param serverVersion             reported in {@code serverInfo.version}
 * @param instructions              usage text returned by {@code initialize}, nullable
 * @param protocolVersion           version answered when the client asks for an unsupported one
 * @param supportedProtocolVersions versions echoed back when a client requests them
 * @param sessionRecoveryEnabled    when true, a missing or unknown {@code Mcp-Session-Id} on a
 *                                  non-initialize call silently gets a session bound to the
 *                                  caller; when false such calls fail with {@code -32001}
 */
public record McpServerSettings(
    String serverName,
    String serverVersion,
    String instructions,
    String protocolVersion,
    List<String> supportedProtocolVersions,
    boolean sessionRecoveryEnabled) {

  public static final String DEFAULT_PROTOCOL_VERSION = "2025-03-26";

  public McpServerSettings {
    supportedProtocolVersions = List.copyOf(supportedProtocolVersions);
  }

  public static McpServerSettings defaults() {
    return new McpServerSettings(
        "Quartermaster Inventory Server",
        "1.0.0",
        "Use 'search' to find stocked items by name, category or location, "
            + "then 'fetch' with a result id to read the full record.",
        DEFAULT_PROTOCOL_VERSION,
        List.of("2024-11-05", DEFAULT_PROTOCOL_VERSION),
        true);
  }
}
