package com.codeheadsystems.quartermaster.model.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result payload of {@code initialize}.
 *
 * @param protocolVersion the negotiated MCP protocol version
 * @param capabilities    capabilities the server declares
 * @param serverInfo      server name and version
 * @param instructions    free-text usage instructions for the model, omitted when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InitializeResult(
    @JsonProperty("protocolVersion") String protocolVersion,
    @JsonProperty("capabilities") ServerCapabilities capabilities,
    @JsonProperty("serverInfo") Implementation serverInfo,
    @JsonProperty("instructions") String instructions) {

  /**
   * Declared server capabilities. Only tools are offered.
   *
   * @param tools tool capability flags
   */
  public record ServerCapabilities(@JsonProperty("tools") ToolsCapability tools) {
  }

  /**
   * Tool capability flags.
   *
   * @param listChanged whether the server emits list-changed notifications; always false
   */
  public record ToolsCapability(@JsonProperty("listChanged") boolean listChanged) {
  }

  /**
   * Name and version of an MCP implementation.
   *
   * @param name    implementation name
   * @param version implementation version
   */
  public record Implementation(
      @JsonProperty("name") String name,
      @JsonProperty("version") String version) {
  }
}
