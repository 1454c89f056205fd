package com.codeheadsystems.quartermaster.server.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One MCP client conversation.
 *
 * @param sessionId          opaque identifier carried in the {@code Mcp-Session-Id} header
 * @param subject            identity the session is bound to
 * @param clientId           OAuth client that created the session
 * @param createdAt          creation time
 * @param protocolVersion    negotiated MCP protocol version
 * @param clientCapabilities capabilities declared by the client on initialize; null when the
 *                           session was created without one
 */
public record McpSession(
    String sessionId,
    String subject,
    String clientId,
    Instant createdAt,
    String protocolVersion,
    JsonNode clientCapabilities) {

  public boolean isOwnedBy(String candidate) {
    return subject.equals(candidate);
  }
}
