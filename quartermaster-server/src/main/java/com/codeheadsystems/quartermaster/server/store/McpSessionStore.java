package com.codeheadsystems.quartermaster.server.store;

import java.util.Optional;

/**
 * Storage for MCP sessions. Implementations must be thread-safe.
 * <p>
 * A session is either live or absent; destroyed and never-created sessions look the same.
 */
public interface McpSessionStore {

  /**
   * Stores a session, replacing any with the same id.
   *
   * @param session the session
   */
  void store(McpSession session);

  /**
   * Stores a session only when its id is unused.
   *
   * @param session the session
   * @return the session now held under that id, which is the argument when it was stored
   */
  McpSession storeIfAbsent(McpSession session);

  /**
   * Loads a session.
   *
   * @param sessionId the id
   * @return the session, or empty
   */
  Optional<McpSession> load(String sessionId);

  /**
   * Deletes a session. Unknown ids are ignored.
   *
   * @param sessionId the id
   */
  void destroy(String sessionId);
}
