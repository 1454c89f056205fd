package com.codeheadsystems.quartermaster.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link McpSessionStore} backed by a {@link ConcurrentHashMap}.
 * Sessions have no expiry and are lost on server restart.
 */
public class InMemoryMcpSessionStore implements McpSessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryMcpSessionStore.class);

  private final ConcurrentHashMap<String, McpSession> sessions = new ConcurrentHashMap<>();

  public InMemoryMcpSessionStore() {
    log.warn("InMemoryMcpSessionStore: MCP sessions will NOT survive restarts");
  }

  @Override
  public void store(McpSession session) {
    sessions.put(session.sessionId(), session);
    log.debug("Stored session id={} subject={}", session.sessionId(), session.subject());
  }

  @Override
  public McpSession storeIfAbsent(McpSession session) {
    McpSession existing = sessions.putIfAbsent(session.sessionId(), session);
    return existing == null ? session : existing;
  }

  @Override
  public Optional<McpSession> load(String sessionId) {
    return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
  }

  @Override
  public void destroy(String sessionId) {
    if (sessionId != null && sessions.remove(sessionId) != null) {
      log.debug("Destroyed session id={}", sessionId);
    }
  }
}
