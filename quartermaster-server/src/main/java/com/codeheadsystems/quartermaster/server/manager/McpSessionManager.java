package com.codeheadsystems.quartermaster.server.manager;

import com.codeheadsystems.quartermaster.server.auth.AuthContext;
import com.codeheadsystems.quartermaster.server.auth.SecureTokenGenerator;
import com.codeheadsystems.quartermaster.server.store.McpSession;
import com.codeheadsystems.quartermaster.server.store.McpSessionStore;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, looks up and destroys MCP sessions, each bound to the subject that created it.
 */
public class McpSessionManager {

  private static final Logger log = LoggerFactory.getLogger(McpSessionManager.class);

  private final McpSessionStore store;
  private final SecureTokenGenerator generator;
  private final Clock clock;

  public McpSessionManager(McpSessionStore store) {
    this(store, new SecureTokenGenerator(), Clock.systemUTC());
  }

  public McpSessionManager(McpSessionStore store, SecureTokenGenerator generator, Clock clock) {
    this.store = store;
    this.generator = generator;
    this.clock = clock;
  }

  /**
   * Creates a session under a fresh random id.
   *
   * @param context            the authenticated caller
   * @param protocolVersion    negotiated protocol version
   * @param clientCapabilities capabilities the client declared, nullable
   * @return the new session
   */
  public McpSession create(AuthContext context, String protocolVersion, JsonNode clientCapabilities) {
    McpSession session = new McpSession(generator.generate(), context.subject(), context.clientId(),
        clock.instant(), protocolVersion, clientCapabilities);
    store.store(session);
    log.debug("Created session id={} subject={}", session.sessionId(), session.subject());
    return session;
  }

  /**
   * Recreates a session under an id the client already holds, e.g. after a server restart.
   * If another request recovered the same id first, that session is returned instead and the
   * caller must check its owner.
   *
   * @param sessionId       the id presented by the client
   * @param context         the authenticated caller
   * @param protocolVersion protocol version to record
   * @return the session now stored under {@code sessionId}
   */
  public McpSession recover(String sessionId, AuthContext context, String protocolVersion) {
    McpSession candidate = new McpSession(sessionId, context.subject(), context.clientId(),
        clock.instant(), protocolVersion, null);
    McpSession stored = store.storeIfAbsent(candidate);
    if (stored == candidate) {
      log.info("Recovered unknown session id={} for subject={}", sessionId, context.subject());
    }
    return stored;
  }

  public Optional<McpSession> get(String sessionId) {
    return store.load(sessionId);
  }

  /**
   * Deletes a session. Idempotent.
   *
   * @param sessionId the id
   */
  public void destroy(String sessionId) {
    store.destroy(sessionId);
  }

  /**
   * Terminates a session on behalf of a caller. Unknown ids are ignored.
   *
   * @param sessionId the id
   * @param context   the authenticated caller
   * @throws SessionOwnershipException if the session is bound to a different subject
   */
  public void terminate(String sessionId, AuthContext context) {
    Optional<McpSession> session = store.load(sessionId);
    if (session.isEmpty()) {
      log.debug("terminate: session id={} already absent", sessionId);
      return;
    }
    if (!session.get().isOwnedBy(context.subject())) {
      log.warn("Subject {} attempted to terminate session id={} owned by another subject",
          context.subject(), sessionId);
      throw new SessionOwnershipException("Session belongs to a different principal");
    }
    store.destroy(sessionId);
    log.debug("Terminated session id={}", sessionId);
  }
}
