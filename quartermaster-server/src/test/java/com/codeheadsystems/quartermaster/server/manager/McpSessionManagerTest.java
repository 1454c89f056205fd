package com.codeheadsystems.quartermaster.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.quartermaster.server.MutableClock;
import com.codeheadsystems.quartermaster.server.auth.AuthContext;
import com.codeheadsystems.quartermaster.server.auth.SecureTokenGenerator;
import com.codeheadsystems.quartermaster.server.store.InMemoryMcpSessionStore;
import com.codeheadsystems.quartermaster.server.store.McpSession;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class McpSessionManagerTest {

  private static final AuthContext ALICE = new AuthContext("alice", "c1", Set.of("inventory"));
  private static final AuthContext BOB = new AuthContext("bob", "c1", Set.of("inventory"));

  private McpSessionManager manager;

  @BeforeEach
  void setUp() {
    manager = new McpSessionManager(new InMemoryMcpSessionStore(), new SecureTokenGenerator(),
        MutableClock.startingAt("2026-01-01T00:00:00Z"));
  }

  @Test
  void create_bindsSubjectAndVersion() {
    McpSession session = manager.create(ALICE, "2025-03-26", null);

    assertThat(session.subject()).isEqualTo("alice");
    assertThat(session.clientId()).isEqualTo("c1");
    assertThat(session.protocolVersion()).isEqualTo("2025-03-26");
    assertThat(manager.get(session.sessionId())).contains(session);
  }

  @Test
  void create_alwaysNewId() {
    assertThat(manager.create(ALICE, "v", null).sessionId())
        .isNotEqualTo(manager.create(ALICE, "v", null).sessionId());
  }

  @Test
  void recover_reusesClientSuppliedId() {
    McpSession recovered = manager.recover("client-held-id", ALICE, "2025-03-26");

    assertThat(recovered.sessionId()).isEqualTo("client-held-id");
    assertThat(recovered.subject()).isEqualTo("alice");
  }

  @Test
  void recover_existingSession_returnsIt() {
    McpSession first = manager.recover("shared", ALICE, "v");

    assertThat(manager.recover("shared", BOB, "v")).isEqualTo(first);
  }

  @Test
  void terminate_ownSession_removesIt() {
    McpSession session = manager.create(ALICE, "v", null);

    manager.terminate(session.sessionId(), ALICE);

    assertThat(manager.get(session.sessionId())).isEmpty();
  }

  @Test
  void terminate_otherSubject_isRejectedAndKeepsSession() {
    McpSession session = manager.create(ALICE, "v", null);

    assertThatThrownBy(() -> manager.terminate(session.sessionId(), BOB))
        .isInstanceOf(SessionOwnershipException.class);
    assertThat(manager.get(session.sessionId())).isPresent();
  }

  @Test
  void terminate_unknown_isNoOp() {
    assertThatCode(() -> manager.terminate("unknown", ALICE)).doesNotThrowAnyException();
  }
}
