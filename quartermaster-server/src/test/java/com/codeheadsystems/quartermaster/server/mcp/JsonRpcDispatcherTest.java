package com.codeheadsystems.quartermaster.server.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes;
import com.codeheadsystems.quartermaster.model.mcp.ContentBlock;
import com.codeheadsystems.quartermaster.model.mcp.ToolDescriptor;
import com.codeheadsystems.quartermaster.server.MutableClock;
import com.codeheadsystems.quartermaster.server.auth.BearerAuthenticator;
import com.codeheadsystems.quartermaster.server.auth.SecureTokenGenerator;
import com.codeheadsystems.quartermaster.server.manager.McpSessionManager;
import com.codeheadsystems.quartermaster.server.store.InMemoryMcpSessionStore;
import com.codeheadsystems.quartermaster.server.store.InMemoryTokenStore;
import com.codeheadsystems.quartermaster.server.tool.InMemoryToolRegistry;
import com.codeheadsystems.quartermaster.server.tool.RegisteredTool;
import com.codeheadsystems.quartermaster.server.tool.ToolExecutionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JsonRpcDispatcherTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private InMemoryTokenStore tokenStore;
  private McpSessionManager sessionManager;
  private InMemoryToolRegistry registry;
  private String aliceAuth;
  private String bobAuth;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    tokenStore = new InMemoryTokenStore(clock, new SecureTokenGenerator());
    sessionManager = new McpSessionManager(new InMemoryMcpSessionStore(),
        new SecureTokenGenerator(), clock);
    registry = new InMemoryToolRegistry();
    registry.register(new RegisteredTool(
        new ToolDescriptor("echo", null, "Echoes its text argument", mapper.createObjectNode()),
        (arguments, context) -> List.of(ContentBlock.text(
            context.subject() + ":" + arguments.path("text").asText()))));
    registry.register(new RegisteredTool(
        new ToolDescriptor("reject", null, "Always fails", mapper.createObjectNode()),
        (arguments, context) -> {
          throw new ToolExecutionException("quantity must be positive");
        }));
    registry.register(new RegisteredTool(
        new ToolDescriptor("explode", null, "Throws unexpectedly", mapper.createObjectNode()),
        (arguments, context) -> {
          throw new IllegalStateException("jdbc:postgresql://db.internal:5432 password=hunter2");
        }));
    aliceAuth = "Bearer " + tokenStore.issue("alice", "c1", Set.of("inventory"), Duration.ofHours(1));
    bobAuth = "Bearer " + tokenStore.issue("bob", "c1", Set.of("inventory"), Duration.ofHours(1));
  }

  private JsonRpcDispatcher dispatcher(boolean recovery) {
    McpServerSettings defaults = McpServerSettings.defaults();
    McpServerSettings settings = new McpServerSettings(defaults.serverName(),
        defaults.serverVersion(), defaults.instructions(), defaults.protocolVersion(),
        defaults.supportedProtocolVersions(), recovery);
    return new JsonRpcDispatcher(new BearerAuthenticator(tokenStore), sessionManager, registry,
        settings, mapper);
  }

  private JsonNode json(DispatchResult result) {
    return mapper.valueToTree(result.body());
  }

  private String initializeSession(JsonRpcDispatcher dispatcher, String auth) {
    return dispatcher.dispatch(auth, null,
        "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}").sessionId();
  }

  @Nested
  class Authentication {

    @Test
    void missingHeader_is401WithOriginalId() {
      DispatchResult result = dispatcher(true).dispatch(null, null,
          "{\"jsonrpc\":\"2.0\",\"id\":\"req-7\",\"method\":\"tools/list\"}");

      assertThat(result.status()).isEqualTo(401);
      assertThat(result.unauthenticated()).isTrue();
      assertThat(result.sessionId()).isNull();
      assertThat(json(result).get("id").asText()).isEqualTo("req-7");
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.UNAUTHENTICATED);
    }

    @Test
    void unknownToken_is401() {
      DispatchResult result = dispatcher(true).dispatch("Bearer bogus", null,
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");

      assertThat(result.status()).isEqualTo(401);
    }

    @Test
    void authIsCheckedBeforeParsing() {
      assertThat(dispatcher(true).dispatch(null, null, "not json").status()).isEqualTo(401);
    }
  }

  @Nested
  class Envelope {

    @Test
    void unparseable_isParseErrorWithNullId() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null, "{\"jsonrpc\":");

      assertThat(result.status()).isEqualTo(400);
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.PARSE_ERROR);
      assertThat(json(result).get("id").isNull()).isTrue();
    }

    @Test
    void wrongVersion_isInvalidRequestWithId() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null,
          "{\"jsonrpc\":\"1.0\",\"id\":9,\"method\":\"ping\"}");

      assertThat(result.status()).isEqualTo(400);
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.INVALID_REQUEST);
      assertThat(json(result).get("id").asInt()).isEqualTo(9);
    }

    @Test
    void missingMethod_isInvalidRequest() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null,
          "{\"jsonrpc\":\"2.0\",\"id\":9}");

      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.INVALID_REQUEST);
    }

    @Test
    void objectId_isInvalidRequestWithNullId() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null,
          "{\"jsonrpc\":\"2.0\",\"id\":{\"n\":1},\"method\":\"ping\"}");

      assertThat(result.status()).isEqualTo(400);
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.INVALID_REQUEST);
      assertThat(json(result).get("id").isNull()).isTrue();
    }

    @Test
    void arrayBody_isInvalidRequest() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null, "[1,2]");

      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.INVALID_REQUEST);
      assertThat(json(result).get("id").isNull()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"abc\"", "42", "null", "-7", "1.50", "1e2", "true", "false"})
    void id_isEchoedVerbatim(String id) throws Exception {
      JsonRpcDispatcher dispatcher = dispatcher(true);
      String session = initializeSession(dispatcher, aliceAuth);

      DispatchResult result = dispatcher.dispatch(aliceAuth, session,
          "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"ping\"}");

      String serialized = mapper.writeValueAsString(result.body());
      assertThat(serialized).contains("\"id\":" + id);
    }

    @Test
    void id_echoedOnErrors() throws Exception {
      JsonRpcDispatcher dispatcher = dispatcher(true);
      String session = initializeSession(dispatcher, aliceAuth);

      DispatchResult result = dispatcher.dispatch(aliceAuth, session,
          "{\"jsonrpc\":\"2.0\",\"id\":\"x-1\",\"method\":\"nope\"}");

      assertThat(mapper.writeValueAsString(result.body())).contains("\"id\":\"x-1\"");
    }
  }

  @Nested
  class Sessions {

    @Test
    void initialize_ignoresSuppliedIdAndCreatesFreshSession() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, "stale-id",
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
              + "\"params\":{\"protocolVersion\":\"2025-03-26\",\"capabilities\":{\"roots\":{}}}}");

      assertThat(result.status()).isEqualTo(200);
      assertThat(result.sessionId()).isNotBlank().isNotEqualTo("stale-id");
      assertThat(sessionManager.get(result.sessionId())).hasValueSatisfying(session -> {
        assertThat(session.subject()).isEqualTo("alice");
        assertThat(session.clientCapabilities().has("roots")).isTrue();
      });
      JsonNode body = json(result);
      assertThat(body.at("/result/protocolVersion").asText()).isEqualTo("2025-03-26");
      assertThat(body.at("/result/capabilities/tools/listChanged").asBoolean(true)).isFalse();
      assertThat(body.at("/result/serverInfo/name").asText()).isNotBlank();
      assertThat(body.at("/result/instructions").asText()).isNotBlank();
    }

    @Test
    void initialize_unsupportedVersion_answersServerVersion() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null,
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
              + "\"params\":{\"protocolVersion\":\"1999-01-01\"}}");

      assertThat(json(result).at("/result/protocolVersion").asText())
          .isEqualTo(McpServerSettings.DEFAULT_PROTOCOL_VERSION);
    }

    @Test
    void initialize_supportedOlderVersion_isEchoed() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null,
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
              + "\"params\":{\"protocolVersion\":\"2024-11-05\"}}");

      assertThat(json(result).at("/result/protocolVersion").asText()).isEqualTo("2024-11-05");
    }

    @Test
    void missingSession_withRecovery_createsOneAndReturnsIt() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, null,
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

      assertThat(result.status()).isEqualTo(200);
      assertThat(result.sessionId()).isNotBlank();
      assertThat(sessionManager.get(result.sessionId())).isPresent();
    }

    @Test
    void unknownSession_withRecovery_isRecreatedUnderSameId() {
      DispatchResult result = dispatcher(true).dispatch(aliceAuth, "from-before-restart",
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

      assertThat(result.status()).isEqualTo(200);
      assertThat(result.sessionId()).isEqualTo("from-before-restart");
      assertThat(sessionManager.get("from-before-restart"))
          .hasValueSatisfying(s -> assertThat(s.subject()).isEqualTo("alice"));
    }

    @Test
    void missingSession_strict_isSessionError400() {
      DispatchResult result = dispatcher(false).dispatch(aliceAuth, null,
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

      assertThat(result.status()).isEqualTo(400);
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.SESSION_ERROR);
    }

    @Test
    void unknownSession_strict_isSessionError404() {
      DispatchResult result = dispatcher(false).dispatch(aliceAuth, "unknown",
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

      assertThat(result.status()).isEqualTo(404);
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.SESSION_ERROR);
      assertThat(sessionManager.get("unknown")).isEmpty();
    }

    @Test
    void otherSubjectsSession_isRejectedEvenWithRecovery() {
      JsonRpcDispatcher dispatcher = dispatcher(true);
      String aliceSession = initializeSession(dispatcher, aliceAuth);

      DispatchResult result = dispatcher.dispatch(bobAuth, aliceSession,
          "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

      assertThat(result.status()).isEqualTo(403);
      assertThat(result.sessionId()).isNull();
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.SESSION_ERROR);
    }

    @Test
    void notification_isAcknowledgedWithoutBody() {
      JsonRpcDispatcher dispatcher = dispatcher(true);
      String session = initializeSession(dispatcher, aliceAuth);

      DispatchResult result = dispatcher.dispatch(aliceAuth, session,
          "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

      assertThat(result.status()).isEqualTo(202);
      assertThat(result.body()).isNull();
      assertThat(result.sessionId()).isEqualTo(session);
    }

    @Test
    void toolCallNotification_runsToolWithoutReply() {
      AtomicInteger calls = new AtomicInteger();
      registry.register(new RegisteredTool(
          new ToolDescriptor("count", null, "Counts calls", mapper.createObjectNode()),
          (arguments, context) -> {
            calls.incrementAndGet();
            return List.of();
          }));
      JsonRpcDispatcher dispatcher = dispatcher(true);
      String session = initializeSession(dispatcher, aliceAuth);

      DispatchResult result = dispatcher.dispatch(aliceAuth, session,
          "{\"jsonrpc\":\"2.0\",\"method\":\"tools/call\",\"params\":{\"name\":\"count\"}}");

      assertThat(result.status()).isEqualTo(202);
      assertThat(result.body()).isNull();
      assertThat(calls).hasValue(1);
    }

    @Test
    void failingNotification_isStillAcknowledged() {
      JsonRpcDispatcher dispatcher = dispatcher(true);
      String session = initializeSession(dispatcher, aliceAuth);

      DispatchResult result = dispatcher.dispatch(aliceAuth, session,
          "{\"jsonrpc\":\"2.0\",\"method\":\"no/such/method\"}");

      assertThat(result.status()).isEqualTo(202);
      assertThat(result.body()).isNull();
    }
  }

  @Nested
  class Methods {

    private JsonRpcDispatcher dispatcher;
    private String session;

    @BeforeEach
    void setUp() {
      dispatcher = dispatcher(true);
      session = initializeSession(dispatcher, aliceAuth);
    }

    private DispatchResult call(String body) {
      return dispatcher.dispatch(aliceAuth, session, body);
    }

    @Test
    void ping_returnsEmptyObject() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");

      assertThat(json(result).get("result").isObject()).isTrue();
      assertThat(json(result).get("result").size()).isZero();
    }

    @Test
    void toolsList_returnsWholeCatalogSorted() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");

      JsonNode tools = json(result).at("/result/tools");
      assertThat(tools.size()).isEqualTo(3);
      assertThat(tools.get(0).get("name").asText()).isEqualTo("echo");
      assertThat(tools.get(1).get("name").asText()).isEqualTo("explode");
      assertThat(tools.get(2).get("name").asText()).isEqualTo("reject");
      assertThat(result.sessionId()).isEqualTo(session);
    }

    @Test
    void unknownMethod_isMethodNotFound() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"resources/list\"}");

      assertThat(result.status()).isEqualTo(200);
      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.METHOD_NOT_FOUND);
      assertThat(result.sessionId()).isEqualTo(session);
    }

    @Test
    void toolsCall_passesArgumentsAndIdentity() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
          + "\"params\":{\"name\":\"echo\",\"arguments\":{\"text\":\"hi\"}}}");

      JsonNode body = json(result);
      assertThat(body.at("/result/success").asBoolean()).isTrue();
      assertThat(body.at("/result/isError").asBoolean()).isFalse();
      assertThat(body.at("/result/content/0/type").asText()).isEqualTo("text");
      assertThat(body.at("/result/content/0/text").asText()).isEqualTo("alice:hi");
      assertThat(body.at("/result").has("error")).isFalse();
    }

    @Test
    void toolsCall_unknownTool_isMethodNotFoundCarryingName() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
          + "\"params\":{\"name\":\"nonexistent\"}}");

      assertThat(result.status()).isEqualTo(200);
      JsonNode body = json(result);
      assertThat(body.at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.METHOD_NOT_FOUND);
      assertThat(body.at("/error/message").asText()).contains("nonexistent");
      assertThat(body.at("/error/data/name").asText()).isEqualTo("nonexistent");
    }

    @Test
    void toolsCall_domainFailure_isSuccessfulEnvelopeWithFailurePayload() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
          + "\"params\":{\"name\":\"reject\",\"arguments\":{}}}");

      assertThat(result.status()).isEqualTo(200);
      JsonNode body = json(result);
      assertThat(body.has("error")).isFalse();
      assertThat(body.at("/result/success").asBoolean(true)).isFalse();
      assertThat(body.at("/result/isError").asBoolean()).isTrue();
      assertThat(body.at("/result/error").asText()).isEqualTo("quantity must be positive");
    }

    @Test
    void toolsCall_unexpectedException_isWrappedWithoutDetail() throws Exception {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
          + "\"params\":{\"name\":\"explode\"}}");

      assertThat(result.status()).isEqualTo(200);
      JsonNode body = json(result);
      assertThat(body.at("/result/success").asBoolean(true)).isFalse();
      assertThat(body.at("/result/error").asText()).isEqualTo("Tool 'explode' failed");
      assertThat(body.at("/result/content/0/text").asText()).isEqualTo("Tool 'explode' failed");
      assertThat(mapper.writeValueAsString(result.body()))
          .doesNotContain("jdbc:postgresql")
          .doesNotContain("hunter2");
    }

    @Test
    void toolsCall_missingName_isInvalidParams() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
          + "\"params\":{\"arguments\":{}}}");

      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.INVALID_PARAMS);
    }

    @Test
    void toolsCall_nonObjectArguments_isInvalidParams() {
      DispatchResult result = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
          + "\"params\":{\"name\":\"echo\",\"arguments\":[1]}}");

      assertThat(json(result).at("/error/code").asInt()).isEqualTo(JsonRpcErrorCodes.INVALID_PARAMS);
    }
  }
}
