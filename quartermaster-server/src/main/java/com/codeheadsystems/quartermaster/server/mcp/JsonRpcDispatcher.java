package com.codeheadsystems.quartermaster.server.mcp;

import static com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes.INTERNAL_ERROR;
import static com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes.INVALID_PARAMS;
import static com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes.INVALID_REQUEST;
import static com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes.METHOD_NOT_FOUND;
import static com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes.PARSE_ERROR;
import static com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes.SESSION_ERROR;
import static com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcErrorCodes.UNAUTHENTICATED;

import com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcResponse;
import com.codeheadsystems.quartermaster.model.mcp.CallToolResult;
import com.codeheadsystems.quartermaster.model.mcp.ContentBlock;
import com.codeheadsystems.quartermaster.model.mcp.InitializeResult;
import com.codeheadsystems.quartermaster.model.mcp.ListToolsResult;
import com.codeheadsystems.quartermaster.server.auth.AuthContext;
import com.codeheadsystems.quartermaster.server.auth.AuthContextResolver;
import com.codeheadsystems.quartermaster.server.auth.UnauthenticatedException;
import com.codeheadsystems.quartermaster.server.manager.McpSessionManager;
import com.codeheadsystems.quartermaster.server.store.McpSession;
import com.codeheadsystems.quartermaster.server.tool.RegisteredTool;
import com.codeheadsystems.quartermaster.server.tool.ToolExecutionException;
import com.codeheadsystems.quartermaster.server.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.util.RawValue;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The MCP protocol state machine for one HTTP request.
 * <p>
 * Each message runs through authentication, envelope validation, session resolution and method
 * dispatch, in that order. Every envelope echoes the request {@code id} node unchanged, and every
 * response after session resolution carries the session id, including method and tool errors.
 * <p>
 * Methods: {@code initialize}, {@code ping}, {@code tools/list}, {@code tools/call}. Messages
 * without an {@code id} member are notifications: they are acknowledged with HTTP 202 and no body.
 * A notification naming a method outside {@code notifications/*} is still executed, and its
 * result is discarded. Tool failures are returned as successful envelopes whose result has
 * {@code success=false}. Unexpected exceptions from a tool are logged and reported with a generic
 * message.
 */
public class JsonRpcDispatcher {

  private static final Logger log = LoggerFactory.getLogger(JsonRpcDispatcher.class);

  public static final String JSONRPC_VERSION = "2.0";
  public static final String METHOD_INITIALIZE = "initialize";
  public static final String METHOD_PING = "ping";
  public static final String METHOD_TOOLS_LIST = "tools/list";
  public static final String METHOD_TOOLS_CALL = "tools/call";
  public static final String NOTIFICATION_PREFIX = "notifications/";

  private final AuthContextResolver authContextResolver;
  private final McpSessionManager sessionManager;
  private final ToolRegistry toolRegistry;
  private final McpServerSettings settings;
  private final ObjectMapper objectMapper;

  public JsonRpcDispatcher(AuthContextResolver authContextResolver,
                           McpSessionManager sessionManager,
                           ToolRegistry toolRegistry,
                           McpServerSettings settings,
                           ObjectMapper objectMapper) {
    this.authContextResolver = authContextResolver;
    this.sessionManager = sessionManager;
    this.toolRegistry = toolRegistry;
    this.settings = settings;
    // Decimal ids must come back exactly as sent, so keep their scale.
    this.objectMapper = objectMapper.copy()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
  }

  /**
   * Handles one POSTed message.
   *
   * @param authorizationHeader raw {@code Authorization} header, nullable
   * @param sessionIdHeader     raw {@code Mcp-Session-Id} header, nullable
   * @param body                the request body
   * @return status, session header and envelope to send
   */
  public DispatchResult dispatch(String authorizationHeader, String sessionIdHeader, String body) {
    Optional<JsonNode> envelope = parse(body);
    JsonNode id = envelope.map(message -> idOf(message, body)).orElse(NullNode.getInstance());

    AuthContext context;
    try {
      context = authContextResolver.resolve(authorizationHeader);
    } catch (UnauthenticatedException e) {
      log.debug("Rejected MCP request: {}", e.getMessage());
      return new DispatchResult(401, null,
          JsonRpcResponse.failure(id, UNAUTHENTICATED, e.getMessage()));
    }

    if (envelope.isEmpty()) {
      return new DispatchResult(400, null,
          JsonRpcResponse.failure(NullNode.getInstance(), PARSE_ERROR, "Parse error"));
    }
    JsonNode message = envelope.get();
    String invalid = validateEnvelope(message);
    if (invalid != null) {
      log.debug("Invalid JSON-RPC envelope: {}", invalid);
      return new DispatchResult(400, null, JsonRpcResponse.failure(id, INVALID_REQUEST, invalid));
    }
    String method = message.get("method").asText();
    JsonNode params = message.get("params");
    boolean notification = !message.has("id");

    SessionResolution resolution = resolveSession(method, sessionIdHeader, params, context, id);
    if (resolution.failure() != null) {
      return resolution.failure();
    }
    McpSession session = resolution.session();

    if (notification) {
      if (!method.startsWith(NOTIFICATION_PREFIX)) {
        invokeDiscarding(method, params, session, context);
      }
      log.debug("Notification {} acknowledged for session id={}", method, session.sessionId());
      return new DispatchResult(202, session.sessionId(), null);
    }

    log.debug("dispatch(method={}, session={})", method, session.sessionId());
    try {
      return new DispatchResult(200, session.sessionId(), invoke(method, id, params, session, context));
    } catch (RuntimeException e) {
      log.error("Unexpected error dispatching method={}", method, e);
      return new DispatchResult(500, session.sessionId(),
          JsonRpcResponse.failure(id, INTERNAL_ERROR, "Internal error"));
    }
  }

  // ── Envelope ─────────────────────────────────────────────────────────────

  private Optional<JsonNode> parse(String body) {
    if (body == null || body.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readTree(body)).filter(node -> !node.isMissingNode());
    } catch (JsonProcessingException e) {
      log.debug("Unparseable JSON-RPC body: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  private JsonNode idOf(JsonNode message, String body) {
    JsonNode id = message.isObject() ? message.get("id") : null;
    if (!isValidId(id)) {
      return NullNode.getInstance();
    }
    if (id.isFloatingPointNumber()) {
      // BigDecimal renders 1e2 as 1E+2, so echo the source text.
      return sourceTextOfId(body)
          .<JsonNode>map(text -> objectMapper.getNodeFactory().rawValueNode(new RawValue(text)))
          .orElse(id);
    }
    return id;
  }

  /**
   * Any JSON scalar or null.
   */
  private static boolean isValidId(JsonNode id) {
    return id != null && id.isValueNode();
  }

  private Optional<String> sourceTextOfId(String body) {
    String text = null;
    try (JsonParser parser = objectMapper.getFactory().createParser(body)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        return Optional.empty();
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        if ("id".equals(field) && value.isNumeric()) {
          text = parser.getText();
        } else {
          parser.skipChildren();
        }
      }
    } catch (IOException e) {
      log.debug("Could not rescan JSON-RPC id: {}", e.getMessage());
      return Optional.empty();
    }
    return Optional.ofNullable(text);
  }

  private static String validateEnvelope(JsonNode message) {
    if (!message.isObject()) {
      return "Request must be a JSON object";
    }
    JsonNode version = message.get("jsonrpc");
    if (version == null || !version.isTextual() || !JSONRPC_VERSION.equals(version.asText())) {
      return "Invalid JSON-RPC version";
    }
    JsonNode method = message.get("method");
    if (method == null || !method.isTextual() || method.asText().isEmpty()) {
      return "Missing method";
    }
    if (message.has("id") && !isValidId(message.get("id"))) {
      return "id must be a string, number, boolean or null";
    }
    JsonNode params = message.get("params");
    if (params != null && !params.isObject() && !params.isArray() && !params.isNull()) {
      return "params must be an object or array";
    }
    return null;
  }

  // ── Sessions ─────────────────────────────────────────────────────────────

  private SessionResolution resolveSession(String method, String sessionIdHeader, JsonNode params,
                                           AuthContext context, JsonNode id) {
    if (METHOD_INITIALIZE.equals(method)) {
      JsonNode capabilities = params == null ? null : params.get("capabilities");
      McpSession session = sessionManager.create(context, negotiateVersion(params), capabilities);
      return SessionResolution.of(session);
    }
    if (sessionIdHeader == null || sessionIdHeader.isBlank()) {
      if (!settings.sessionRecoveryEnabled()) {
        return SessionResolution.failed(
            new DispatchResult(400, null, JsonRpcResponse.failure(id, SESSION_ERROR,
                "Missing Mcp-Session-Id header")));
      }
      log.debug("No session id on {}, creating one for subject={}", method, context.subject());
      return SessionResolution.of(sessionManager.create(context, settings.protocolVersion(), null));
    }
    Optional<McpSession> existing = sessionManager.get(sessionIdHeader);
    McpSession session;
    if (existing.isPresent()) {
      session = existing.get();
    } else if (settings.sessionRecoveryEnabled()) {
      session = sessionManager.recover(sessionIdHeader, context, settings.protocolVersion());
    } else {
      return SessionResolution.failed(
          new DispatchResult(404, null, JsonRpcResponse.failure(id, SESSION_ERROR,
              "Unknown session")));
    }
    if (!session.isOwnedBy(context.subject())) {
      log.warn("Subject {} presented session id={} bound to another subject",
          context.subject(), sessionIdHeader);
      return SessionResolution.failed(
          new DispatchResult(403, null, JsonRpcResponse.failure(id, SESSION_ERROR,
              "Session belongs to a different principal")));
    }
    return SessionResolution.of(session);
  }

  private String negotiateVersion(JsonNode params) {
    JsonNode requested = params == null ? null : params.get("protocolVersion");
    if (requested != null && requested.isTextual()
        && settings.supportedProtocolVersions().contains(requested.asText())) {
      return requested.asText();
    }
    return settings.protocolVersion();
  }

  // ── Methods ──────────────────────────────────────────────────────────────

  private void invokeDiscarding(String method, JsonNode params, McpSession session,
                                AuthContext context) {
    try {
      JsonRpcResponse discarded = invoke(method, NullNode.getInstance(), params, session, context);
      if (discarded.error() != null) {
        log.debug("Notification {} failed: {}", method, discarded.error().message());
      }
    } catch (RuntimeException e) {
      log.error("Unexpected error handling notification method={}", method, e);
    }
  }

  private JsonRpcResponse invoke(String method, JsonNode id, JsonNode params,
                                 McpSession session, AuthContext context) {
    return switch (method) {
      case METHOD_INITIALIZE -> JsonRpcResponse.success(id, new InitializeResult(
          session.protocolVersion(),
          new InitializeResult.ServerCapabilities(new InitializeResult.ToolsCapability(false)),
          new InitializeResult.Implementation(settings.serverName(), settings.serverVersion()),
          settings.instructions()));
      case METHOD_PING -> JsonRpcResponse.success(id, Map.of());
      case METHOD_TOOLS_LIST -> JsonRpcResponse.success(id, new ListToolsResult(toolRegistry.list()));
      case METHOD_TOOLS_CALL -> callTool(id, params, context);
      default -> JsonRpcResponse.failure(id, METHOD_NOT_FOUND, "Method not found: " + method,
          Map.of("method", method));
    };
  }

  private JsonRpcResponse callTool(JsonNode id, JsonNode params, AuthContext context) {
    if (params == null || !params.isObject()) {
      return JsonRpcResponse.failure(id, INVALID_PARAMS, "params must be an object");
    }
    JsonNode nameNode = params.get("name");
    if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
      return JsonRpcResponse.failure(id, INVALID_PARAMS, "Tool name is required");
    }
    String name = nameNode.asText();
    JsonNode arguments = params.get("arguments");
    if (arguments == null || arguments.isNull()) {
      arguments = objectMapper.createObjectNode();
    } else if (!arguments.isObject()) {
      return JsonRpcResponse.failure(id, INVALID_PARAMS, "arguments must be an object");
    }

    Optional<RegisteredTool> tool = toolRegistry.find(name);
    if (tool.isEmpty()) {
      log.debug("tools/call for unknown tool {}", name);
      return JsonRpcResponse.failure(id, METHOD_NOT_FOUND, "Unknown tool: " + name,
          Map.of("name", name));
    }
    try {
      List<ContentBlock> content = tool.get().handler().call(arguments, context);
      return JsonRpcResponse.success(id,
          CallToolResult.completed(content == null ? List.of() : content));
    } catch (ToolExecutionException e) {
      log.info("Tool {} failed for subject={}: {}", name, context.subject(), e.getMessage());
      String message = e.getMessage();
      return JsonRpcResponse.success(id, CallToolResult.failed(
          message == null || message.isBlank() ? genericFailure(name) : message));
    } catch (RuntimeException e) {
      log.warn("Tool {} raised an unexpected exception", name, e);
      return JsonRpcResponse.success(id, CallToolResult.failed(genericFailure(name)));
    }
  }

  private static String genericFailure(String toolName) {
    return "Tool '" + toolName + "' failed";
  }

  private record SessionResolution(McpSession session, DispatchResult failure) {

    static SessionResolution of(McpSession session) {
      return new SessionResolution(session, null);
    }

    static SessionResolution failed(DispatchResult failure) {
      return new SessionResolution(null, failure);
    }
  }
}
