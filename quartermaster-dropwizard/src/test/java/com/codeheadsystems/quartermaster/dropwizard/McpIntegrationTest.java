package com.codeheadsystems.quartermaster.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the MCP endpoint: authentication, sessions and the inventory tools.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class McpIntegrationTest {

  static final DropwizardAppExtension<QuartermasterConfiguration> APP =
      new DropwizardAppExtension<>(
          QuartermasterApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String INITIALIZE = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
      + "\"params\":{\"protocolVersion\":\"2024-11-05\",\"capabilities\":{},"
      + "\"clientInfo\":{\"name\":\"it\",\"version\":\"1\"}}}";

  private final ObjectMapper mapper = new ObjectMapper();
  private HttpClient httpClient;
  private String token;

  @BeforeEach
  void setUp() throws Exception {
    httpClient = HttpClient.newHttpClient();
    token = new OAuthTestClient(httpClient, mapper, baseUrl()).obtainToken();
  }

  @Test
  void withoutToken_returns401WithChallenge() throws Exception {
    HttpResponse<String> response = post(null, null, INITIALIZE);

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).hasValueSatisfying(h -> assertThat(h)
        .startsWith("Bearer realm=\"MCP Server\"")
        .contains("resource_metadata=\"" + baseUrl() + "/.well-known/oauth-protected-resource\""));
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("error").get("code").asInt()).isEqualTo(-32000);
    assertThat(body.get("id").asInt()).isEqualTo(1);
  }

  @Test
  void initialize_returnsSessionAndNegotiatedVersion() throws Exception {
    HttpResponse<String> response = post(token, null, INITIALIZE);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.headers().firstValue("Mcp-Session-Id")).isPresent();
    JsonNode result = mapper.readTree(response.body()).get("result");
    assertThat(result.get("protocolVersion").asText()).isEqualTo("2024-11-05");
    assertThat(result.get("serverInfo").get("name").asText()).isEqualTo("Quartermaster Inventory Server");
    assertThat(result.get("capabilities").get("tools").get("listChanged").asBoolean()).isFalse();
  }

  @Test
  void searchThenFetch_withinSession() throws Exception {
    String sessionId = initialize();

    HttpResponse<String> search = post(token, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":2,"
        + "\"method\":\"tools/call\",\"params\":{\"name\":\"search\",\"arguments\":{\"query\":\"milk\"}}}");

    assertThat(search.statusCode()).isEqualTo(200);
    assertThat(search.headers().firstValue("Mcp-Session-Id")).contains(sessionId);
    JsonNode searchResult = mapper.readTree(search.body()).get("result");
    JsonNode hits = mapper.readTree(searchResult.get("content").get(0).get("text").asText()).get("results");
    assertThat(hits.size()).isEqualTo(1);
    assertThat(hits.get(0).get("id").asText()).isEqualTo("item-1");

    HttpResponse<String> fetch = post(token, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":3,"
        + "\"method\":\"tools/call\",\"params\":{\"name\":\"fetch\",\"arguments\":{\"id\":\"item-1\"}}}");

    JsonNode doc = mapper.readTree(
        mapper.readTree(fetch.body()).get("result").get("content").get(0).get("text").asText());
    assertThat(doc.get("title").asText()).isEqualTo("Item: Milk");
    assertThat(doc.get("metadata").get("location").asText()).isEqualTo("fridge");
  }

  @Test
  void fetchUnknownItem_isToolErrorNotProtocolError() throws Exception {
    String sessionId = initialize();

    HttpResponse<String> response = post(token, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":4,"
        + "\"method\":\"tools/call\",\"params\":{\"name\":\"fetch\",\"arguments\":{\"id\":\"item-999\"}}}");

    assertThat(response.statusCode()).isEqualTo(200);
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.has("error")).isFalse();
    assertThat(body.get("result").get("isError").asBoolean()).isTrue();
  }

  @Test
  void unknownTool_isMethodNotFound() throws Exception {
    String sessionId = initialize();

    HttpResponse<String> response = post(token, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":8,"
        + "\"method\":\"tools/call\",\"params\":{\"name\":\"nonexistent\",\"arguments\":{}}}");

    assertThat(response.statusCode()).isEqualTo(200);
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("error").get("code").asInt()).isEqualTo(-32601);
    assertThat(body.get("id").asInt()).isEqualTo(8);
  }

  @Test
  void toolsList_returnsBothTools() throws Exception {
    String sessionId = initialize();

    HttpResponse<String> response = post(token, sessionId,
        "{\"jsonrpc\":\"2.0\",\"id\":\"list\",\"method\":\"tools/list\"}");

    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("id").asText()).isEqualTo("list");
    JsonNode tools = body.get("result").get("tools");
    assertThat(tools.size()).isEqualTo(2);
    assertThat(tools.get(0).get("name").asText()).isEqualTo("fetch");
    assertThat(tools.get(1).get("name").asText()).isEqualTo("search");
  }

  @Test
  void notification_returns202WithoutBody() throws Exception {
    String sessionId = initialize();

    HttpResponse<String> response = post(token, sessionId,
        "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

    assertThat(response.statusCode()).isEqualTo(202);
    assertThat(response.body()).isEmpty();
  }

  @Test
  void malformedJson_isParseError() throws Exception {
    HttpResponse<String> response = post(token, null, "{not json");

    assertThat(response.statusCode()).isEqualTo(400);
    JsonNode body = mapper.readTree(response.body());
    assertThat(body.get("error").get("code").asInt()).isEqualTo(-32700);
    assertThat(body.get("id").isNull()).isTrue();
  }

  @Test
  void scalarIds_areEchoedAsSent() throws Exception {
    String sessionId = initialize();

    HttpResponse<String> exponent = post(token, sessionId,
        "{\"jsonrpc\":\"2.0\",\"id\":1e2,\"method\":\"ping\"}");
    HttpResponse<String> bool = post(token, sessionId,
        "{\"jsonrpc\":\"2.0\",\"id\":true,\"method\":\"ping\"}");

    assertThat(exponent.statusCode()).isEqualTo(200);
    assertThat(exponent.body()).contains("\"id\":1e2");
    assertThat(bool.statusCode()).isEqualTo(200);
    assertThat(mapper.readTree(bool.body()).get("id").asBoolean()).isTrue();
  }

  @Test
  void missingSessionHeader_isRecovered() throws Exception {
    HttpResponse<String> response = post(token, null,
        "{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"ping\"}");

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.headers().firstValue("Mcp-Session-Id")).isPresent();
  }

  @Test
  void session_isUsableByAnotherClientOfSameSubject() throws Exception {
    String sessionId = initialize();
    String otherToken = new OAuthTestClient(httpClient, mapper, baseUrl()).obtainToken();
    HttpResponse<String> sameSubject = post(otherToken, sessionId,
        "{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"ping\"}");

    assertThat(sameSubject.statusCode()).isEqualTo(200);
  }

  @Test
  void delete_terminatesSession() throws Exception {
    String sessionId = initialize();

    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + "/mcp"))
            .header("Authorization", "Bearer " + token)
            .header("Mcp-Session-Id", sessionId)
            .DELETE()
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(204);
  }

  @Test
  void delete_withoutSessionHeader_returns400() throws Exception {
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + "/mcp"))
            .header("Authorization", "Bearer " + token)
            .DELETE()
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(400);
  }

  @Test
  void delete_withoutToken_returns401() throws Exception {
    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + "/mcp"))
            .header("Mcp-Session-Id", "whatever")
            .DELETE()
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).isPresent();
  }

  private String initialize() throws Exception {
    HttpResponse<String> response = post(token, null, INITIALIZE);
    assertThat(response.statusCode()).isEqualTo(200);
    return response.headers().firstValue("Mcp-Session-Id").orElseThrow();
  }

  private HttpResponse<String> post(String bearer, String sessionId, String body) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/mcp"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body));
    if (bearer != null) {
      builder.header("Authorization", "Bearer " + bearer);
    }
    if (sessionId != null) {
      builder.header("Mcp-Session-Id", sessionId);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return "http://localhost:" + APP.getLocalPort();
  }
}
