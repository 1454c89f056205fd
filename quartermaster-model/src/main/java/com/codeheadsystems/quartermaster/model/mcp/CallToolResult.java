package com.codeheadsystems.quartermaster.model.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result payload of {@code tools/call}.
 * <p>
 * Tool-level failures are domain results, not protocol errors: they travel inside a successful
 * JSON-RPC envelope with {@code success=false}, {@code isError=true} and a non-empty
 * {@code error} message. The same message is also the single text content block so that
 * clients that only read {@code content} still see it.
 *
 * @param content the content blocks produced by the tool
 * @param isError MCP error flag
 * @param success true when the tool completed
 * @param error   failure message, omitted on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallToolResult(
    @JsonProperty("content") List<ContentBlock> content,
    @JsonProperty("isError") boolean isError,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error) {

  /**
   * Builds a successful result.
   *
   * @param content the content blocks
   * @return the result
   */
  public static CallToolResult completed(List<ContentBlock> content) {
    return new CallToolResult(List.copyOf(content), false, true, null);
  }

  /**
   * Builds a failed result.
   *
   * @param message human-readable failure message
   * @return the result
   */
  public static CallToolResult failed(String message) {
    return new CallToolResult(List.of(ContentBlock.text(message)), true, false, message);
  }
}
