package com.codeheadsystems.quartermaster.model.jsonrpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 response envelope.
 * <p>
 * Exactly one of {@code result} or {@code error} is present. The {@code id} is always written,
 * as JSON {@code null} when the request id was null or could not be read, and is otherwise the
 * request's id node unchanged so numbers, strings and null round-trip without coercion.
 *
 * @param jsonrpc always {@code "2.0"}
 * @param id      the request id, echoed verbatim
 * @param result  the method result on success
 * @param error   the error on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(
    @JsonProperty("jsonrpc") String jsonrpc,
    @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("id") JsonNode id,
    @JsonProperty("result") Object result,
    @JsonProperty("error") JsonRpcError error) {

  /**
   * The only protocol version this envelope speaks.
   */
  public static final String VERSION = "2.0";

  /**
   * Builds a success envelope.
   *
   * @param id     the request id
   * @param result the result payload
   * @return the envelope
   */
  public static JsonRpcResponse success(JsonNode id, Object result) {
    return new JsonRpcResponse(VERSION, id, result, null);
  }

  /**
   * Builds an error envelope.
   *
   * @param id      the request id
   * @param code    the JSON-RPC error code
   * @param message a short description
   * @return the envelope
   */
  public static JsonRpcResponse failure(JsonNode id, int code, String message) {
    return new JsonRpcResponse(VERSION, id, null, new JsonRpcError(code, message, null));
  }

  /**
   * Builds an error envelope carrying structured error data.
   *
   * @param id      the request id
   * @param code    the JSON-RPC error code
   * @param message a short description
   * @param data    additional data, e.g. the offending tool name
   * @return the envelope
   */
  public static JsonRpcResponse failure(JsonNode id, int code, String message, Object data) {
    return new JsonRpcResponse(VERSION, id, null, new JsonRpcError(code, message, data));
  }
}
