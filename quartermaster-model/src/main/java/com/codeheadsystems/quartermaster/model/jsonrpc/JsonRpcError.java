package com.codeheadsystems.quartermaster.model.jsonrpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON-RPC 2.0 error object.
 *
 * @param code    numeric error code
 * @param message short description of the error
 * @param data    optional additional information, omitted when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcError(
    @JsonProperty("code") int code,
    @JsonProperty("message") String message,
    @JsonProperty("data") Object data) {
}
