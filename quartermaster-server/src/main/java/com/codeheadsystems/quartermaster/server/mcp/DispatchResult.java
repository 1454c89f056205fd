package com.codeheadsystems.quartermaster.server.mcp;

import com.codeheadsystems.quartermaster.model.jsonrpc.JsonRpcResponse;

/**
 * What the transport should send back for one JSON-RPC message.
 *
 * @param status    HTTP status
 * @param sessionId value for the {@code Mcp-Session-Id} response header, null for none
 * @param body      the envelope, null for an acknowledged notification
 */
public record DispatchResult(int status, String sessionId, JsonRpcResponse body) {

  /**
   * True when the caller must be sent an authentication challenge.
   *
   * @return whether the request failed authentication
   */
  public boolean unauthenticated() {
    return status == 401;
  }
}
