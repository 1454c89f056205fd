package com.codeheadsystems.quartermaster.model.jsonrpc;

/**
 * Error codes used in JSON-RPC error envelopes.
 */
public final class JsonRpcErrorCodes {

  /**
   * The body was not valid JSON.
   */
  public static final int PARSE_ERROR = -32700;

  /**
   * The body was JSON but not a valid JSON-RPC 2.0 request.
   */
  public static final int INVALID_REQUEST = -32600;

  /**
   * Unknown method, or unknown tool on {@code tools/call}.
   */
  public static final int METHOD_NOT_FOUND = -32601;

  /**
   * Method parameters were missing or of the wrong shape.
   */
  public static final int INVALID_PARAMS = -32602;

  /**
   * Unexpected server-side failure. Details are logged, never returned.
   */
  public static final int INTERNAL_ERROR = -32603;

  /**
   * Authentication failed before dispatch.
   */
  public static final int UNAUTHENTICATED = -32000;

  /**
   * The session id was missing, unknown, or bound to a different principal.
   */
  public static final int SESSION_ERROR = -32001;

  private JsonRpcErrorCodes() {
  }
}
