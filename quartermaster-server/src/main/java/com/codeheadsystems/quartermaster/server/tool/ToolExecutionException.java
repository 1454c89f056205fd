package com.codeheadsystems.quartermaster.server.tool;

/**
 * A domain-level tool failure. The message is shown to the client.
 */
public class ToolExecutionException extends Exception {

  public ToolExecutionException(String message) {
    super(message);
  }

  public ToolExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
