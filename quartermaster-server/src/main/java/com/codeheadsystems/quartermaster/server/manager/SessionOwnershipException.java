package com.codeheadsystems.quartermaster.server.manager;

/**
 * A live session was presented by a subject other than the one it is bound to. Maps to HTTP 403.
 */
public class SessionOwnershipException extends SecurityException {

  public SessionOwnershipException(String message) {
    super(message);
  }
}
