package com.codeheadsystems.quartermaster.server.auth;

/**
 * Outcome of a consent step.
 *
 * @param granted whether the resource owner approved the request
 * @param subject the approving subject; null when denied
 */
public record ConsentDecision(boolean granted, String subject) {

  public static ConsentDecision granted(String subject) {
    return new ConsentDecision(true, subject);
  }

  public static ConsentDecision denied() {
    return new ConsentDecision(false, null);
  }
}
