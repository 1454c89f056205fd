package com.codeheadsystems.quartermaster.server.auth;

/**
 * Establishes who is authorizing a client, and whether they agree.
 * <p>
 * Implementations plug a real identity provider or consent screen in between the receipt of
 * an authorization request and code issuance. The code and redirect mechanics do not change.
 */
public interface ConsentProvider {

  /**
   * Obtains consent for the request.
   *
   * @param request the validated authorization request
   * @return the decision; never null
   */
  ConsentDecision obtainConsent(ConsentRequest request);
}
