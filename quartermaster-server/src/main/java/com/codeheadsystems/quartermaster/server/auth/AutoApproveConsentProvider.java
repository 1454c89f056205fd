package com.codeheadsystems.quartermaster.server.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approves every request as a single configured subject.
 * <p>
 * Performs no identity verification. Suitable for development and single-user deployments only.
 */
public class AutoApproveConsentProvider implements ConsentProvider {

  private static final Logger log = LoggerFactory.getLogger(AutoApproveConsentProvider.class);

  private final String subject;

  public AutoApproveConsentProvider(String subject) {
    this.subject = subject;
    log.warn("AutoApproveConsentProvider approves every authorization request as '{}'", subject);
  }

  @Override
  public ConsentDecision obtainConsent(ConsentRequest request) {
    log.debug("Auto-approving client_id={} for subject={}", request.clientId(), subject);
    return ConsentDecision.granted(subject);
  }
}
