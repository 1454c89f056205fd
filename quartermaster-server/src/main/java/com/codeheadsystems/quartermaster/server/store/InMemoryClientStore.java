package com.codeheadsystems.quartermaster.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link ClientStore}. Registrations are lost on server restart.
 */
public class InMemoryClientStore implements ClientStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryClientStore.class);

  private final ConcurrentHashMap<String, ClientRegistration> clients = new ConcurrentHashMap<>();

  public InMemoryClientStore() {
    log.warn("InMemoryClientStore: client registrations will NOT survive restarts");
  }

  @Override
  public void store(ClientRegistration registration) {
    clients.put(registration.clientId(), registration);
    log.debug("Registered client_id={} name={}", registration.clientId(), registration.clientName());
  }

  @Override
  public Optional<ClientRegistration> load(String clientId) {
    return clientId == null ? Optional.empty() : Optional.ofNullable(clients.get(clientId));
  }
}
