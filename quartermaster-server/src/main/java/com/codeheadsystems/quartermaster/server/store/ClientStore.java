package com.codeheadsystems.quartermaster.server.store;

import java.util.Optional;

/**
 * Storage for dynamically registered clients. Implementations must be thread-safe.
 */
public interface ClientStore {

  void store(ClientRegistration registration);

  Optional<ClientRegistration> load(String clientId);
}
