package com.codeheadsystems.gatekeeper.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.gatekeeper.server.store.CredentialStore;

/**
 * Health check that verifies the credential document can be read.
 */
public class CredentialStoreHealthCheck extends HealthCheck {

  private final CredentialStore credentialStore;

  /**
   * Instantiates a new credential store health check.
   *
   * @param credentialStore the credential store
   */
  public CredentialStoreHealthCheck(CredentialStore credentialStore) {
    this.credentialStore = credentialStore;
  }

  @Override
  protected Result check() {
    if (!credentialStore.isReadable()) {
      return Result.unhealthy("Credential document cannot be read");
    }
    return Result.healthy("users=%d", credentialStore.load().size());
  }
}
