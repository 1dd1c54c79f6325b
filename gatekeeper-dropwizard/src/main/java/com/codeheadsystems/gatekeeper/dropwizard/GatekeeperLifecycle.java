package com.codeheadsystems.gatekeeper.dropwizard;

import com.codeheadsystems.gatekeeper.server.manager.RegistrationManager;
import com.codeheadsystems.gatekeeper.server.store.CredentialStore;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the credential store before Jetty accepts requests, ensures the default administrator
 * exists, and closes the store on shutdown.
 */
public class GatekeeperLifecycle implements Managed {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperLifecycle.class);

  private final CredentialStore credentialStore;
  private final RegistrationManager registrationManager;
  private final String adminUsername;
  private final String adminPassword;

  /**
   * Instantiates a new lifecycle.
   *
   * @param credentialStore     the store
   * @param registrationManager used for the administrator bootstrap
   * @param adminUsername       default administrator, or null for none
   * @param adminPassword       its initial password, or null for none
   */
  public GatekeeperLifecycle(CredentialStore credentialStore,
                             RegistrationManager registrationManager,
                             String adminUsername,
                             String adminPassword) {
    this.credentialStore = credentialStore;
    this.registrationManager = registrationManager;
    this.adminUsername = adminUsername;
    this.adminPassword = adminPassword;
  }

  @Override
  public void start() {
    credentialStore.start();
    if (adminUsername != null && adminPassword != null) {
      registrationManager.bootstrapAdministrator(adminUsername, adminPassword);
    }
    log.info("Credential store started");
  }

  @Override
  public void stop() {
    credentialStore.stop();
  }
}
