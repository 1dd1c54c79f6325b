package com.codeheadsystems.gatekeeper.dropwizard.auth;

import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.manager.GatekeeperAuthManager;
import io.dropwizard.auth.Authenticator;
import io.dropwizard.auth.basic.BasicCredentials;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that verifies HTTP Basic credentials on every request.
 */
public class GatekeeperBasicAuthenticator
    implements Authenticator<BasicCredentials, GatekeeperPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperBasicAuthenticator.class);

  private final GatekeeperAuthManager manager;

  /**
   * Instantiates a new basic authenticator.
   *
   * @param manager the auth manager
   */
  public GatekeeperBasicAuthenticator(GatekeeperAuthManager manager) {
    this.manager = manager;
  }

  @Override
  public Optional<GatekeeperPrincipal> authenticate(BasicCredentials credentials) {
    try {
      return Optional.of(new GatekeeperPrincipal(
          manager.authenticateBasic(credentials.getUsername(), credentials.getPassword())));
    } catch (AuthFailureException e) {
      log.debug("Basic authentication failed: {}", e.reason());
      return Optional.empty();
    }
  }
}
