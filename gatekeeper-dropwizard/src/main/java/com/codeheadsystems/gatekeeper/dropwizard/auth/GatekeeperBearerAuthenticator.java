package com.codeheadsystems.gatekeeper.dropwizard.auth;

import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.manager.GatekeeperAuthManager;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates bearer tokens.
 */
public class GatekeeperBearerAuthenticator implements Authenticator<String, GatekeeperPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperBearerAuthenticator.class);

  private final GatekeeperAuthManager manager;

  /**
   * Instantiates a new bearer authenticator.
   *
   * @param manager the auth manager
   */
  public GatekeeperBearerAuthenticator(GatekeeperAuthManager manager) {
    this.manager = manager;
  }

  @Override
  public Optional<GatekeeperPrincipal> authenticate(String token) {
    try {
      return Optional.of(new GatekeeperPrincipal(manager.authenticateBearer(token)));
    } catch (AuthFailureException e) {
      log.debug("Bearer authentication failed: {}", e.reason());
      return Optional.empty();
    }
  }
}
