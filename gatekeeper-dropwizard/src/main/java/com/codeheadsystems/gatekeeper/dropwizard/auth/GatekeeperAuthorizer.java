package com.codeheadsystems.gatekeeper.dropwizard.auth;

import com.codeheadsystems.gatekeeper.server.manager.GatekeeperAuthManager;
import com.codeheadsystems.gatekeeper.server.model.Role;
import io.dropwizard.auth.Authorizer;
import jakarta.ws.rs.container.ContainerRequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backs {@code @RolesAllowed} with the authorization gate. Role names are the wire names,
 * e.g. {@code @RolesAllowed("admin")}.
 */
public class GatekeeperAuthorizer implements Authorizer<GatekeeperPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperAuthorizer.class);

  private final GatekeeperAuthManager manager;

  /**
   * Instantiates a new authorizer.
   *
   * @param manager the auth manager
   */
  public GatekeeperAuthorizer(GatekeeperAuthManager manager) {
    this.manager = manager;
  }

  @Override
  public boolean authorize(GatekeeperPrincipal principal, String role,
                           ContainerRequestContext requestContext) {
    Role required;
    try {
      required = Role.fromName(role);
    } catch (IllegalArgumentException e) {
      log.warn("@RolesAllowed names an unknown role '{}', denying {}", role, principal.getName());
      return false;
    }
    boolean allowed = manager.isAllowed(principal.context(), required);
    if (!allowed) {
      log.warn("User {} with role {} denied, {} required", principal.getName(), principal.role(),
          required);
    }
    return allowed;
  }
}
