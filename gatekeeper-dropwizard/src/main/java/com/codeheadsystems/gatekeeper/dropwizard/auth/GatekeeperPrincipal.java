package com.codeheadsystems.gatekeeper.dropwizard.auth;

import com.codeheadsystems.gatekeeper.server.model.AuthContext;
import com.codeheadsystems.gatekeeper.server.model.Role;
import java.security.Principal;

/**
 * Principal representing an authenticated gatekeeper user.
 *
 * @param context the identity resolved for this request
 */
public record GatekeeperPrincipal(AuthContext context) implements Principal {

  @Override
  public String getName() {
    return context.username();
  }

  /**
   * The account's role, or null when the deployment is not role-aware.
   *
   * @return the role
   */
  public Role role() {
    return context.role();
  }
}
