package com.codeheadsystems.gatekeeper.server.auth;

import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException.Reason;
import com.codeheadsystems.gatekeeper.server.model.AuthContext;
import com.codeheadsystems.gatekeeper.server.model.Role;
import jakarta.inject.Singleton;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an authenticated identity may perform an action that may require a role.
 */
@Singleton
public class AuthorizationGate {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

  /**
   * Whether {@code context} satisfies {@code requiredRole}.
   *
   * @param context      the authenticated identity
   * @param requiredRole the role the action needs, or null for any authenticated identity
   * @return true if allowed
   */
  public boolean isAllowed(AuthContext context, Role requiredRole) {
    Objects.requireNonNull(context, "context");
    return requiredRole == null || requiredRole == context.role();
  }

  /**
   * Fails unless {@code context} satisfies {@code requiredRole}.
   *
   * @param context      the authenticated identity
   * @param requiredRole the role the action needs, or null for any authenticated identity
   * @throws AuthFailureException with {@code FORBIDDEN} if denied
   */
  public void authorize(AuthContext context, Role requiredRole) {
    if (!isAllowed(context, requiredRole)) {
      log.warn("User {} with role {} denied, {} required", context.username(), context.role(),
          requiredRole);
      throw new AuthFailureException(Reason.FORBIDDEN);
    }
  }
}
