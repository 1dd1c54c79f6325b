package com.codeheadsystems.gatekeeper.testserver;

import com.codeheadsystems.gatekeeper.dropwizard.auth.GatekeeperPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.annotation.security.RolesAllowed;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.Map;

/**
 * Administrator-only endpoint. Needs {@code roleAware: true}; otherwise every caller is denied.
 */
@Path("/api/admin/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class AdminResource {

  @GET
  @RolesAllowed("admin")
  public Map<String, String> whoAmI(@Auth GatekeeperPrincipal principal) {
    return Map.of("username", principal.getName(), "role", principal.role().wireName());
  }
}
