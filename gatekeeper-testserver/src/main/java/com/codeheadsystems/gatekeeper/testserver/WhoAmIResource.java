package com.codeheadsystems.gatekeeper.testserver;

import com.codeheadsystems.gatekeeper.dropwizard.auth.GatekeeperPrincipal;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Protected endpoint that echoes the authenticated identity back to the caller.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  @GET
  public Map<String, Object> whoAmI(@Auth GatekeeperPrincipal principal) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("username", principal.getName());
    if (principal.role() != null) {
      body.put("role", principal.role().wireName());
    }
    body.put("profile", principal.context().profile());
    return body;
  }
}
