package com.codeheadsystems.gatekeeper.server.resource;

import com.codeheadsystems.gatekeeper.model.ErrorResponse;
import com.codeheadsystems.gatekeeper.model.LoginRequest;
import com.codeheadsystems.gatekeeper.model.LoginResponse;
import com.codeheadsystems.gatekeeper.model.RegistrationRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationResponse;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperSettings;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.exception.PersistenceException;
import com.codeheadsystems.gatekeeper.server.manager.GatekeeperAuthManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for account registration and login.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/register} creates an account, 201 on success</li>
 *   <li>{@code POST /auth/login} verifies credentials; issues a token under the bearer scheme</li>
 * </ul>
 * Every error response carries an {@link ErrorResponse} body. 401 responses also carry the
 * deployment's {@code WWW-Authenticate} challenge.
 */
@Singleton
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final GatekeeperAuthManager manager;
  private final String challenge;

  /**
   * Instantiates a new auth resource.
   *
   * @param manager the manager
   */
  @Inject
  public AuthResource(GatekeeperAuthManager manager) {
    this.manager = manager;
    GatekeeperSettings settings = manager.settings();
    this.challenge = settings.authScheme().challenge(settings.realm());
  }

  /**
   * Registers a new account.
   *
   * @param request the request
   * @return 201 with a {@link RegistrationResponse}
   */
  @POST
  @Path("/register")
  public Response register(RegistrationRequest request) {
    log.debug("register({})", request);
    requireBody(request);
    try {
      RegistrationResponse response = manager.register(request);
      return Response.status(Response.Status.CREATED).entity(response).build();
    } catch (IllegalArgumentException e) {
      throw error(Response.Status.BAD_REQUEST, e.getMessage());
    } catch (PersistenceException e) {
      log.error("Registration of {} failed: {}", request.username(), e.getMessage());
      throw error(Response.Status.INTERNAL_SERVER_ERROR, PersistenceException.EXTERNAL_MESSAGE);
    }
  }

  /**
   * Verifies credentials.
   *
   * @param request the request
   * @return the scheme-specific login response
   */
  @POST
  @Path("/login")
  public LoginResponse login(LoginRequest request) {
    log.debug("login({})", request);
    requireBody(request);
    try {
      return manager.login(request);
    } catch (IllegalArgumentException e) {
      throw error(Response.Status.BAD_REQUEST, e.getMessage());
    } catch (AuthFailureException e) {
      throw unauthorized(e);
    }
  }

  private WebApplicationException unauthorized(AuthFailureException e) {
    Response response = Response.status(e.category().status())
        .header(HttpHeaders.WWW_AUTHENTICATE, challenge)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(e.category().status(), e.getMessage()))
        .build();
    return new WebApplicationException(e.getMessage(), response);
  }

  private static void requireBody(Object request) {
    if (request == null) {
      throw error(Response.Status.BAD_REQUEST, "Missing request body");
    }
  }

  private static WebApplicationException error(Response.Status status, String message) {
    Response response = Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(status.getStatusCode(), message))
        .build();
    return new WebApplicationException(message, response);
  }
}
