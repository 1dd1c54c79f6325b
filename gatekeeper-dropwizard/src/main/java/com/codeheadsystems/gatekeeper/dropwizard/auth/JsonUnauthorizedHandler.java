package com.codeheadsystems.gatekeeper.dropwizard.auth;

import com.codeheadsystems.gatekeeper.model.ErrorResponse;
import io.dropwizard.auth.UnauthorizedHandler;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Answers rejected requests with a JSON {@link ErrorResponse} and the scheme's challenge.
 * The message is fixed per scheme so clients cannot tell why authentication failed.
 */
public class JsonUnauthorizedHandler implements UnauthorizedHandler {

  private final String message;

  /**
   * Instantiates a new handler.
   *
   * @param message the message every 401 carries
   */
  public JsonUnauthorizedHandler(String message) {
    this.message = message;
  }

  @Override
  public Response buildResponse(String prefix, String realm) {
    return Response.status(Response.Status.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, String.format("%s realm=\"%s\"", prefix, realm))
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(Response.Status.UNAUTHORIZED.getStatusCode(), message))
        .build();
  }
}
