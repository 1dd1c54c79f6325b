package com.codeheadsystems.gatekeeper.dropwizard.auth;

import com.codeheadsystems.gatekeeper.model.ErrorResponse;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import jakarta.ws.rs.ForbiddenException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Turns the {@link ForbiddenException} thrown for a failed {@code @RolesAllowed} check into the
 * standard JSON error body.
 */
@Provider
public class ForbiddenExceptionMapper implements ExceptionMapper<ForbiddenException> {

  @Override
  public Response toResponse(ForbiddenException exception) {
    AuthFailureException.Category category = AuthFailureException.Category.FORBIDDEN;
    return Response.status(category.status())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(category.status(), category.externalMessage()))
        .build();
  }
}
