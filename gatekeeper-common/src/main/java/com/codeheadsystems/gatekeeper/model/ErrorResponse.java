package com.codeheadsystems.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of every error response, mirroring Dropwizard's own error shape.
 *
 * @param code    the HTTP status code
 * @param message the externally visible message
 */
public record ErrorResponse(
    @JsonProperty("code") int code,
    @JsonProperty("message") String message) {
}
