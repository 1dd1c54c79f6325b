package com.codeheadsystems.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned with HTTP 201 after a successful registration.
 *
 * @param message  human-readable confirmation
 * @param username the username that was registered
 */
public record RegistrationResponse(
    @JsonProperty("message") String message,
    @JsonProperty("username") String username) {
}
