package com.codeheadsystems.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Login result for deployments using the Basic scheme. Nothing is issued: the client keeps
 * sending its username and password on every protected request.
 *
 * @param message  human-readable confirmation
 * @param username the username that logged in
 * @param role     the account's role, absent unless the deployment is role-aware
 * @param profile  the account's profile fields, absent when none were stored
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BasicLoginResponse(
    @JsonProperty("message") String message,
    @JsonProperty("username") String username,
    @JsonProperty("role") String role,
    @JsonProperty("profile") Map<String, Object> profile) implements LoginResponse {
}
