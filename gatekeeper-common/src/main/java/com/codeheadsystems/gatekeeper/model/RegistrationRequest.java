package com.codeheadsystems.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for creating a new account.
 * <p>
 * The password travels in plaintext inside the request body and is hashed by the server before
 * anything is persisted. {@code role} is only honored by role-aware deployments and defaults to
 * {@code customer} there; {@code email} and {@code full_name} are free-form profile fields the
 * server stores without interpreting them.
 * <p>
 * Used by: {@code POST /auth/register}
 *
 * @param username the requested username, unique and case-sensitive
 * @param password the plaintext password
 * @param role     optional role name ({@code admin} or {@code customer})
 * @param email    optional email address
 * @param fullName optional display name
 */
public record RegistrationRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("role") String role,
    @JsonProperty("email") String email,
    @JsonProperty("full_name") String fullName) {

  /**
   * Convenience constructor for a request without role or profile fields.
   *
   * @param username the username
   * @param password the password
   */
  public RegistrationRequest(String username, String password) {
    this(username, password, null, null, null);
  }

  /**
   * Returns the username, rejecting a missing value.
   *
   * @return the username
   * @throws IllegalArgumentException if the username is null
   */
  public String requireUsername() {
    return require(username, "username");
  }

  /**
   * Returns the password, rejecting a missing value.
   *
   * @return the password
   * @throws IllegalArgumentException if the password is null
   */
  public String requirePassword() {
    return require(password, "password");
  }

  private static String require(String value, String fieldName) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    return value;
  }

  @Override
  public String toString() {
    return "RegistrationRequest[username=" + username + ", role=" + role + "]";
  }
}
