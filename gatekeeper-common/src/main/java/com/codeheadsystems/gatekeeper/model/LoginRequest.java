package com.codeheadsystems.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for exchanging a username and password for a login result.
 * <p>
 * Used by: {@code POST /auth/login}
 *
 * @param username the username
 * @param password the plaintext password
 */
public record LoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {

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
    return "LoginRequest[username=" + username + "]";
  }
}
