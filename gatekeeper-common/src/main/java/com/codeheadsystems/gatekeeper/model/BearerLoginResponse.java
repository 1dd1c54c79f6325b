package com.codeheadsystems.gatekeeper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login result for deployments using the Bearer scheme.
 * <p>
 * The token is a signed, self-contained JWT. It is not stored by the server and cannot be revoked;
 * it simply stops validating once {@code expiresInSeconds} have elapsed.
 *
 * @param token            the signed bearer token
 * @param tokenType        always {@code bearer}
 * @param username         the username embedded in the token
 * @param expiresInSeconds remaining lifetime of the token at issuance
 */
public record BearerLoginResponse(
    @JsonProperty("token") String token,
    @JsonProperty("tokenType") String tokenType,
    @JsonProperty("username") String username,
    @JsonProperty("expiresInSeconds") long expiresInSeconds) implements LoginResponse {

  /**
   * The token type reported for every bearer login.
   */
  public static final String TOKEN_TYPE = "bearer";
}
