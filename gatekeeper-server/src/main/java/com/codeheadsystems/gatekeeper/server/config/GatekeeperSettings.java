package com.codeheadsystems.gatekeeper.server.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Consolidated settings for the authentication core.
 * <p>
 * Everything that varies between deployments is configured here rather than hardcoded, from the
 * registration length limits to the protected-request scheme.
 *
 * @param minUsernameLength minimum trimmed username length accepted at registration
 * @param minPasswordLength minimum password length accepted at registration
 * @param passwordSalt      application-wide salt appended to every password before hashing
 * @param tokenSecret       HMAC-SHA256 signing secret for bearer tokens
 * @param tokenIssuer       issuer claim written into and required from every bearer token
 * @param tokenTtl          lifetime of an issued bearer token
 * @param roleAware         whether accounts carry a role used by the authorization gate
 * @param authScheme        the scheme protected requests use
 * @param realm             realm reported in {@code WWW-Authenticate} challenges
 */
public record GatekeeperSettings(
    int minUsernameLength,
    int minPasswordLength,
    String passwordSalt,
    byte[] tokenSecret,
    String tokenIssuer,
    Duration tokenTtl,
    boolean roleAware,
    AuthScheme authScheme,
    String realm) {

  /**
   * Default minimum username length.
   */
  public static final int DEFAULT_MIN_USERNAME_LENGTH = 3;

  /**
   * Default minimum password length.
   */
  public static final int DEFAULT_MIN_PASSWORD_LENGTH = 6;

  /**
   * Default bearer token lifetime.
   */
  public static final Duration DEFAULT_TOKEN_TTL = Duration.ofMinutes(30);

  /**
   * Validates the settings.
   */
  public GatekeeperSettings {
    if (minUsernameLength < 1) {
      throw new IllegalArgumentException("minUsernameLength must be at least 1");
    }
    if (minPasswordLength < 1) {
      throw new IllegalArgumentException("minPasswordLength must be at least 1");
    }
    Objects.requireNonNull(passwordSalt, "passwordSalt");
    Objects.requireNonNull(tokenSecret, "tokenSecret");
    if (tokenSecret.length == 0) {
      throw new IllegalArgumentException("tokenSecret must not be empty");
    }
    Objects.requireNonNull(tokenIssuer, "tokenIssuer");
    Objects.requireNonNull(tokenTtl, "tokenTtl");
    if (tokenTtl.isNegative() || tokenTtl.isZero()) {
      throw new IllegalArgumentException("tokenTtl must be positive");
    }
    Objects.requireNonNull(authScheme, "authScheme");
    Objects.requireNonNull(realm, "realm");
    tokenSecret = tokenSecret.clone();
  }

  /**
   * Settings with the library defaults and the supplied secret material.
   *
   * @param passwordSalt the password salt
   * @param tokenSecret  the token signing secret
   * @return bearer-scheme, non-role-aware settings
   */
  public static GatekeeperSettings defaults(String passwordSalt, byte[] tokenSecret) {
    return new GatekeeperSettings(DEFAULT_MIN_USERNAME_LENGTH, DEFAULT_MIN_PASSWORD_LENGTH,
        passwordSalt, tokenSecret, "gatekeeper", DEFAULT_TOKEN_TTL, false, AuthScheme.BEARER,
        "gatekeeper");
  }

  @Override
  public byte[] tokenSecret() {
    return tokenSecret.clone();
  }

  /**
   * Copy of these settings with a different role-awareness flag.
   *
   * @param aware whether accounts carry a role
   * @return the new settings
   */
  public GatekeeperSettings withRoleAware(boolean aware) {
    return new GatekeeperSettings(minUsernameLength, minPasswordLength, passwordSalt, tokenSecret,
        tokenIssuer, tokenTtl, aware, authScheme, realm);
  }

  /**
   * Copy of these settings with a different scheme.
   *
   * @param scheme the scheme
   * @return the new settings
   */
  public GatekeeperSettings withAuthScheme(AuthScheme scheme) {
    return new GatekeeperSettings(minUsernameLength, minPasswordLength, passwordSalt, tokenSecret,
        tokenIssuer, tokenTtl, roleAware, scheme, realm);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof GatekeeperSettings other
        && minUsernameLength == other.minUsernameLength
        && minPasswordLength == other.minPasswordLength
        && roleAware == other.roleAware
        && passwordSalt.equals(other.passwordSalt)
        && Arrays.equals(tokenSecret, other.tokenSecret)
        && tokenIssuer.equals(other.tokenIssuer)
        && tokenTtl.equals(other.tokenTtl)
        && authScheme == other.authScheme
        && realm.equals(other.realm);
  }

  @Override
  public int hashCode() {
    return Objects.hash(minUsernameLength, minPasswordLength, passwordSalt,
        Arrays.hashCode(tokenSecret), tokenIssuer, tokenTtl, roleAware, authScheme, realm);
  }

  @Override
  public String toString() {
    return "GatekeeperSettings[minUsernameLength=" + minUsernameLength
        + ", minPasswordLength=" + minPasswordLength
        + ", tokenIssuer=" + tokenIssuer
        + ", tokenTtl=" + tokenTtl
        + ", roleAware=" + roleAware
        + ", authScheme=" + authScheme
        + ", realm=" + realm + "]";
  }
}
