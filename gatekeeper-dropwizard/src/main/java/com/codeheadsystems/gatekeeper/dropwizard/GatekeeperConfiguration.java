package com.codeheadsystems.gatekeeper.dropwizard;

import com.codeheadsystems.gatekeeper.server.config.AuthScheme;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Dropwizard configuration for the gatekeeper authentication core.
 * <p>
 * For production, set {@code storePath} so accounts survive restarts and {@code tokenSecretHex}
 * (a hex-encoded random value of at least 32 bytes) so issued tokens survive restarts. Leaving
 * either empty falls back to an in-memory store or a random secret (dev/test only).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class GatekeeperConfiguration extends Configuration {

  /**
   * Location of the JSON credential document. Empty keeps accounts in memory.
   */
  @NotNull
  private String storePath = "";

  /**
   * {@code BASIC} or {@code BEARER}.
   */
  @NotEmpty
  private String authScheme = AuthScheme.BEARER.name();

  @Min(1)
  private int minUsernameLength = GatekeeperSettings.DEFAULT_MIN_USERNAME_LENGTH;

  @Min(1)
  private int minPasswordLength = GatekeeperSettings.DEFAULT_MIN_PASSWORD_LENGTH;

  /**
   * Application-wide salt appended to every password before hashing. Changing it invalidates
   * every stored password.
   */
  @NotEmpty
  private String passwordSalt = "gatekeeper_salt";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for bearer tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String tokenSecretHex = "";

  @NotEmpty
  private String tokenIssuer = "gatekeeper";

  /**
   * Bearer token lifetime in seconds.
   */
  @Min(1)
  private long tokenTtlSeconds = GatekeeperSettings.DEFAULT_TOKEN_TTL.toSeconds();

  /**
   * Whether accounts carry a role checked by {@code @RolesAllowed}.
   */
  private boolean roleAware = false;

  @NotEmpty
  private String realm = "gatekeeper";

  /**
   * Username of the administrator created at startup when role-aware. Empty disables it.
   */
  private String defaultAdminUsername = "";

  private String defaultAdminPassword = "";

  /**
   * Builds the core settings.
   *
   * @param tokenSecret the resolved signing secret
   * @return the settings
   */
  public GatekeeperSettings toSettings(byte[] tokenSecret) {
    return new GatekeeperSettings(minUsernameLength, minPasswordLength, passwordSalt, tokenSecret,
        tokenIssuer, Duration.ofSeconds(tokenTtlSeconds), roleAware,
        AuthScheme.fromName(authScheme), realm);
  }

  /**
   * Whether a default administrator should be ensured at startup.
   *
   * @return true if role-aware and both username and password are configured
   */
  public boolean hasDefaultAdmin() {
    return roleAware
        && defaultAdminUsername != null && !defaultAdminUsername.isEmpty()
        && defaultAdminPassword != null && !defaultAdminPassword.isEmpty();
  }

  @JsonProperty
  public String getStorePath() {
    return storePath;
  }

  @JsonProperty
  public void setStorePath(String storePath) {
    this.storePath = storePath;
  }

  @JsonProperty
  public String getAuthScheme() {
    return authScheme;
  }

  @JsonProperty
  public void setAuthScheme(String authScheme) {
    this.authScheme = authScheme;
  }

  @JsonProperty
  public int getMinUsernameLength() {
    return minUsernameLength;
  }

  @JsonProperty
  public void setMinUsernameLength(int minUsernameLength) {
    this.minUsernameLength = minUsernameLength;
  }

  @JsonProperty
  public int getMinPasswordLength() {
    return minPasswordLength;
  }

  @JsonProperty
  public void setMinPasswordLength(int minPasswordLength) {
    this.minPasswordLength = minPasswordLength;
  }

  @JsonProperty
  public String getPasswordSalt() {
    return passwordSalt;
  }

  @JsonProperty
  public void setPasswordSalt(String passwordSalt) {
    this.passwordSalt = passwordSalt;
  }

  @JsonProperty
  public String getTokenSecretHex() {
    return tokenSecretHex;
  }

  @JsonProperty
  public void setTokenSecretHex(String tokenSecretHex) {
    this.tokenSecretHex = tokenSecretHex;
  }

  @JsonProperty
  public String getTokenIssuer() {
    return tokenIssuer;
  }

  @JsonProperty
  public void setTokenIssuer(String tokenIssuer) {
    this.tokenIssuer = tokenIssuer;
  }

  @JsonProperty
  public long getTokenTtlSeconds() {
    return tokenTtlSeconds;
  }

  @JsonProperty
  public void setTokenTtlSeconds(long tokenTtlSeconds) {
    this.tokenTtlSeconds = tokenTtlSeconds;
  }

  @JsonProperty
  public boolean isRoleAware() {
    return roleAware;
  }

  @JsonProperty
  public void setRoleAware(boolean roleAware) {
    this.roleAware = roleAware;
  }

  @JsonProperty
  public String getRealm() {
    return realm;
  }

  @JsonProperty
  public void setRealm(String realm) {
    this.realm = realm;
  }

  @JsonProperty
  public String getDefaultAdminUsername() {
    return defaultAdminUsername;
  }

  @JsonProperty
  public void setDefaultAdminUsername(String defaultAdminUsername) {
    this.defaultAdminUsername = defaultAdminUsername;
  }

  @JsonProperty
  public String getDefaultAdminPassword() {
    return defaultAdminPassword;
  }

  @JsonProperty
  public void setDefaultAdminPassword(String defaultAdminPassword) {
    this.defaultAdminPassword = defaultAdminPassword;
  }
}
