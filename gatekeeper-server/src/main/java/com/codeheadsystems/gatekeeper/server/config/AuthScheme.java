package com.codeheadsystems.gatekeeper.server.config;

import java.util.Locale;

/**
 * How clients prove their identity on protected requests. Chosen once per deployment.
 */
public enum AuthScheme {

  /**
   * Username and password on every request ({@code Authorization: Basic ...}).
   */
  BASIC("Basic"),

  /**
   * A signed session token obtained from the login endpoint ({@code Authorization: Bearer ...}).
   */
  BEARER("Bearer");

  private final String prefix;

  AuthScheme(String prefix) {
    this.prefix = prefix;
  }

  /**
   * Parses a scheme name, ignoring case.
   *
   * @param name {@code BASIC} or {@code BEARER}
   * @return the scheme
   * @throws IllegalArgumentException for any other value
   */
  public static AuthScheme fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Auth scheme must not be null");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown auth scheme: " + name, e);
    }
  }

  /**
   * The {@code Authorization} header prefix for this scheme.
   *
   * @return {@code Basic} or {@code Bearer}
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Builds the {@code WWW-Authenticate} challenge sent with 401 responses.
   *
   * @param realm the protection realm
   * @return e.g. {@code Bearer realm="gatekeeper"}
   */
  public String challenge(String realm) {
    return String.format("%s realm=\"%s\"", prefix, realm);
  }
}
