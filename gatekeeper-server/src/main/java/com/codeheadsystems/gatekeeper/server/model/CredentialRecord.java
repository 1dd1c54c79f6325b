package com.codeheadsystems.gatekeeper.server.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stored identity unit: the username, the digest of its password, an optional role and the
 * profile fields owned by the surrounding application.
 * <p>
 * The digest never leaves the core: {@link #toString()} masks it, and every view handed to
 * callers ({@link Account}, {@link AuthContext}) is built without it.
 *
 * @param username     unique, case-sensitive key
 * @param passwordHash output of the password hasher
 * @param role         the role, or null when the deployment is not role-aware
 * @param profile      free-form profile fields, never null, preserved verbatim
 */
public record CredentialRecord(
    String username,
    String passwordHash,
    Role role,
    Map<String, Object> profile) {

  /**
   * Normalizes the profile into an unmodifiable, insertion-ordered copy. Null profile values are
   * kept because the surrounding application writes them.
   */
  public CredentialRecord {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(passwordHash, "passwordHash");
    profile = profile == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(profile));
  }

  /**
   * The public view of this record.
   *
   * @return the account
   */
  public Account toAccount() {
    return new Account(username, role, profile);
  }

  @Override
  public String toString() {
    return "CredentialRecord[username=" + username + ", passwordHash=****, role=" + role
        + ", profile=" + profile.keySet() + "]";
  }
}
