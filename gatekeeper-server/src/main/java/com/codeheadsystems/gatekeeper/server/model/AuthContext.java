package com.codeheadsystems.gatekeeper.server.model;

import java.util.Map;
import java.util.Optional;

/**
 * The identity established for a single request after a credential or token verified.
 * <p>
 * Built fresh per request from the live credential store and never persisted. This is the only
 * identity representation business code and the authorization gate should trust.
 *
 * @param username the authenticated username
 * @param role     the account's role, or null when the deployment is not role-aware
 * @param profile  the account's profile fields
 */
public record AuthContext(String username, Role role, Map<String, Object> profile) {

  /**
   * Builds a context from a stored record, dropping the password digest.
   *
   * @param record the stored record
   * @return the context
   */
  public static AuthContext from(CredentialRecord record) {
    return new AuthContext(record.username(), record.role(), record.profile());
  }

  /**
   * The role, if the account has one.
   *
   * @return the role
   */
  public Optional<Role> optionalRole() {
    return Optional.ofNullable(role);
  }
}
