package com.codeheadsystems.gatekeeper.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse permission label carried by accounts in role-aware deployments.
 */
public enum Role {

  ADMIN("admin"),
  CUSTOMER("customer");

  private final String wireName;

  Role(String wireName) {
    this.wireName = wireName;
  }

  /**
   * The lowest-privilege role, assigned when registration does not ask for one.
   *
   * @return {@link #CUSTOMER}
   */
  public static Role defaultRole() {
    return CUSTOMER;
  }

  /**
   * Parses the persisted / wire form of a role.
   *
   * @param name {@code admin} or {@code customer}
   * @return the role
   * @throws IllegalArgumentException for any other value
   */
  @JsonCreator
  public static Role fromName(String name) {
    for (Role role : values()) {
      if (role.wireName.equals(name)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown role: " + name);
  }

  /**
   * The persisted / wire form.
   *
   * @return the lower-case role name
   */
  @JsonValue
  public String wireName() {
    return wireName;
  }
}
