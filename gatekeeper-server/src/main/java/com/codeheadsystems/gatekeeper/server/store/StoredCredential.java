package com.codeheadsystems.gatekeeper.server.store;

import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import com.codeheadsystems.gatekeeper.server.model.Role;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk form of one entry in the credential document:
 * <pre>{@code
 *   "alice": {"password_hash": "...", "role": "customer", "email": null, "full_name": "Alice"}
 * }</pre>
 * {@code password_hash} and {@code role} belong to the core; every other field is owned by the
 * surrounding application and is carried through untouched.
 */
class StoredCredential {

  @JsonProperty("password_hash")
  private String passwordHash;

  @JsonProperty("role")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  private Role role;

  private final Map<String, Object> extra = new LinkedHashMap<>();

  StoredCredential() {
  }

  static StoredCredential from(CredentialRecord record) {
    StoredCredential stored = new StoredCredential();
    stored.passwordHash = record.passwordHash();
    stored.role = record.role();
    stored.extra.putAll(record.profile());
    return stored;
  }

  CredentialRecord toRecord(String username) {
    return new CredentialRecord(username, passwordHash, role, extra);
  }

  boolean hasPasswordHash() {
    return passwordHash != null;
  }

  @JsonAnyGetter
  public Map<String, Object> extra() {
    return extra;
  }

  @JsonAnySetter
  public void putExtra(String name, Object value) {
    extra.put(name, value);
  }
}
