package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.server.config.GatekeeperSettings;
import com.codeheadsystems.gatekeeper.server.exception.RegistrationException;
import com.codeheadsystems.gatekeeper.server.hash.PasswordHasher;
import com.codeheadsystems.gatekeeper.server.model.Account;
import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import com.codeheadsystems.gatekeeper.server.model.Role;
import com.codeheadsystems.gatekeeper.server.store.CredentialStore;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates accounts.
 * <p>
 * The duplicate check and the write happen inside one {@link CredentialStore#update} cycle, so two
 * concurrent registrations of the same username cannot both succeed and concurrent registrations of
 * different usernames cannot overwrite each other.
 */
public class RegistrationManager {

  private static final Logger log = LoggerFactory.getLogger(RegistrationManager.class);

  private final CredentialStore credentialStore;
  private final PasswordHasher passwordHasher;
  private final GatekeeperSettings settings;

  /**
   * Instantiates a new registration manager.
   *
   * @param credentialStore the credential store
   * @param passwordHasher  the password hasher
   * @param settings        the settings
   */
  public RegistrationManager(CredentialStore credentialStore,
                             PasswordHasher passwordHasher,
                             GatekeeperSettings settings) {
    this.credentialStore = credentialStore;
    this.passwordHasher = passwordHasher;
    this.settings = settings;
  }

  /**
   * Registers a new account.
   * <p>
   * Rules are checked in order and the first violation wins: duplicate username, username too
   * short after trimming, password too short. The username is stored exactly as given.
   *
   * @param username  the username
   * @param plaintext the password
   * @param role      the requested role, or null for the default; ignored when not role-aware
   * @param profile   application-owned fields stored next to the digest, may be null
   * @return the created account
   * @throws RegistrationException                                                 on a rule
   *                                                                               violation
   * @throws com.codeheadsystems.gatekeeper.server.exception.PersistenceException if the store
   *                                                                               cannot be
   *                                                                               updated
   */
  public Account register(String username, String plaintext, Role role,
                          Map<String, Object> profile) {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(plaintext, "plaintext");
    Role effectiveRole = settings.roleAware()
        ? (role == null ? Role.defaultRole() : role)
        : null;

    Account account = credentialStore.update(records -> {
      if (records.containsKey(username)) {
        throw RegistrationException.duplicateUsername();
      }
      if (username.trim().length() < settings.minUsernameLength()) {
        throw RegistrationException.usernameTooShort(settings.minUsernameLength());
      }
      if (plaintext.length() < settings.minPasswordLength()) {
        throw RegistrationException.passwordTooShort(settings.minPasswordLength());
      }
      CredentialRecord record = new CredentialRecord(
          username, passwordHasher.hash(plaintext), effectiveRole, profile);
      records.put(username, record);
      return record.toAccount();
    });
    log.info("New user registered: {}", username);
    return account;
  }

  /**
   * Makes sure an administrator account exists. An existing account with the same username is
   * left untouched, whatever its role.
   *
   * @param username  the administrator username
   * @param plaintext the initial password
   * @return true if the account was created
   */
  public boolean bootstrapAdministrator(String username, String plaintext) {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(plaintext, "plaintext");
    boolean created = credentialStore.update(records -> {
      if (records.containsKey(username)) {
        return false;
      }
      records.put(username, new CredentialRecord(
          username, passwordHasher.hash(plaintext), Role.ADMIN, Map.of()));
      return true;
    });
    if (created) {
      log.warn("Created default admin user '{}'. Change its password before going to production!",
          username);
    } else {
      log.debug("Default admin user '{}' already exists", username);
    }
    return created;
  }
}
