package com.codeheadsystems.gatekeeper.server.auth;

import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException.Reason;
import com.codeheadsystems.gatekeeper.server.hash.PasswordHasher;
import com.codeheadsystems.gatekeeper.server.model.AuthContext;
import com.codeheadsystems.gatekeeper.server.model.CredentialRecord;
import com.codeheadsystems.gatekeeper.server.store.CredentialStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a username and password against the credential store.
 */
@Singleton
public class CredentialVerifier {

  private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

  private final CredentialStore credentialStore;
  private final PasswordHasher passwordHasher;

  /**
   * Instantiates a new credential verifier.
   *
   * @param credentialStore the credential store
   * @param passwordHasher  the password hasher
   */
  @Inject
  public CredentialVerifier(CredentialStore credentialStore, PasswordHasher passwordHasher) {
    this.credentialStore = credentialStore;
    this.passwordHasher = passwordHasher;
  }

  /**
   * Verifies a presented password.
   * <p>
   * Unknown usernames and wrong passwords are logged differently but surface as the same
   * exception message.
   *
   * @param username        the presented username
   * @param presentedSecret the presented password
   * @return the identity, without the password digest
   * @throws AuthFailureException with {@code UNKNOWN_USER} or {@code BAD_SECRET}
   */
  public AuthContext verify(String username, String presentedSecret) {
    Optional<CredentialRecord> record = username == null
        ? Optional.empty()
        : credentialStore.find(username);
    if (record.isEmpty()) {
      log.warn("Login attempt with non-existent username: {}", username);
      throw new AuthFailureException(Reason.UNKNOWN_USER);
    }
    if (!passwordHasher.matches(presentedSecret, record.get().passwordHash())) {
      log.warn("Failed login attempt for user: {}", username);
      throw new AuthFailureException(Reason.BAD_SECRET);
    }
    log.debug("verify({}) succeeded", username);
    return AuthContext.from(record.get());
  }
}
