package com.codeheadsystems.gatekeeper.server.manager;

import com.codeheadsystems.gatekeeper.model.BasicLoginResponse;
import com.codeheadsystems.gatekeeper.model.BearerLoginResponse;
import com.codeheadsystems.gatekeeper.model.LoginRequest;
import com.codeheadsystems.gatekeeper.model.LoginResponse;
import com.codeheadsystems.gatekeeper.model.RegistrationRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationResponse;
import com.codeheadsystems.gatekeeper.server.auth.AuthorizationGate;
import com.codeheadsystems.gatekeeper.server.auth.CredentialVerifier;
import com.codeheadsystems.gatekeeper.server.auth.SessionTokenManager;
import com.codeheadsystems.gatekeeper.server.config.AuthScheme;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperSettings;
import com.codeheadsystems.gatekeeper.server.model.Account;
import com.codeheadsystems.gatekeeper.server.model.AuthContext;
import com.codeheadsystems.gatekeeper.server.model.Role;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic orchestration of registration, login and per-request authentication.
 * <p>
 * Transport adapters translate the unchecked exceptions this class throws into responses:
 * <ul>
 *   <li>{@link IllegalArgumentException} (including
 *       {@link com.codeheadsystems.gatekeeper.server.exception.RegistrationException}) maps to
 *       400 Bad Request</li>
 *   <li>{@link com.codeheadsystems.gatekeeper.server.exception.AuthFailureException} maps to
 *       401 Unauthorized, or 403 Forbidden for a denied role</li>
 *   <li>{@link com.codeheadsystems.gatekeeper.server.exception.PersistenceException} maps to
 *       500 Internal Server Error</li>
 * </ul>
 */
public class GatekeeperAuthManager {

  /**
   * Message returned on successful registration.
   */
  public static final String REGISTERED_MESSAGE = "User registered successfully";

  /**
   * Message returned on successful Basic login.
   */
  public static final String LOGIN_MESSAGE = "Login successful";

  private static final Logger log = LoggerFactory.getLogger(GatekeeperAuthManager.class);

  private final GatekeeperSettings settings;
  private final RegistrationManager registrationManager;
  private final CredentialVerifier credentialVerifier;
  private final SessionTokenManager sessionTokenManager;
  private final AuthorizationGate authorizationGate;

  /**
   * Instantiates a new auth manager.
   *
   * @param settings            the settings
   * @param registrationManager the registration manager
   * @param credentialVerifier  the credential verifier
   * @param sessionTokenManager the session token manager
   * @param authorizationGate   the authorization gate
   */
  public GatekeeperAuthManager(GatekeeperSettings settings,
                               RegistrationManager registrationManager,
                               CredentialVerifier credentialVerifier,
                               SessionTokenManager sessionTokenManager,
                               AuthorizationGate authorizationGate) {
    this.settings = settings;
    this.registrationManager = registrationManager;
    this.credentialVerifier = credentialVerifier;
    this.sessionTokenManager = sessionTokenManager;
    this.authorizationGate = authorizationGate;
  }

  /**
   * The settings this manager was built with.
   *
   * @return the settings
   */
  public GatekeeperSettings settings() {
    return settings;
  }

  // ── Registration ──────────────────────────────────────────────────────────

  /**
   * Registers an account from a wire request.
   *
   * @param request the request
   * @return the response
   */
  public RegistrationResponse register(RegistrationRequest request) {
    String username = request.requireUsername();
    String password = request.requirePassword();
    Role role = settings.roleAware() && request.role() != null
        ? Role.fromName(request.role())
        : null;
    Account account = registrationManager.register(username, password, role, profileOf(request));
    return new RegistrationResponse(REGISTERED_MESSAGE, account.username());
  }

  // ── Login ─────────────────────────────────────────────────────────────────

  /**
   * Verifies the credentials in {@code request}. Under the bearer scheme a token is issued;
   * under the basic scheme the caller gets its account details back.
   *
   * @param request the request
   * @return a {@link BearerLoginResponse} or a {@link BasicLoginResponse}
   */
  public LoginResponse login(LoginRequest request) {
    AuthContext context = credentialVerifier.verify(
        request.requireUsername(), request.requirePassword());
    log.info("User logged in: {}", context.username());
    if (settings.authScheme() == AuthScheme.BEARER) {
      SessionTokenManager.IssuedToken issued = sessionTokenManager.issue(context.username());
      return new BearerLoginResponse(issued.token(), BearerLoginResponse.TOKEN_TYPE,
          context.username(), issued.expiresInSeconds());
    }
    return new BasicLoginResponse(LOGIN_MESSAGE, context.username(),
        context.optionalRole().map(Role::wireName).orElse(null),
        context.profile().isEmpty() ? null : context.profile());
  }

  // ── Per-request authentication ────────────────────────────────────────────

  /**
   * Authenticates a request carrying Basic credentials.
   *
   * @param username the username
   * @param password the password
   * @return the identity
   */
  public AuthContext authenticateBasic(String username, String password) {
    return credentialVerifier.verify(username, password);
  }

  /**
   * Authenticates a request carrying a bearer token.
   *
   * @param token the raw token
   * @return the identity
   */
  public AuthContext authenticateBearer(String token) {
    return sessionTokenManager.validate(token);
  }

  /**
   * Fails unless the identity satisfies {@code requiredRole}.
   *
   * @param context      the identity
   * @param requiredRole the role, or null
   */
  public void authorize(AuthContext context, Role requiredRole) {
    authorizationGate.authorize(context, requiredRole);
  }

  /**
   * Whether the identity satisfies {@code requiredRole}.
   *
   * @param context      the identity
   * @param requiredRole the role, or null
   * @return true if allowed
   */
  public boolean isAllowed(AuthContext context, Role requiredRole) {
    return authorizationGate.isAllowed(context, requiredRole);
  }

  private static Map<String, Object> profileOf(RegistrationRequest request) {
    Map<String, Object> profile = new LinkedHashMap<>();
    if (request.email() != null) {
      profile.put("email", request.email());
    }
    if (request.fullName() != null) {
      profile.put("full_name", request.fullName());
    }
    return profile;
  }
}
