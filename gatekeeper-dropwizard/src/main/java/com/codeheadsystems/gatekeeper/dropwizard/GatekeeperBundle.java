package com.codeheadsystems.gatekeeper.dropwizard;

import com.codeheadsystems.gatekeeper.dropwizard.auth.ForbiddenExceptionMapper;
import com.codeheadsystems.gatekeeper.dropwizard.auth.GatekeeperAuthorizer;
import com.codeheadsystems.gatekeeper.dropwizard.auth.GatekeeperBasicAuthenticator;
import com.codeheadsystems.gatekeeper.dropwizard.auth.GatekeeperBearerAuthenticator;
import com.codeheadsystems.gatekeeper.dropwizard.auth.GatekeeperPrincipal;
import com.codeheadsystems.gatekeeper.dropwizard.auth.JsonUnauthorizedHandler;
import com.codeheadsystems.gatekeeper.dropwizard.health.CredentialStoreHealthCheck;
import com.codeheadsystems.gatekeeper.server.auth.AuthorizationGate;
import com.codeheadsystems.gatekeeper.server.auth.CredentialVerifier;
import com.codeheadsystems.gatekeeper.server.auth.SessionTokenManager;
import com.codeheadsystems.gatekeeper.server.config.AuthScheme;
import com.codeheadsystems.gatekeeper.server.config.GatekeeperSettings;
import com.codeheadsystems.gatekeeper.server.exception.AuthFailureException;
import com.codeheadsystems.gatekeeper.server.hash.PasswordHasher;
import com.codeheadsystems.gatekeeper.server.hash.SaltedSha256PasswordHasher;
import com.codeheadsystems.gatekeeper.server.manager.GatekeeperAuthManager;
import com.codeheadsystems.gatekeeper.server.manager.RegistrationManager;
import com.codeheadsystems.gatekeeper.server.resource.AuthResource;
import com.codeheadsystems.gatekeeper.server.store.CredentialStore;
import com.codeheadsystems.gatekeeper.server.store.InMemoryCredentialStore;
import com.codeheadsystems.gatekeeper.server.store.JsonFileCredentialStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthFilter;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.basic.BasicCredentialAuthFilter;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import org.glassfish.jersey.server.filter.RolesAllowedDynamicFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the gatekeeper authentication core into an existing Dropwizard
 * application.
 * <p>
 * Registers {@code /auth/register} and {@code /auth/login}, the {@code credential-store} health
 * check, and an auth filter for the configured scheme so resources can take
 * {@code @Auth GatekeeperPrincipal} and use {@code @RolesAllowed("admin")}. Requires a
 * {@link GatekeeperConfiguration} as the application's configuration.
 * <p>
 * The store comes from {@code storePath} in the configuration:
 * <pre>{@code
 *   bootstrap.addBundle(new GatekeeperBundle<>());
 * }</pre>
 * <p>
 * Or supply one:
 * <pre>{@code
 *   bootstrap.addBundle(new GatekeeperBundle<>(myCredentialStore));
 * }</pre>
 */
public class GatekeeperBundle<C extends GatekeeperConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(GatekeeperBundle.class);

  private final CredentialStore suppliedStore;
  private final Clock clock;

  /**
   * Creates a bundle whose store is chosen by {@code storePath}.
   */
  public GatekeeperBundle() {
    this(null, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied store; {@code storePath} is ignored.
   *
   * @param credentialStore the store
   */
  public GatekeeperBundle(CredentialStore credentialStore) {
    this(credentialStore, Clock.systemUTC());
  }

  /**
   * Creates a bundle with an explicit clock for token issuance and expiry.
   *
   * @param credentialStore the store, or null to use {@code storePath}
   * @param clock           the clock
   */
  public GatekeeperBundle(CredentialStore credentialStore, Clock clock) {
    this.suppliedStore = credentialStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    GatekeeperSettings settings = configuration.toSettings(resolveTokenSecret(configuration));
    log.info("Starting gatekeeper with {}", settings);

    CredentialStore credentialStore = suppliedStore != null
        ? suppliedStore
        : buildCredentialStore(configuration, environment);
    PasswordHasher passwordHasher = new SaltedSha256PasswordHasher(settings.passwordSalt());
    RegistrationManager registrationManager =
        new RegistrationManager(credentialStore, passwordHasher, settings);
    GatekeeperAuthManager authManager = new GatekeeperAuthManager(
        settings,
        registrationManager,
        new CredentialVerifier(credentialStore, passwordHasher),
        new SessionTokenManager(settings.tokenSecret(), settings.tokenIssuer(),
            settings.tokenTtl(), credentialStore, clock),
        new AuthorizationGate());

    environment.lifecycle().manage(new GatekeeperLifecycle(
        credentialStore,
        registrationManager,
        configuration.hasDefaultAdmin() ? configuration.getDefaultAdminUsername() : null,
        configuration.hasDefaultAdmin() ? configuration.getDefaultAdminPassword() : null));
    environment.jersey().register(new AuthResource(authManager));
    environment.healthChecks().register("credential-store",
        new CredentialStoreHealthCheck(credentialStore));

    environment.jersey().register(new AuthDynamicFeature(buildAuthFilter(settings, authManager)));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(GatekeeperPrincipal.class));
    environment.jersey().register(RolesAllowedDynamicFeature.class);
    environment.jersey().register(new ForbiddenExceptionMapper());
  }

  private AuthFilter<?, GatekeeperPrincipal> buildAuthFilter(GatekeeperSettings settings,
                                                             GatekeeperAuthManager authManager) {
    GatekeeperAuthorizer authorizer = new GatekeeperAuthorizer(authManager);
    if (settings.authScheme() == AuthScheme.BASIC) {
      return new BasicCredentialAuthFilter.Builder<GatekeeperPrincipal>()
          .setAuthenticator(new GatekeeperBasicAuthenticator(authManager))
          .setAuthorizer(authorizer)
          .setPrefix(AuthScheme.BASIC.prefix())
          .setRealm(settings.realm())
          .setUnauthorizedHandler(new JsonUnauthorizedHandler(
              AuthFailureException.Category.INVALID_CREDENTIALS.externalMessage()))
          .buildAuthFilter();
    }
    return new OAuthCredentialAuthFilter.Builder<GatekeeperPrincipal>()
        .setAuthenticator(new GatekeeperBearerAuthenticator(authManager))
        .setAuthorizer(authorizer)
        .setPrefix(AuthScheme.BEARER.prefix())
        .setRealm(settings.realm())
        .setUnauthorizedHandler(new JsonUnauthorizedHandler(
            AuthFailureException.Category.INVALID_TOKEN.externalMessage()))
        .buildAuthFilter();
  }

  private CredentialStore buildCredentialStore(C configuration, Environment environment) {
    String storePath = configuration.getStorePath();
    if (storePath == null || storePath.isEmpty()) {
      return new InMemoryCredentialStore();
    }
    return new JsonFileCredentialStore(Path.of(storePath), environment.getObjectMapper());
  }

  private byte[] resolveTokenSecret(C configuration) {
    String secretHex = configuration.getTokenSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No token secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      byte[] secret = new byte[32];
      new SecureRandom().nextBytes(secret);
      return secret;
    }
    return HexFormat.of().parseHex(secretHex);
  }
}
