package com.codeheadsystems.gatekeeper.testserver;

import com.codeheadsystems.gatekeeper.dropwizard.GatekeeperBundle;
import com.codeheadsystems.gatekeeper.dropwizard.GatekeeperConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local developer testing of gatekeeper clients.
 * Reads everything from {@code config/config.yml}; accounts live in the JSON document named by
 * {@code storePath} so they survive restarts.
 * <pre>
 *   java -cp ... com.codeheadsystems.gatekeeper.testserver.GatekeeperTestServerApplication \
 *       server config/config.yml
 * </pre>
 */
public class GatekeeperTestServerApplication extends Application<GatekeeperConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new GatekeeperTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "gatekeeper-testserver";
  }

  @Override
  public void initialize(Bootstrap<GatekeeperConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution in config YAML files so environment
    // variables can override individual keys without replacing the entire config file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new GatekeeperBundle<>());
  }

  @Override
  public void run(GatekeeperConfiguration configuration, Environment environment) {
    environment.jersey().register(new WhoAmIResource());
    environment.jersey().register(new AdminResource());
  }
}
