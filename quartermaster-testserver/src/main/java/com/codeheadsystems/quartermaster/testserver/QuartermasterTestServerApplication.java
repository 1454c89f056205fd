package com.codeheadsystems.quartermaster.testserver;

import com.codeheadsystems.quartermaster.dropwizard.QuartermasterBundle;
import com.codeheadsystems.quartermaster.dropwizard.QuartermasterConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local testing of MCP clients and their OAuth flow.
 * Uses in-memory client, token and session stores (lost on restart) and the demo inventory.
 * Start with {@code java -jar quartermaster-testserver.jar server config/config.yml}.
 */
public class QuartermasterTestServerApplication extends Application<QuartermasterConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new QuartermasterTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "quartermaster-testserver";
  }

  @Override
  public void initialize(Bootstrap<QuartermasterConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution in config YAML files so individual keys can be
    // overridden from the environment without replacing the whole file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(new QuartermasterBundle<>());
  }

  @Override
  public void run(QuartermasterConfiguration configuration, Environment environment) {
    // Protected endpoint: confirms that a token from /token is accepted by @Auth routes.
    environment.jersey().register(new WhoAmIResource());
  }
}
