package com.codeheadsystems.quartermaster.dropwizard;

import com.codeheadsystems.quartermaster.dropwizard.auth.QuartermasterAuthenticator;
import com.codeheadsystems.quartermaster.dropwizard.auth.QuartermasterPrincipal;
import com.codeheadsystems.quartermaster.dropwizard.health.InventoryStoreHealthCheck;
import com.codeheadsystems.quartermaster.dropwizard.lifecycle.ExpiredGrantReaper;
import com.codeheadsystems.quartermaster.server.auth.AuthContextResolver;
import com.codeheadsystems.quartermaster.server.auth.AutoApproveConsentProvider;
import com.codeheadsystems.quartermaster.server.auth.BearerAuthenticator;
import com.codeheadsystems.quartermaster.server.auth.ConsentProvider;
import com.codeheadsystems.quartermaster.server.auth.DebugBypassAuthenticator;
import com.codeheadsystems.quartermaster.server.auth.PkceVerifier;
import com.codeheadsystems.quartermaster.server.auth.SecureTokenGenerator;
import com.codeheadsystems.quartermaster.server.manager.DiscoveryManager;
import com.codeheadsystems.quartermaster.server.manager.McpSessionManager;
import com.codeheadsystems.quartermaster.server.manager.OAuthServerManager;
import com.codeheadsystems.quartermaster.server.manager.OAuthServerSettings;
import com.codeheadsystems.quartermaster.server.mcp.JsonRpcDispatcher;
import com.codeheadsystems.quartermaster.server.mcp.McpServerSettings;
import com.codeheadsystems.quartermaster.server.resource.DiscoveryResource;
import com.codeheadsystems.quartermaster.server.resource.HealthResource;
import com.codeheadsystems.quartermaster.server.resource.McpResource;
import com.codeheadsystems.quartermaster.server.resource.OAuthResource;
import com.codeheadsystems.quartermaster.server.store.AuthorizationCodeStore;
import com.codeheadsystems.quartermaster.server.store.ClientStore;
import com.codeheadsystems.quartermaster.server.store.InMemoryAuthorizationCodeStore;
import com.codeheadsystems.quartermaster.server.store.InMemoryClientStore;
import com.codeheadsystems.quartermaster.server.store.InMemoryMcpSessionStore;
import com.codeheadsystems.quartermaster.server.store.InMemoryTokenStore;
import com.codeheadsystems.quartermaster.server.store.McpSessionStore;
import com.codeheadsystems.quartermaster.server.store.TokenStore;
import com.codeheadsystems.quartermaster.server.tool.InMemoryToolRegistry;
import com.codeheadsystems.quartermaster.server.tool.inventory.InMemoryInventoryStore;
import com.codeheadsystems.quartermaster.server.tool.inventory.InventoryStore;
import com.codeheadsystems.quartermaster.server.tool.inventory.InventoryTools;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Quartermaster OAuth authorization server and the MCP
 * inventory endpoint into an existing Dropwizard application.
 * <p>
 * Registers the OAuth, discovery, MCP and health resources, the inventory health check, the
 * bearer authentication filter for {@code @Auth} routes and the expired-grant reaper.
 * Requires a {@link QuartermasterConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new QuartermasterBundle<>());
 * }</pre>
 * <p>
 * Or supply your own stores and consent step:
 * <pre>{@code
 *   bootstrap.addBundle(new QuartermasterBundle<>(tokenStore, sessionStore, clientStore,
 *       inventoryStore, consentProvider));
 * }</pre>
 * A null consent provider auto-approves every request as {@code consentSubject}.
 */
@Singleton
public class QuartermasterBundle<C extends QuartermasterConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(QuartermasterBundle.class);

  private final TokenStore tokenStore;
  private final McpSessionStore sessionStore;
  private final ClientStore clientStore;
  private final InventoryStore inventoryStore;
  private final ConsentProvider consentProvider;

  /**
   * Creates a bundle backed by in-memory stores and a small seeded inventory.
   * <p>
   * For dev/test only: all clients, tokens and sessions are lost on restart.
   */
  public QuartermasterBundle() {
    this.tokenStore = new InMemoryTokenStore();
    this.sessionStore = new InMemoryMcpSessionStore();
    this.clientStore = new InMemoryClientStore();
    this.inventoryStore = InMemoryInventoryStore.seeded();
    this.consentProvider = null;
    log.warn("""
        #################################################################
        # WARNING: Using in-memory client, token and session stores     #
        # with a demo inventory. All data will be lost on restart.      #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param tokenStore      access token storage
   * @param sessionStore    MCP session storage
   * @param clientStore     dynamic client registrations
   * @param inventoryStore  data behind the search and fetch tools
   * @param consentProvider consent step of {@code /authorize}; null auto-approves
   */
  @Inject
  public QuartermasterBundle(TokenStore tokenStore,
                             McpSessionStore sessionStore,
                             ClientStore clientStore,
                             InventoryStore inventoryStore,
                             ConsentProvider consentProvider) {
    this.tokenStore = tokenStore;
    this.sessionStore = sessionStore;
    this.clientStore = clientStore;
    this.inventoryStore = inventoryStore;
    this.consentProvider = consentProvider;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    AuthorizationCodeStore codeStore = new InMemoryAuthorizationCodeStore(
        Clock.systemUTC(),
        Duration.ofSeconds(configuration.getAuthorizationCodeTtlSeconds()),
        configuration.getMaxPendingAuthorizationCodes(),
        new SecureTokenGenerator(),
        new PkceVerifier());
    OAuthServerSettings oauthSettings = new OAuthServerSettings(
        Duration.ofSeconds(configuration.getAccessTokenTtlSeconds()),
        configuration.getDefaultScope(),
        configuration.getScopesSupported());
    ConsentProvider consent = consentProvider != null
        ? consentProvider
        : new AutoApproveConsentProvider(configuration.getConsentSubject());

    OAuthServerManager oauthManager =
        new OAuthServerManager(codeStore, tokenStore, clientStore, consent, oauthSettings);
    DiscoveryManager discoveryManager =
        new DiscoveryManager(configuration.getIssuer(), configuration.getScopesSupported());
    McpSessionManager sessionManager = new McpSessionManager(sessionStore);
    AuthContextResolver resolver = buildResolver(configuration);

    InMemoryToolRegistry toolRegistry = new InMemoryToolRegistry();
    new InventoryTools(inventoryStore, environment.getObjectMapper(), configuration.getIssuer())
        .registerWith(toolRegistry);
    JsonRpcDispatcher dispatcher = new JsonRpcDispatcher(
        resolver, sessionManager, toolRegistry, buildMcpSettings(configuration),
        environment.getObjectMapper());

    environment.jersey().register(new OAuthResource(oauthManager));
    environment.jersey().register(new DiscoveryResource(discoveryManager));
    environment.jersey().register(new McpResource(dispatcher, resolver, sessionManager, discoveryManager));
    environment.jersey().register(new HealthResource(inventoryStore));
    environment.healthChecks().register("inventory-store", new InventoryStoreHealthCheck(inventoryStore));

    // Bearer auth filter for application routes using @Auth
    QuartermasterAuthenticator authenticator = new QuartermasterAuthenticator(tokenStore);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<QuartermasterPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(QuartermasterPrincipal.class));

    environment.lifecycle().manage(new ExpiredGrantReaper(codeStore, tokenStore,
        Duration.ofSeconds(configuration.getReaperIntervalSeconds())));
  }

  private AuthContextResolver buildResolver(C configuration) {
    if (configuration.isAuthBypassEnabled()) {
      Set<String> scopes = new LinkedHashSet<>(configuration.getScopesSupported());
      return new DebugBypassAuthenticator(configuration.getAuthBypassSubject(), scopes);
    }
    return new BearerAuthenticator(tokenStore);
  }

  private static McpServerSettings buildMcpSettings(QuartermasterConfiguration configuration) {
    String instructions = configuration.getInstructions();
    return new McpServerSettings(
        configuration.getServerName(),
        configuration.getServerVersion(),
        instructions == null || instructions.isBlank() ? null : instructions,
        configuration.getProtocolVersion(),
        configuration.getSupportedProtocolVersions(),
        configuration.isSessionRecoveryEnabled());
  }
}
