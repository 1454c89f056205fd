package com.codeheadsystems.quartermaster.server.manager;

import com.codeheadsystems.quartermaster.model.oauth.AuthorizationServerMetadata;
import com.codeheadsystems.quartermaster.model.oauth.ProtectedResourceMetadata;
import com.codeheadsystems.quartermaster.model.oauth.ProtectedResourceMetadata.AuthorizationServerReference;
import java.net.URI;
import java.util.List;

/**
 * Builds the OAuth discovery documents and the {@code WWW-Authenticate} challenge.
 * <p>
 * Pure configuration reflection: nothing here reads the stores. When no issuer is configured it
 * is derived from the base URI of the request being answered.
 */
public class DiscoveryManager {

  public static final String AUTHORIZATION_SERVER_PATH = "/.well-known/oauth-authorization-server";
  public static final String PROTECTED_RESOURCE_PATH = "/.well-known/oauth-protected-resource";
  public static final String REALM = "MCP Server";

  private final String configuredIssuer;
  private final List<String> scopesSupported;

  /**
   * @param configuredIssuer base URL of this server, or blank to derive it per request
   * @param scopesSupported  advertised scopes
   */
  public DiscoveryManager(String configuredIssuer, List<String> scopesSupported) {
    this.configuredIssuer = stripTrailingSlash(configuredIssuer);
    this.scopesSupported = List.copyOf(scopesSupported);
  }

  /**
   * The issuer to publish for a request.
   *
   * @param requestBaseUri base URI of the current request, used only without a configured issuer
   * @return the issuer, without trailing slash
   */
  public String resolveIssuer(URI requestBaseUri) {
    if (configuredIssuer != null && !configuredIssuer.isEmpty()) {
      return configuredIssuer;
    }
    return stripTrailingSlash(requestBaseUri.toString());
  }

  public AuthorizationServerMetadata authorizationServerMetadata(String issuer) {
    return new AuthorizationServerMetadata(
        issuer,
        issuer + "/authorize",
        issuer + "/token",
        issuer + "/register",
        scopesSupported,
        List.of("code"),
        List.of("query"),
        List.of(OAuthServerManager.GRANT_TYPE_AUTHORIZATION_CODE),
        List.of(OAuthServerManager.AUTH_METHOD_NONE),
        List.of("S256", "plain"));
  }

  public ProtectedResourceMetadata protectedResourceMetadata(String issuer) {
    return new ProtectedResourceMetadata(
        issuer + "/mcp",
        List.of(new AuthorizationServerReference(issuer, issuer + "/authorize")),
        List.of("header"),
        scopesSupported);
  }

  /**
   * The challenge sent with every 401, pointing clients at the protected-resource metadata.
   *
   * @param issuer the resolved issuer
   * @return the {@code WWW-Authenticate} header value
   */
  public String challenge(String issuer) {
    return "Bearer realm=\"" + REALM + "\", resource_metadata=\""
        + issuer + PROTECTED_RESOURCE_PATH + "\"";
  }

  private static String stripTrailingSlash(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
