package com.codeheadsystems.quartermaster.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Dropwizard configuration for the Quartermaster authorization server and MCP endpoint.
 * <p>
 * All grants, tokens and sessions are held in memory unless the application supplies its own
 * stores to {@link QuartermasterBundle}. Leave {@code issuer} empty to derive it from each
 * request's base URI, which is only correct when the server is reached directly.
 */
public class QuartermasterConfiguration extends Configuration {

  /**
   * Public base URL, e.g. {@code https://quartermaster.example.com}. Published in discovery
   * documents and in the {@code WWW-Authenticate} challenge.
   */
  private String issuer = "";

  /**
   * Lifetime of issued access tokens. 30 days by default.
   */
  @Min(1)
  private long accessTokenTtlSeconds = 2_592_000;

  /**
   * Lifetime of authorization codes.
   */
  @Min(1)
  private long authorizationCodeTtlSeconds = 600;

  @NotEmpty
  private String defaultScope = "inventory";

  @NotEmpty
  private List<String> scopesSupported = List.of("inventory", "search", "fetch");

  /**
   * Outstanding authorization codes above which {@code /authorize} answers 503.
   */
  @Min(1)
  private int maxPendingAuthorizationCodes = 10_000;

  /**
   * Subject assigned by the auto-approving consent step.
   */
  @NotEmpty
  private String consentSubject = "demo_user";

  /**
   * When true, MCP calls with a missing or unknown session id get a fresh session bound to the
   * caller instead of a {@code -32001} error.
   */
  private boolean sessionRecoveryEnabled = true;

  /**
   * Disables bearer authentication on the MCP endpoint. Local debugging only.
   */
  private boolean authBypassEnabled = false;

  @NotEmpty
  private String authBypassSubject = "debug-user";

  @NotEmpty
  private String serverName = "Quartermaster Inventory Server";

  @NotEmpty
  private String serverVersion = "1.0.0";

  private String instructions = "Use 'search' to find stocked items by name, category or location, "
      + "then 'fetch' with a result id to read the full record.";

  /**
   * MCP protocol version answered when the client requests one that is not supported.
   */
  @NotEmpty
  private String protocolVersion = "2025-03-26";

  @NotEmpty
  private List<String> supportedProtocolVersions = List.of("2024-11-05", "2025-03-26");

  /**
   * How often expired codes and tokens are purged. Lazy eviction on read does not depend on it.
   */
  @Min(1)
  private long reaperIntervalSeconds = 60;

  @JsonProperty
  public String getIssuer() {
    return issuer;
  }

  @JsonProperty
  public void setIssuer(String issuer) {
    this.issuer = issuer;
  }

  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  @JsonProperty
  public long getAuthorizationCodeTtlSeconds() {
    return authorizationCodeTtlSeconds;
  }

  @JsonProperty
  public void setAuthorizationCodeTtlSeconds(long authorizationCodeTtlSeconds) {
    this.authorizationCodeTtlSeconds = authorizationCodeTtlSeconds;
  }

  @JsonProperty
  public String getDefaultScope() {
    return defaultScope;
  }

  @JsonProperty
  public void setDefaultScope(String defaultScope) {
    this.defaultScope = defaultScope;
  }

  @JsonProperty
  public List<String> getScopesSupported() {
    return scopesSupported;
  }

  @JsonProperty
  public void setScopesSupported(List<String> scopesSupported) {
    this.scopesSupported = scopesSupported;
  }

  @JsonProperty
  public int getMaxPendingAuthorizationCodes() {
    return maxPendingAuthorizationCodes;
  }

  @JsonProperty
  public void setMaxPendingAuthorizationCodes(int maxPendingAuthorizationCodes) {
    this.maxPendingAuthorizationCodes = maxPendingAuthorizationCodes;
  }

  @JsonProperty
  public String getConsentSubject() {
    return consentSubject;
  }

  @JsonProperty
  public void setConsentSubject(String consentSubject) {
    this.consentSubject = consentSubject;
  }

  @JsonProperty
  public boolean isSessionRecoveryEnabled() {
    return sessionRecoveryEnabled;
  }

  @JsonProperty
  public void setSessionRecoveryEnabled(boolean sessionRecoveryEnabled) {
    this.sessionRecoveryEnabled = sessionRecoveryEnabled;
  }

  @JsonProperty
  public boolean isAuthBypassEnabled() {
    return authBypassEnabled;
  }

  @JsonProperty
  public void setAuthBypassEnabled(boolean authBypassEnabled) {
    this.authBypassEnabled = authBypassEnabled;
  }

  @JsonProperty
  public String getAuthBypassSubject() {
    return authBypassSubject;
  }

  @JsonProperty
  public void setAuthBypassSubject(String authBypassSubject) {
    this.authBypassSubject = authBypassSubject;
  }

  @JsonProperty
  public String getServerName() {
    return serverName;
  }

  @JsonProperty
  public void setServerName(String serverName) {
    this.serverName = serverName;
  }

  @JsonProperty
  public String getServerVersion() {
    return serverVersion;
  }

  @JsonProperty
  public void setServerVersion(String serverVersion) {
    this.serverVersion = serverVersion;
  }

  @JsonProperty
  public String getInstructions() {
    return instructions;
  }

  @JsonProperty
  public void setInstructions(String instructions) {
    this.instructions = instructions;
  }

  @JsonProperty
  public String getProtocolVersion() {
    return protocolVersion;
  }

  @JsonProperty
  public void setProtocolVersion(String protocolVersion) {
    this.protocolVersion = protocolVersion;
  }

  @JsonProperty
  public List<String> getSupportedProtocolVersions() {
    return supportedProtocolVersions;
  }

  @JsonProperty
  public void setSupportedProtocolVersions(List<String> supportedProtocolVersions) {
    this.supportedProtocolVersions = supportedProtocolVersions;
  }

  @JsonProperty
  public long getReaperIntervalSeconds() {
    return reaperIntervalSeconds;
  }

  @JsonProperty
  public void setReaperIntervalSeconds(long reaperIntervalSeconds) {
    this.reaperIntervalSeconds = reaperIntervalSeconds;
  }
}
