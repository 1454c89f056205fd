package com.codeheadsystems.quartermaster.server.manager;

import com.codeheadsystems.quartermaster.model.oauth.ClientRegistrationRequest;
import com.codeheadsystems.quartermaster.model.oauth.ClientRegistrationResponse;
import com.codeheadsystems.quartermaster.model.oauth.TokenResponse;
import com.codeheadsystems.quartermaster.server.auth.CodeChallengeMethod;
import com.codeheadsystems.quartermaster.server.auth.ConsentDecision;
import com.codeheadsystems.quartermaster.server.auth.ConsentProvider;
import com.codeheadsystems.quartermaster.server.auth.ConsentRequest;
import com.codeheadsystems.quartermaster.server.auth.OAuthError;
import com.codeheadsystems.quartermaster.server.auth.OAuthException;
import com.codeheadsystems.quartermaster.server.store.AuthorizationCodeData;
import com.codeheadsystems.quartermaster.server.store.AuthorizationCodeStore;
import com.codeheadsystems.quartermaster.server.store.ClientRegistration;
import com.codeheadsystems.quartermaster.server.store.ClientStore;
import com.codeheadsystems.quartermaster.server.store.TokenStore;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing the OAuth 2.1 authorization code grant with PKCE.
 * <p>
 * Framework adapters ({@code OAuthResource} for JAX-RS) stay thin: they collect parameters and
 * translate exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link OAuthException}: rejected request carrying the OAuth error code, HTTP 400</li>
 *   <li>{@link IllegalStateException}: code store at capacity, HTTP 503</li>
 * </ul>
 * Validation failures on {@code client_id} or {@code redirect_uri} are always thrown rather
 * than redirected, so an unvalidated URI never receives a redirect.
 */
public class OAuthServerManager {

  private static final Logger log = LoggerFactory.getLogger(OAuthServerManager.class);

  public static final String RESPONSE_TYPE_CODE = "code";
  public static final String GRANT_TYPE_AUTHORIZATION_CODE = "authorization_code";
  public static final String AUTH_METHOD_NONE = "none";

  private final AuthorizationCodeStore codeStore;
  private final TokenStore tokenStore;
  private final ClientStore clientStore;
  private final ConsentProvider consentProvider;
  private final OAuthServerSettings settings;
  private final Clock clock;

  public OAuthServerManager(AuthorizationCodeStore codeStore,
                            TokenStore tokenStore,
                            ClientStore clientStore,
                            ConsentProvider consentProvider,
                            OAuthServerSettings settings) {
    this(codeStore, tokenStore, clientStore, consentProvider, settings, Clock.systemUTC());
  }

  public OAuthServerManager(AuthorizationCodeStore codeStore,
                            TokenStore tokenStore,
                            ClientStore clientStore,
                            ConsentProvider consentProvider,
                            OAuthServerSettings settings,
                            Clock clock) {
    this.codeStore = codeStore;
    this.tokenStore = tokenStore;
    this.clientStore = clientStore;
    this.consentProvider = consentProvider;
    this.settings = settings;
    this.clock = clock;
  }

  // ── Authorization endpoint ───────────────────────────────────────────────

  /**
   * Validates an authorization request, obtains consent and issues a code.
   *
   * @param req the raw request parameters
   * @return the URI to redirect the user agent to, carrying either {@code code} or an
   *     {@code access_denied} error, plus the original {@code state}
   * @throws OAuthException        if the request is invalid; never redirected
   * @throws IllegalStateException if too many codes are pending
   */
  public URI authorize(AuthorizationRequest req) {
    log.debug("authorize(client_id={})", req.clientId());
    if (isBlank(req.clientId())) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "client_id is required");
    }
    if (isBlank(req.redirectUri())) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri is required");
    }
    if (!isAbsoluteUri(req.redirectUri())) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "redirect_uri must be an absolute URI");
    }
    Optional<ClientRegistration> registration = clientStore.load(req.clientId());
    if (registration.isPresent() && !registration.get().allowsRedirectUri(req.redirectUri())) {
      log.warn("Rejected unregistered redirect_uri for client_id={}", req.clientId());
      throw new OAuthException(OAuthError.INVALID_REQUEST,
          "redirect_uri is not registered for this client");
    }
    if (!RESPONSE_TYPE_CODE.equals(req.responseType())) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "response_type must be 'code'");
    }
    CodeChallengeMethod method = CodeChallengeMethod.S256;
    if (!isBlank(req.codeChallengeMethod())) {
      method = CodeChallengeMethod.fromWireName(req.codeChallengeMethod())
          .orElseThrow(() -> new OAuthException(OAuthError.INVALID_REQUEST,
              "Unsupported code_challenge_method"));
    }
    Set<String> scopes = parseScopes(req.scope());

    ConsentDecision decision = consentProvider.obtainConsent(
        new ConsentRequest(req.clientId(), req.redirectUri(), scopes));
    if (!decision.granted()) {
      log.debug("Consent denied for client_id={}", req.clientId());
      Map<String, String> params = new LinkedHashMap<>();
      params.put("error", OAuthError.ACCESS_DENIED.code());
      params.put("error_description", "The resource owner denied the request");
      params.put("state", req.state());
      return appendQuery(req.redirectUri(), params);
    }

    String challenge = isBlank(req.codeChallenge()) ? null : req.codeChallenge();
    String code = codeStore.issue(req.clientId(), req.redirectUri(), scopes,
        challenge, method, decision.subject());
    Map<String, String> params = new LinkedHashMap<>();
    params.put("code", code);
    params.put("state", req.state());
    return appendQuery(req.redirectUri(), params);
  }

  // ── Token endpoint ───────────────────────────────────────────────────────

  /**
   * Exchanges an authorization code for an access token.
   *
   * @param req the raw form parameters
   * @return the token response
   * @throws OAuthException with {@code unsupported_grant_type}, {@code invalid_request} or
   *                        {@code invalid_grant}
   */
  public TokenResponse exchange(TokenRequest req) {
    log.debug("exchange(client_id={})", req.clientId());
    if (isBlank(req.grantType())) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "grant_type is required");
    }
    if (!GRANT_TYPE_AUTHORIZATION_CODE.equals(req.grantType())) {
      throw new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE,
          "Only authorization_code is supported");
    }
    if (isBlank(req.code())) {
      throw new OAuthException(OAuthError.INVALID_REQUEST, "code is required");
    }
    AuthorizationCodeData grant = codeStore.redeem(req.code(), emptyToNull(req.codeVerifier()),
        emptyToNull(req.clientId()), emptyToNull(req.redirectUri()));
    String token = tokenStore.issue(grant.subject(), grant.clientId(), grant.scopes(),
        settings.accessTokenTtl());
    log.debug("Issued access token to client_id={} subject={}", grant.clientId(), grant.subject());
    return TokenResponse.bearer(token, settings.accessTokenTtl().toSeconds(),
        String.join(" ", grant.scopes()));
  }

  // ── Dynamic client registration ──────────────────────────────────────────

  /**
   * Registers a public client.
   *
   * @param req the registration document
   * @return the assigned client id and the accepted metadata
   * @throws OAuthException with {@code invalid_redirect_uri} if no usable redirect URI is given
   */
  public ClientRegistrationResponse register(ClientRegistrationRequest req) {
    List<String> redirectUris = req == null ? null : req.redirectUris();
    if (redirectUris == null || redirectUris.isEmpty()) {
      throw new OAuthException(OAuthError.INVALID_REDIRECT_URI,
          "At least one redirect_uri is required");
    }
    for (String uri : redirectUris) {
      if (!isAbsoluteUri(uri)) {
        throw new OAuthException(OAuthError.INVALID_REDIRECT_URI,
            "redirect_uris must be absolute URIs");
      }
    }
    ClientRegistration registration = new ClientRegistration(
        UUID.randomUUID().toString(), req.clientName(), redirectUris, clock.instant());
    clientStore.store(registration);
    log.info("Registered client_id={} name={}", registration.clientId(), registration.clientName());
    return new ClientRegistrationResponse(registration.clientId(), registration.clientName(),
        AUTH_METHOD_NONE, registration.redirectUris());
  }

  public OAuthServerSettings settings() {
    return settings;
  }

  private Set<String> parseScopes(String scope) {
    String value = isBlank(scope) ? settings.defaultScope() : scope;
    return Arrays.stream(value.trim().split("\\s+"))
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static URI appendQuery(String redirectUri, Map<String, String> params) {
    String query = params.entrySet().stream()
        .filter(e -> e.getValue() != null)
        .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
    String separator = redirectUri.contains("?") ? "&" : "?";
    return URI.create(redirectUri + separator + query);
  }

  private static boolean isAbsoluteUri(String value) {
    if (isBlank(value)) {
      return false;
    }
    try {
      URI uri = new URI(value);
      return uri.isAbsolute() && uri.getFragment() == null;
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String emptyToNull(String value) {
    return isBlank(value) ? null : value;
  }
}
