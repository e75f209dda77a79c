package com.codeheadsystems.ibauth.client;

import com.codeheadsystems.ibauth.client.accessor.BrokerAccessor;
import com.codeheadsystems.ibauth.client.exceptions.NotAuthenticatedException;
import com.codeheadsystems.ibauth.client.exceptions.SessionExpiredException;
import com.codeheadsystems.ibauth.client.manager.OAuthRequestFactory;
import com.codeheadsystems.ibauth.client.manager.TokenExchangeFlow;
import com.codeheadsystems.ibauth.client.model.AccessToken;
import com.codeheadsystems.ibauth.client.model.ApiResponse;
import com.codeheadsystems.ibauth.client.model.LiveSessionToken;
import com.codeheadsystems.ibauth.client.model.ServerConnectionInfo;
import com.codeheadsystems.ibauth.client.model.SignedRequest;
import com.codeheadsystems.ibauth.client.session.AuthSession;
import com.codeheadsystems.ibauth.model.session.Account;
import com.codeheadsystems.ibauth.model.session.AuthStatusResponse;
import com.codeheadsystems.ibauth.model.session.TickleResponse;
import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers: authenticates an {@link AuthSession} and signs and sends calls with
 * its live session token.
 * <p>
 * Parameters of {@code POST} and {@code PUT} calls are sent as a form body; those of other
 * methods as the query string. Both are part of the signature.
 * <p>
 * A 401 on a call triggers one re-derivation of the live session token and one retry. A second
 * 401, or a failed re-derivation, raises {@link SessionExpiredException}. Thread-safe.
 */
public class AuthenticatedClient {

  private static final Logger log = LoggerFactory.getLogger(AuthenticatedClient.class);

  static final String TICKLE_PATH = "/tickle";
  static final String AUTH_STATUS_PATH = "/iserver/auth/status";
  static final String ACCOUNTS_PATH = "/portfolio/accounts";

  private final AuthSession session;
  private final TokenExchangeFlow flow;
  private final OAuthRequestFactory requestFactory;
  private final BrokerAccessor accessor;
  private final ServerConnectionInfo servers;

  /**
   * Instantiates a new Authenticated client.
   *
   * @param session        the session this client signs with
   * @param flow           the token exchange flow
   * @param requestFactory the request factory
   * @param accessor       the accessor
   * @param servers        the broker base urls
   */
  @Inject
  public AuthenticatedClient(final AuthSession session,
                             final TokenExchangeFlow flow,
                             final OAuthRequestFactory requestFactory,
                             final BrokerAccessor accessor,
                             final ServerConnectionInfo servers) {
    log.info("AuthenticatedClient()");
    this.session = session;
    this.flow = flow;
    this.requestFactory = requestFactory;
    this.accessor = accessor;
    this.servers = servers;
  }

  public AuthSession session() {
    return session;
  }

  /**
   * Runs the token exchange until the brokerage session is initialized.
   *
   * @return the session
   */
  public AuthSession authenticate() {
    return flow.authenticate(session);
  }

  /**
   * Whether the session is initialized and calls can be signed.
   *
   * @return true if authenticated
   */
  public boolean isAuthenticated() {
    return session.isAuthenticated();
  }

  /**
   * Builds a signed request without sending it.
   *
   * @param method HTTP method
   * @param path   path below the API base, e.g. {@code /portfolio/accounts}
   * @param params request parameters
   * @return the signed request
   * @throws NotAuthenticatedException if no live session token exists
   */
  public SignedRequest signedRequest(final String method, final String path, final Map<String, String> params) {
    return sign(method, servers.api(path), params, currentTokens());
  }

  /**
   * Signs and sends a call.
   *
   * @param method HTTP method
   * @param path   path below the API base
   * @param params request parameters
   * @return the response
   * @throws SessionExpiredException if the call is still rejected after one re-derivation
   */
  public ApiResponse execute(final String method, final String path, final Map<String, String> params) {
    log.debug("execute(method={}, path={})", method, path);
    URI uri = servers.api(path);
    Tokens tokens = currentTokens();
    ApiResponse response = accessor.send(sign(method, uri, params, tokens));
    if (!response.isUnauthorized()) {
      return response;
    }

    log.warn("{} {} rejected with 401, re-deriving the live session token", method, path);
    try {
      flow.rederive(session, tokens.liveSessionToken());
    } catch (IbAuthException e) {
      throw new SessionExpiredException("Re-deriving the live session token failed", e);
    }
    response = accessor.send(sign(method, uri, params, currentTokens()));
    if (response.isUnauthorized()) {
      throw new SessionExpiredException(method + " " + path + " rejected after re-deriving the live session token");
    }
    return response;
  }

  public ApiResponse get(final String path, final Map<String, String> queryParams) {
    return execute("GET", path, queryParams);
  }

  public ApiResponse post(final String path, final Map<String, String> formParams) {
    return execute("POST", path, formParams);
  }

  public ApiResponse delete(final String path, final Map<String, String> queryParams) {
    return execute("DELETE", path, queryParams);
  }

  /**
   * Checks that the broker accepts the current live session token.
   *
   * @return true if {@code GET /portfolio/accounts} answers 200
   */
  public boolean validate() {
    return flow.isLive(session);
  }

  /**
   * Keeps the brokerage session alive.
   *
   * @return the tickle response
   */
  public TickleResponse tickle() {
    return accessor.read(get(TICKLE_PATH, Map.of()), TickleResponse.class);
  }

  /**
   * Current brokerage session status.
   *
   * @return the status
   */
  public AuthStatusResponse authStatus() {
    return accessor.read(get(AUTH_STATUS_PATH, Map.of()), AuthStatusResponse.class);
  }

  /**
   * Accounts visible to the session.
   *
   * @return the accounts
   */
  public List<Account> accounts() {
    return accessor.read(get(ACCOUNTS_PATH, Map.of()), new TypeReference<List<Account>>() {
    });
  }

  /**
   * Logs out and deletes the persisted tokens.
   *
   * @return true if the broker acknowledged the logout
   */
  public boolean logout() {
    return flow.logout(session);
  }

  private SignedRequest sign(String method, URI uri, Map<String, String> params, Tokens tokens) {
    String upper = method.toUpperCase(Locale.ROOT);
    boolean form = "POST".equals(upper) || "PUT".equals(upper);
    return requestFactory.hmacSigned(upper, uri,
        form ? Map.of() : params,
        form ? params : Map.of(),
        tokens.accessToken().token(),
        tokens.liveSessionToken().value());
  }

  private Tokens currentTokens() {
    Tokens tokens = Tokens.of(session);
    if (tokens == null) {
      // a re-derivation may be in flight; it holds the lock until the new token is in place
      tokens = session.withLock(() -> Tokens.of(session));
    }
    if (tokens == null) {
      throw new NotAuthenticatedException("Session has no live session token; authenticate first");
    }
    return tokens;
  }

  private record Tokens(AccessToken accessToken, LiveSessionToken liveSessionToken) {

    static Tokens of(AuthSession session) {
      AccessToken accessToken = session.accessToken();
      LiveSessionToken liveSessionToken = session.liveSessionToken();
      return accessToken == null || liveSessionToken == null ? null : new Tokens(accessToken, liveSessionToken);
    }
  }
}
