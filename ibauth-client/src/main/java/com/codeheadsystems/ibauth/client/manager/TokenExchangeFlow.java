package com.codeheadsystems.ibauth.client.manager;

import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.CALLBACK;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.CALLBACK_OUT_OF_BAND;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.DH_CHALLENGE;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.TOKEN;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.VERIFIER;

import com.codeheadsystems.ibauth.client.accessor.BrokerAccessor;
import com.codeheadsystems.ibauth.client.exceptions.BrokerAccessorException;
import com.codeheadsystems.ibauth.client.exceptions.NotAuthenticatedException;
import com.codeheadsystems.ibauth.client.exceptions.TokenExchangeException;
import com.codeheadsystems.ibauth.client.model.AccessToken;
import com.codeheadsystems.ibauth.client.model.ApiResponse;
import com.codeheadsystems.ibauth.client.model.AuthState;
import com.codeheadsystems.ibauth.client.model.AuthStep;
import com.codeheadsystems.ibauth.client.model.Credentials;
import com.codeheadsystems.ibauth.client.model.LiveSessionToken;
import com.codeheadsystems.ibauth.client.model.RequestToken;
import com.codeheadsystems.ibauth.client.model.ServerConnectionInfo;
import com.codeheadsystems.ibauth.client.model.SignedRequest;
import com.codeheadsystems.ibauth.client.session.AuthSession;
import com.codeheadsystems.ibauth.client.store.TokenStore;
import com.codeheadsystems.ibauth.model.oauth.AccessTokenResponse;
import com.codeheadsystems.ibauth.model.oauth.LiveSessionTokenResponse;
import com.codeheadsystems.ibauth.model.oauth.RequestTokenResponse;
import com.codeheadsystems.ibauth.model.session.AuthStatusResponse;
import com.codeheadsystems.ibauth.model.store.PersistedTokenRecord;
import com.codeheadsystems.ibauth.rfc.dh.AccessTokenSecretDecryptor;
import com.codeheadsystems.ibauth.rfc.dh.DhExchangeState;
import com.codeheadsystems.ibauth.rfc.dh.DiffieHellmanExchange;
import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;
import com.codeheadsystems.ibauth.rfc.exceptions.SigningException;
import java.math.BigInteger;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives an {@link AuthSession} from unauthenticated to an initialized brokerage session.
 * <p>
 * <strong>Bootstrap</strong> (skipped when a pre-authorized access token is configured):
 * <ol>
 *   <li>RSA-signed {@code POST /oauth/request_token} with {@code oauth_callback=oob}.</li>
 *   <li>RSA-signed {@code POST /oauth/access_token}, optionally with a verifier.</li>
 * </ol>
 * <strong>Session</strong>:
 * <ol>
 *   <li>RSA-signed {@code POST /oauth/live_session_token} carrying the DH challenge, with the
 *       decrypted access token secret prepended to the base string. The reply yields the LST.</li>
 *   <li>HMAC-signed {@code POST /iserver/auth/ssodh/init}, at the gateway first and then the
 *       cloud API. A 401 there discards the LST and derives a new one, once.</li>
 * </ol>
 * A persisted token set for the same consumer is reused when a liveness check accepts it.
 * All token changes happen under the session lock.
 */
@Singleton
public class TokenExchangeFlow {

  private static final Logger log = LoggerFactory.getLogger(TokenExchangeFlow.class);

  static final String REQUEST_TOKEN_PATH = "/oauth/request_token";
  static final String ACCESS_TOKEN_PATH = "/oauth/access_token";
  static final String LIVE_SESSION_TOKEN_PATH = "/oauth/live_session_token";
  static final String SESSION_INIT_PATH = "/iserver/auth/ssodh/init";
  static final String ACCOUNTS_PATH = "/portfolio/accounts";
  static final String LOGOUT_PATH = "/logout";

  private static final Map<String, String> SESSION_INIT_FORM = Map.of("publish", "true", "compete", "false");

  private final Credentials credentials;
  private final ServerConnectionInfo servers;
  private final BrokerAccessor accessor;
  private final OAuthRequestFactory requestFactory;
  private final TokenStore tokenStore;
  private final DiffieHellmanExchange diffieHellman;
  private final AccessTokenSecretDecryptor secretDecryptor;
  private final Clock clock;
  private final AccessToken preAuthorizedAccessToken;

  /**
   * Instantiates a new Token exchange flow.
   *
   * @param credentials              the credentials
   * @param servers                  the broker base urls
   * @param accessor                 the accessor
   * @param requestFactory           the request factory
   * @param tokenStore               the token store
   * @param diffieHellman            the DH exchange
   * @param clock                    the clock
   * @param preAuthorizedAccessToken configured access token, or null to run the bootstrap
   */
  @Inject
  public TokenExchangeFlow(final Credentials credentials,
                           final ServerConnectionInfo servers,
                           final BrokerAccessor accessor,
                           final OAuthRequestFactory requestFactory,
                           final TokenStore tokenStore,
                           final DiffieHellmanExchange diffieHellman,
                           final Clock clock,
                           final AccessToken preAuthorizedAccessToken) {
    log.info("TokenExchangeFlow(preAuthorized={})", preAuthorizedAccessToken != null);
    this.credentials = credentials;
    this.servers = servers;
    this.accessor = accessor;
    this.requestFactory = requestFactory;
    this.tokenStore = tokenStore;
    this.diffieHellman = diffieHellman;
    this.secretDecryptor = new AccessTokenSecretDecryptor(credentials.encryptionKey());
    this.clock = clock;
    this.preAuthorizedAccessToken = preAuthorizedAccessToken;
  }

  /**
   * Runs whatever steps the session still needs to reach {@link AuthState#SESSION_INITIALIZED}.
   *
   * @param session the session
   * @return the same session
   * @throws TokenExchangeException if the broker rejects a step; the session is left
   *                                {@link AuthState#FAILED} with the failing step recorded
   */
  public AuthSession authenticate(final AuthSession session) {
    log.debug("authenticate({})", session);
    return session.withLock(() -> {
      if (session.isAuthenticated()) {
        return session;
      }
      try {
        if (resumeStoredSession(session)) {
          return session;
        }
        if (session.accessToken() == null) {
          if (preAuthorizedAccessToken != null) {
            log.info("Using pre-authorized access token {}", preAuthorizedAccessToken.token());
            session.onAccessToken(preAuthorizedAccessToken);
          } else {
            accessToken(session, requestToken(session), null);
          }
        }
        liveSessionToken(session);
        initializeWithRestart(session);
        return session;
      } catch (IbAuthException e) {
        fail(session, e);
        throw e;
      }
    });
  }

  /**
   * Obtains a request token.
   *
   * @param session the session
   * @return the request token
   */
  public RequestToken requestToken(final AuthSession session) {
    log.debug("requestToken()");
    SignedRequest request = requestFactory.rsaSigned("POST", servers.api(REQUEST_TOKEN_PATH),
        Map.of(CALLBACK, CALLBACK_OUT_OF_BAND), null);
    RequestTokenResponse response = parse(AuthStep.REQUEST_TOKEN,
        exchange(AuthStep.REQUEST_TOKEN, request), RequestTokenResponse.class);
    if (response.oauthToken() == null) {
      throw new TokenExchangeException(AuthStep.REQUEST_TOKEN, "response carried no oauth_token", null);
    }
    session.withLock(() -> {
      session.onRequestToken();
      return null;
    });
    log.info("Obtained request token");
    return new RequestToken(response.oauthToken());
  }

  /**
   * Exchanges a request token for an access token.
   *
   * @param session      the session
   * @param requestToken the request token
   * @param verifier     the verifier from an interactive authorization, or null
   * @return the access token
   */
  public AccessToken accessToken(final AuthSession session,
                                 final RequestToken requestToken,
                                 final String verifier) {
    log.debug("accessToken(verifier={})", verifier != null);
    Map<String, String> params = new HashMap<>();
    params.put(TOKEN, requestToken.value());
    if (verifier != null) {
      params.put(VERIFIER, verifier);
    }
    SignedRequest request = requestFactory.rsaSigned("POST", servers.api(ACCESS_TOKEN_PATH), params, null);
    AccessTokenResponse response = parse(AuthStep.ACCESS_TOKEN,
        exchange(AuthStep.ACCESS_TOKEN, request), AccessTokenResponse.class);
    if (response.oauthToken() == null || response.oauthTokenSecret() == null) {
      throw new TokenExchangeException(AuthStep.ACCESS_TOKEN, "response carried no token or secret", null);
    }
    AccessToken accessToken = new AccessToken(response.oauthToken(), response.oauthTokenSecret());
    session.withLock(() -> {
      session.onAccessToken(accessToken);
      return null;
    });
    log.info("Obtained access token {}", accessToken.token());
    return accessToken;
  }

  /**
   * Derives a fresh live session token for the session's access token and persists the pair.
   *
   * @param session the session, which must hold an access token
   * @return the live session token
   */
  public LiveSessionToken liveSessionToken(final AuthSession session) {
    return session.withLock(() -> {
      AccessToken accessToken = session.accessToken();
      if (accessToken == null) {
        throw new NotAuthenticatedException("No access token to derive a live session token from");
      }
      log.debug("liveSessionToken(accessToken={})", accessToken.token());

      // Step 1: challenge A = g^a mod p, signed with the decrypted secret as prepend
      DhExchangeState dhState = diffieHellman.begin();
      String prepend = secretDecryptor.decryptToHex(accessToken.encryptedSecret());
      Map<String, String> params = Map.of(
          TOKEN, accessToken.token(),
          DH_CHALLENGE, dhState.challengeHex());
      SignedRequest request = requestFactory.rsaSigned("POST", servers.api(LIVE_SESSION_TOKEN_PATH),
          params, prepend);
      LiveSessionTokenResponse response = parse(AuthStep.LIVE_SESSION_TOKEN,
          exchange(AuthStep.LIVE_SESSION_TOKEN, request), LiveSessionTokenResponse.class);

      // Step 2: K = B^a mod p, LST = HMAC-SHA1(K, secret)
      BigInteger sharedSecret;
      try {
        sharedSecret = diffieHellman.sharedSecret(dhState, response.diffieHellmanResponse());
      } catch (IllegalArgumentException e) {
        throw new TokenExchangeException(AuthStep.LIVE_SESSION_TOKEN, "invalid diffie_hellman_response", e);
      }
      String value = DiffieHellmanExchange.deriveLiveSessionToken(sharedSecret, accessToken.encryptedSecret());

      // Step 3: compare with the broker's signature; a mismatch is reported but not fatal
      boolean verified = DiffieHellmanExchange.verifyLiveSessionToken(value, credentials.consumerKey(),
          response.liveSessionTokenSignature());
      Instant expiresAt = response.liveSessionTokenExpiration() == null
          ? null
          : Instant.ofEpochMilli(response.liveSessionTokenExpiration());
      LiveSessionToken token = new LiveSessionToken(value, expiresAt, verified);
      if (!verified) {
        log.warn("Live session token signature from the broker does not match the derived token {}; "
            + "continuing with the derived token", token.fingerprint());
      }
      session.onLiveSessionToken(token);
      persist(session);
      log.info("Derived live session token {} (expiresAt={})", token.fingerprint(), expiresAt);
      return token;
    });
  }

  /**
   * Initializes the brokerage session, trying the gateway before the cloud API.
   *
   * @param session the session, which must hold a live session token
   * @return the status reported by whichever base accepted the call
   * @throws TokenExchangeException the 401 if any base rejected the token, else the last failure
   */
  public AuthStatusResponse initializeBrokerageSession(final AuthSession session) {
    return session.withLock(() -> {
      AccessToken accessToken = session.accessToken();
      LiveSessionToken liveSessionToken = session.liveSessionToken();
      if (accessToken == null || liveSessionToken == null) {
        throw new NotAuthenticatedException("No live session token to initialize a brokerage session with");
      }
      TokenExchangeException unauthorized = null;
      TokenExchangeException last = null;
      for (URI base : servers.sessionInitBases()) {
        log.debug("initializeBrokerageSession(base={})", base);
        SignedRequest request = requestFactory.hmacSigned("POST",
            ServerConnectionInfo.resolve(base, SESSION_INIT_PATH), Map.of(), SESSION_INIT_FORM,
            accessToken.token(), liveSessionToken.value());
        try {
          AuthStatusResponse status = parse(AuthStep.SESSION_INIT,
              exchange(AuthStep.SESSION_INIT, request), AuthStatusResponse.class);
          if (!status.authenticated()) {
            log.warn("Brokerage session at {} reports authenticated=false: {}", base, status.message());
          }
          log.info("Brokerage session initialized via {} (connected={}, competing={})",
              base, status.connected(), status.competing());
          session.onSessionInitialized();
          return status;
        } catch (TokenExchangeException e) {
          log.warn("Brokerage session init failed at {}: {}", base, e.getMessage());
          if (e.isUnauthorized()) {
            unauthorized = e;
          }
          last = e;
        }
      }
      throw unauthorized != null ? unauthorized : last;
    });
  }

  /**
   * Replaces a live session token that the broker rejected.
   * <p>
   * If another caller already replaced {@code rejected} while this one waited for the lock,
   * nothing is derived.
   *
   * @param session  the session
   * @param rejected the token the broker rejected
   * @return true if this call derived a new token
   */
  public boolean rederive(final AuthSession session, final LiveSessionToken rejected) {
    return session.withLock(() -> {
      LiveSessionToken current = session.liveSessionToken();
      if (current != null && !current.equals(rejected)) {
        log.debug("rederive: token already replaced by {}", current.fingerprint());
        return false;
      }
      log.info("Re-deriving live session token after rejection of {}",
          rejected == null ? null : rejected.fingerprint());
      try {
        session.invalidateLiveSessionToken();
        liveSessionToken(session);
        initializeBrokerageSession(session);
        return true;
      } catch (IbAuthException e) {
        fail(session, e);
        throw e;
      }
    });
  }

  /**
   * Liveness check: an HMAC-signed {@code GET /portfolio/accounts}.
   *
   * @param session the session
   * @return true if the broker answered 200
   * @throws BrokerAccessorException if the broker could not be reached
   */
  public boolean isLive(final AuthSession session) {
    AccessToken accessToken = session.accessToken();
    LiveSessionToken liveSessionToken = session.liveSessionToken();
    if (accessToken == null || liveSessionToken == null) {
      return false;
    }
    SignedRequest request = requestFactory.hmacSigned("GET", servers.api(ACCOUNTS_PATH), Map.of(), Map.of(),
        accessToken.token(), liveSessionToken.value());
    ApiResponse response = accessor.send(request);
    log.debug("isLive: {} -> {}", liveSessionToken.fingerprint(), response.statusCode());
    return response.statusCode() == 200;
  }

  /**
   * Ends the brokerage session and forgets all tokens, locally and in the token store.
   *
   * @param session the session
   * @return true if the broker acknowledged the logout
   */
  public boolean logout(final AuthSession session) {
    return session.withLock(() -> {
      boolean acknowledged = false;
      try {
        if (session.accessToken() != null && session.liveSessionToken() != null) {
          SignedRequest request = requestFactory.hmacSigned("POST", servers.api(LOGOUT_PATH), Map.of(), Map.of(),
              session.accessToken().token(), session.liveSessionToken().value());
          ApiResponse response = accessor.send(request);
          acknowledged = response.isSuccess();
          if (!acknowledged) {
            log.warn("Logout returned HTTP {}", response.statusCode());
          }
        }
      } finally {
        session.clear();
        tokenStore.clear();
        log.info("Logged out, tokens cleared");
      }
      return acknowledged;
    });
  }

  private boolean resumeStoredSession(AuthSession session) {
    Optional<PersistedTokenRecord> stored = tokenStore.load()
        .filter(record -> credentials.consumerKey().equals(record.consumerKey()));
    if (stored.isEmpty()) {
      return false;
    }
    PersistedTokenRecord record = stored.get();
    if (preAuthorizedAccessToken != null && !preAuthorizedAccessToken.token().equals(record.accessToken())) {
      log.info("Stored tokens belong to a different access token, ignoring them");
      return false;
    }
    session.onAccessToken(new AccessToken(record.accessToken(), record.accessTokenSecret()));
    LiveSessionToken token = new LiveSessionToken(record.liveSessionToken(),
        record.liveSessionTokenExpiration() == null ? null : Instant.ofEpochMilli(record.liveSessionTokenExpiration()),
        Boolean.TRUE.equals(record.liveSessionTokenVerified()));
    if (token.isExpired(clock.instant())) {
      log.info("Stored live session token {} expired at {}", token.fingerprint(), token.expiresAt());
      return false;
    }
    session.onLiveSessionToken(token);
    boolean live;
    try {
      live = isLive(session);
    } catch (BrokerAccessorException e) {
      log.warn("Liveness check failed: {}", e.getMessage());
      live = false;
    } catch (SigningException e) {
      log.warn("Stored live session token {} cannot sign requests: {}", token.fingerprint(), e.getMessage());
      live = false;
    }
    if (!live) {
      log.info("Stored live session token {} is no longer accepted", token.fingerprint());
      session.invalidateLiveSessionToken();
      return false;
    }
    log.info("Reusing stored live session token {}", token.fingerprint());
    initializeWithRestart(session);
    return true;
  }

  private void initializeWithRestart(AuthSession session) {
    try {
      initializeBrokerageSession(session);
    } catch (TokenExchangeException e) {
      if (!e.isUnauthorized()) {
        throw e;
      }
      log.warn("Brokerage session init rejected the live session token, deriving a new one");
      session.invalidateLiveSessionToken();
      liveSessionToken(session);
      initializeBrokerageSession(session);
    }
  }

  private void persist(AuthSession session) {
    AccessToken accessToken = session.accessToken();
    LiveSessionToken liveSessionToken = session.liveSessionToken();
    tokenStore.save(new PersistedTokenRecord(
        accessToken.token(),
        accessToken.encryptedSecret(),
        liveSessionToken.value(),
        credentials.consumerKey(),
        credentials.realm(),
        clock.instant().toString(),
        liveSessionToken.expiresAt() == null ? null : liveSessionToken.expiresAt().toEpochMilli(),
        liveSessionToken.verified()));
  }

  private ApiResponse exchange(AuthStep step, SignedRequest request) {
    ApiResponse response;
    try {
      response = accessor.send(request);
    } catch (BrokerAccessorException e) {
      throw new TokenExchangeException(step, "no response from " + request.uri(), e);
    }
    if (response.statusCode() != 200) {
      throw new TokenExchangeException(step, response.statusCode(), response.body());
    }
    return response;
  }

  private <T> T parse(AuthStep step, ApiResponse response, Class<T> type) {
    try {
      T value = accessor.read(response, type);
      if (value == null) {
        throw new TokenExchangeException(step, "empty response body", null);
      }
      return value;
    } catch (BrokerAccessorException e) {
      throw new TokenExchangeException(step, "unreadable response", e);
    }
  }

  private static void fail(AuthSession session, IbAuthException e) {
    AuthStep step = e instanceof TokenExchangeException
        ? ((TokenExchangeException) e).step()
        : nextStep(session.state());
    log.error("Authentication failed at {}: {}", step, e.getMessage());
    session.onFailure(step);
  }

  private static AuthStep nextStep(AuthState state) {
    switch (state) {
      case UNAUTHENTICATED:
        return AuthStep.REQUEST_TOKEN;
      case HAS_REQUEST_TOKEN:
        return AuthStep.ACCESS_TOKEN;
      case HAS_ACCESS_TOKEN:
        return AuthStep.LIVE_SESSION_TOKEN;
      default:
        return AuthStep.SESSION_INIT;
    }
  }
}
