package com.codeheadsystems.ibauth.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.ibauth.client.config.IbAuthConfig;
import com.codeheadsystems.ibauth.client.exceptions.NotAuthenticatedException;
import com.codeheadsystems.ibauth.client.exceptions.SessionExpiredException;
import com.codeheadsystems.ibauth.client.exceptions.TokenExchangeException;
import com.codeheadsystems.ibauth.client.model.ApiResponse;
import com.codeheadsystems.ibauth.client.model.AuthState;
import com.codeheadsystems.ibauth.client.model.AuthStep;
import com.codeheadsystems.ibauth.client.model.SignedRequest;
import com.codeheadsystems.ibauth.client.testing.MockBroker;
import com.codeheadsystems.ibauth.client.testing.TestCredentials;
import com.codeheadsystems.ibauth.model.session.Account;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuthenticatedClientTest {

  private static TestCredentials credentials;

  @TempDir
  Path dir;

  private MockBroker broker;
  private Map<String, String> env;

  @BeforeAll
  static void generateCredentials() throws Exception {
    credentials = TestCredentials.generate();
  }

  @BeforeEach
  void setUp() throws Exception {
    broker = new MockBroker(credentials);
    env = credentials.writeEnvironment(dir, broker.baseUrl());
  }

  @AfterEach
  void tearDown() {
    broker.close();
  }

  private AuthenticatedClient preAuthorizedClient() {
    return IbAuthClientFactory.create(IbAuthConfig.fromEnvironment(credentials.withPreAuthorizedToken(env)));
  }

  private AuthenticatedClient bootstrapClient() {
    return IbAuthClientFactory.create(IbAuthConfig.fromEnvironment(env));
  }

  private void editTokenFile(Consumer<ObjectNode> edit) throws IOException {
    Path file = dir.resolve("tokens.json");
    ObjectNode node = (ObjectNode) new ObjectMapper().readTree(Files.readString(file));
    edit.accept(node);
    Files.writeString(file, node.toString());
  }

  // ── Token exchange ────────────────────────────────────────────────────────

  @Test
  void fastPath_derivesLstInitializesSessionAndSignsCalls() {
    AuthenticatedClient client = preAuthorizedClient();

    client.authenticate();

    assertThat(client.isAuthenticated()).isTrue();
    assertThat(client.session().state()).isEqualTo(AuthState.SESSION_INITIALIZED);
    assertThat(client.session().liveSessionToken().value()).isEqualTo(broker.liveSessionToken());
    assertThat(client.session().liveSessionToken().verified()).isTrue();
    assertThat(client.session().liveSessionToken().expiresAt()).isNotNull();
    assertThat(broker.requestTokenCalls()).isZero();
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(1);
    assertThat(broker.sessionInitCalls()).isEqualTo(1);
    assertThat(dir.resolve("tokens.json")).exists();

    ApiResponse response = client.get("/portfolio/accounts", Map.of());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(broker.lastAuthorizationHeader())
        .startsWith("OAuth realm=\"limited_poa\", ")
        .contains("oauth_signature_method=\"HMAC-SHA256\"")
        .contains("oauth_version=\"1.0\"")
        .contains("oauth_token=\"" + TestCredentials.ACCESS_TOKEN + "\"");
  }

  @Test
  void bootstrap_withoutPreAuthorizedToken_obtainsRequestAndAccessTokens() {
    AuthenticatedClient client = IbAuthClientFactory.create(IbAuthConfig.fromEnvironment(env));

    client.authenticate();

    assertThat(client.isAuthenticated()).isTrue();
    assertThat(broker.requestTokenCalls()).isEqualTo(1);
    assertThat(broker.accessTokenCalls()).isEqualTo(1);
    assertThat(client.session().accessToken().token()).isEqualTo(TestCredentials.ACCESS_TOKEN);
  }

  @Test
  void authenticate_twice_doesNotRepeatTheExchange() {
    AuthenticatedClient client = preAuthorizedClient();

    client.authenticate();
    client.authenticate();

    assertThat(broker.liveSessionTokenCalls()).isEqualTo(1);
    assertThat(broker.sessionInitCalls()).isEqualTo(1);
  }

  @Test
  void gatewayUnreachable_fallsBackToCloud() throws Exception {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    env.put(IbAuthConfig.GATEWAY_BASE_URL, "http://127.0.0.1:" + closedPort + "/v1/api");
    AuthenticatedClient client = preAuthorizedClient();

    client.authenticate();

    assertThat(client.isAuthenticated()).isTrue();
    assertThat(broker.sessionInitCalls()).isEqualTo(1);
  }

  @Test
  void sessionInitRejectedOnce_derivesNewLstAndSucceeds() {
    broker.rejectNextSessionInits(1);
    AuthenticatedClient client = preAuthorizedClient();

    client.authenticate();

    assertThat(client.isAuthenticated()).isTrue();
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
    assertThat(broker.sessionInitCalls()).isEqualTo(2);
  }

  @Test
  void sessionInitRejectedTwice_failsAtSessionInit() {
    broker.rejectNextSessionInits(2);
    AuthenticatedClient client = preAuthorizedClient();

    assertThatThrownBy(client::authenticate)
        .isInstanceOf(TokenExchangeException.class)
        .satisfies(e -> {
          TokenExchangeException tee = (TokenExchangeException) e;
          assertThat(tee.step()).isEqualTo(AuthStep.SESSION_INIT);
          assertThat(tee.statusCode()).isEqualTo(401);
        });
    assertThat(client.session().state()).isEqualTo(AuthState.FAILED);
    assertThat(client.session().failedStep()).isEqualTo(AuthStep.SESSION_INIT);
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
  }

  @Test
  void liveSessionTokenRejected_reportsStepAndStatus() {
    broker.failLiveSessionToken(true);
    AuthenticatedClient client = preAuthorizedClient();

    assertThatThrownBy(client::authenticate)
        .isInstanceOf(TokenExchangeException.class)
        .hasMessageContaining("LIVE_SESSION_TOKEN")
        .hasMessageContaining("401");
    assertThat(client.isAuthenticated()).isFalse();
    assertThat(client.session().failedStep()).isEqualTo(AuthStep.LIVE_SESSION_TOKEN);
    assertThat(dir.resolve("tokens.json")).doesNotExist();
  }

  @Test
  void lstSignatureMismatch_isToleratedButFlagged() {
    broker.corruptLstSignature(true);
    AuthenticatedClient client = preAuthorizedClient();

    client.authenticate();

    assertThat(client.isAuthenticated()).isTrue();
    assertThat(client.session().liveSessionToken().verified()).isFalse();
    assertThat(client.get("/portfolio/accounts", Map.of()).statusCode()).isEqualTo(200);
  }

  // ── Persisted tokens ──────────────────────────────────────────────────────

  @Test
  void storedTokens_areReusedByANewClient() {
    preAuthorizedClient().authenticate();

    AuthenticatedClient second = preAuthorizedClient();
    second.authenticate();

    assertThat(second.isAuthenticated()).isTrue();
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(1);
    assertThat(broker.sessionInitCalls()).isEqualTo(2);
    assertThat(second.session().liveSessionToken().verified()).isTrue();
    assertThat(second.get("/portfolio/accounts", Map.of()).statusCode()).isEqualTo(200);
  }

  @Test
  void storedTokens_noLongerAccepted_areReplaced() {
    preAuthorizedClient().authenticate();
    broker.revokeLiveSessionToken();

    AuthenticatedClient second = preAuthorizedClient();
    second.authenticate();

    assertThat(second.isAuthenticated()).isTrue();
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
    assertThat(second.session().liveSessionToken().value()).isEqualTo(broker.liveSessionToken());
  }

  @Test
  void storedTokens_withoutAccessTokenSecret_startOver() throws Exception {
    bootstrapClient().authenticate();
    editTokenFile(node -> node.remove("access_token_secret"));
    broker.revokeLiveSessionToken();

    AuthenticatedClient second = bootstrapClient();
    second.authenticate();

    assertThat(second.isAuthenticated()).isTrue();
    assertThat(second.session().state()).isEqualTo(AuthState.SESSION_INITIALIZED);
    assertThat(broker.requestTokenCalls()).isEqualTo(2);
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
    assertThat(second.session().accessToken().encryptedSecret()).isEqualTo(credentials.encryptedAccessTokenSecret());
    assertThat(Files.readString(dir.resolve("tokens.json"))).contains("access_token_secret");
  }

  @Test
  void storedTokens_withUnusableLst_areReplacedAndRewritten() throws Exception {
    preAuthorizedClient().authenticate();
    editTokenFile(node -> node.put("live_session_token", "not*base64!"));

    AuthenticatedClient second = preAuthorizedClient();
    second.authenticate();

    assertThat(second.isAuthenticated()).isTrue();
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);

    AuthenticatedClient third = preAuthorizedClient();
    third.authenticate();

    assertThat(third.isAuthenticated()).isTrue();
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
    assertThat(third.session().liveSessionToken().value()).isEqualTo(broker.liveSessionToken());
  }

  @Test
  void storedTokens_keepAFailedVerification() {
    broker.corruptLstSignature(true);
    preAuthorizedClient().authenticate();

    AuthenticatedClient second = preAuthorizedClient();
    second.authenticate();

    assertThat(broker.liveSessionTokenCalls()).isEqualTo(1);
    assertThat(second.session().liveSessionToken().verified()).isFalse();
  }

  // ── Signed calls ──────────────────────────────────────────────────────────

  @Test
  void signedRequest_beforeAuthenticate_throwsNotAuthenticated() {
    AuthenticatedClient client = preAuthorizedClient();

    assertThat(client.isAuthenticated()).isFalse();
    assertThatThrownBy(() -> client.signedRequest("GET", "/portfolio/accounts", Map.of()))
        .isInstanceOf(NotAuthenticatedException.class);
  }

  @Test
  void signedRequest_putsQueryParamsInTheUrlAndFormParamsInTheBody() {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();

    SignedRequest get = client.signedRequest("GET", "/echo", Map.of("symbol", "BRK B"));
    SignedRequest post = client.signedRequest("POST", "/echo", Map.of("confirmed", "true"));

    assertThat(get.uri().toString()).endsWith("/v1/api/echo?symbol=BRK%20B");
    assertThat(get.formBody()).isNull();
    assertThat(get.authorizationHeader()).doesNotContain("symbol");
    assertThat(post.uri().toString()).endsWith("/v1/api/echo");
    assertThat(post.formBody()).isEqualTo("confirmed=true");
  }

  @Test
  void queryAndFormParams_areCoveredByTheSignature() {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();

    ApiResponse get = client.get("/echo", Map.of("fields", "31,84|85", "conids", "265598:STK"));
    assertThat(get.statusCode()).isEqualTo(200);
    assertThat(broker.lastParameters()).containsEntry("fields", "31,84|85").containsEntry("conids", "265598:STK");

    ApiResponse post = client.post("/echo", Map.of("note", "a b+c", "confirmed", "true"));
    assertThat(post.statusCode()).isEqualTo(200);
    assertThat(broker.lastParameters()).containsEntry("note", "a b+c").containsEntry("confirmed", "true");
  }

  @Test
  void unauthorized_rederivesOnceAndRetries() {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();
    String before = client.session().liveSessionToken().value();
    broker.revokeLiveSessionToken();

    ApiResponse response = client.get("/portfolio/accounts", Map.of());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
    assertThat(client.session().liveSessionToken().value()).isNotEqualTo(before);
    assertThat(client.isAuthenticated()).isTrue();
  }

  @Test
  void unauthorizedAfterRederivation_throwsSessionExpired() {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();
    broker.rejectAllSignedCalls(true);

    assertThatThrownBy(() -> client.get("/portfolio/accounts", Map.of()))
        .isInstanceOf(SessionExpiredException.class);
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
    assertThat(client.isAuthenticated()).isFalse();
  }

  @Test
  void concurrentUnauthorizedCalls_shareASingleRederivation() throws Exception {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();
    broker.revokeLiveSessionToken();

    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<ApiResponse>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          return client.get("/portfolio/accounts", Map.of());
        }));
      }
      start.countDown();
      for (Future<ApiResponse> future : futures) {
        assertThat(future.get(30, TimeUnit.SECONDS).statusCode()).isEqualTo(200);
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(broker.liveSessionTokenCalls()).isEqualTo(2);
  }

  // ── Session endpoints ─────────────────────────────────────────────────────

  @Test
  void sessionEndpoints_parseBrokerResponses() {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();

    assertThat(client.validate()).isTrue();
    assertThat(client.tickle().session()).isEqualTo("sess-1");
    assertThat(client.authStatus().authenticated()).isTrue();
    List<Account> accounts = client.accounts();
    assertThat(accounts).extracting(Account::accountId).containsExactly("U1234567");
  }

  @Test
  void validate_afterRevocation_isFalse() {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();
    broker.revokeLiveSessionToken();

    assertThat(client.validate()).isFalse();
  }

  @Test
  void logout_clearsSessionAndTokenFile() {
    AuthenticatedClient client = preAuthorizedClient();
    client.authenticate();
    assertThat(Files.exists(dir.resolve("tokens.json"))).isTrue();

    assertThat(client.logout()).isTrue();

    assertThat(client.isAuthenticated()).isFalse();
    assertThat(client.session().state()).isEqualTo(AuthState.UNAUTHENTICATED);
    assertThat(dir.resolve("tokens.json")).doesNotExist();
    assertThatThrownBy(() -> client.get("/portfolio/accounts", Map.of()))
        .isInstanceOf(NotAuthenticatedException.class);
  }
}
