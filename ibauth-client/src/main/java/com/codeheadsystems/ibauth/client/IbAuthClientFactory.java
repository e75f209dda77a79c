package com.codeheadsystems.ibauth.client;

import com.codeheadsystems.ibauth.client.accessor.BrokerAccessor;
import com.codeheadsystems.ibauth.client.config.CredentialStore;
import com.codeheadsystems.ibauth.client.config.IbAuthConfig;
import com.codeheadsystems.ibauth.client.manager.OAuthRequestFactory;
import com.codeheadsystems.ibauth.client.manager.TokenExchangeFlow;
import com.codeheadsystems.ibauth.client.model.AccessToken;
import com.codeheadsystems.ibauth.client.model.Credentials;
import com.codeheadsystems.ibauth.client.model.ServerConnectionInfo;
import com.codeheadsystems.ibauth.client.session.AuthSession;
import com.codeheadsystems.ibauth.client.store.FileTokenStore;
import com.codeheadsystems.ibauth.client.store.TokenStore;
import com.codeheadsystems.ibauth.rfc.common.RandomProvider;
import com.codeheadsystems.ibauth.rfc.dh.DiffieHellmanExchange;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wires an {@link AuthenticatedClient} from configuration.
 */
public class IbAuthClientFactory {

  private IbAuthClientFactory() {
  }

  /**
   * Builds a client that persists tokens to the configured file.
   *
   * @param config the config
   * @return the client, not yet authenticated
   */
  public static AuthenticatedClient create(final IbAuthConfig config) {
    ObjectMapper objectMapper = new ObjectMapper();
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(config.httpTimeout())
        .build();
    return create(config, httpClient, objectMapper, new FileTokenStore(config.tokenFile(), objectMapper),
        Clock.systemUTC());
  }

  /**
   * Builds a client from explicit collaborators.
   *
   * @param config       the config
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param tokenStore   the token store
   * @param clock        the clock
   * @return the client, not yet authenticated
   */
  public static AuthenticatedClient create(final IbAuthConfig config,
                                           final HttpClient httpClient,
                                           final ObjectMapper objectMapper,
                                           final TokenStore tokenStore,
                                           final Clock clock) {
    Credentials credentials = new CredentialStore(config).load();
    RandomProvider randomProvider = new RandomProvider();
    ServerConnectionInfo servers = new ServerConnectionInfo(config.apiBaseUrl(), config.gatewayBaseUrl());
    BrokerAccessor accessor = new BrokerAccessor(httpClient, objectMapper, config.httpTimeout());
    OAuthRequestFactory requestFactory = new OAuthRequestFactory(credentials, randomProvider, clock);
    AccessToken preAuthorized = config.hasPreAuthorizedAccessToken()
        ? new AccessToken(config.accessToken(), config.accessTokenSecret())
        : null;
    TokenExchangeFlow flow = new TokenExchangeFlow(credentials, servers, accessor, requestFactory, tokenStore,
        new DiffieHellmanExchange(credentials.dhParameters(), randomProvider), clock, preAuthorized);
    return new AuthenticatedClient(new AuthSession(), flow, requestFactory, accessor, servers);
  }
}
