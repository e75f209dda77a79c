package com.codeheadsystems.ibauth.client.accessor;

import com.codeheadsystems.ibauth.client.exceptions.BrokerAccessorException;
import com.codeheadsystems.ibauth.client.model.ApiResponse;
import com.codeheadsystems.ibauth.client.model.SignedRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP transport for signed broker requests.
 * <p>
 * Every call carries the configured timeout. Status codes are returned to the caller as an
 * {@link ApiResponse}; only transport failures throw here. I/O errors, timeouts and interruptions
 * are wrapped in {@link BrokerAccessorException}. No call is retried at this layer.
 */
@Singleton
public class BrokerAccessor {

  private static final Logger log = LoggerFactory.getLogger(BrokerAccessor.class);

  private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration timeout;

  /**
   * Instantiates a new Broker accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param timeout      per-request timeout
   */
  @Inject
  public BrokerAccessor(final HttpClient httpClient,
                        final ObjectMapper objectMapper,
                        final Duration timeout) {
    log.info("BrokerAccessor(timeout={})", timeout);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.timeout = timeout;
  }

  /**
   * Sends a signed request.
   *
   * @param signedRequest the request
   * @return the response, whatever its status
   * @throws BrokerAccessorException if no response was received
   */
  public ApiResponse send(final SignedRequest signedRequest) {
    log.debug("send(method={}, uri={})", signedRequest.method(), signedRequest.uri());
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(signedRequest.uri())
          .timeout(timeout)
          .header("Authorization", signedRequest.authorizationHeader())
          .header("Accept", "application/json");
      if (signedRequest.hasFormBody()) {
        builder.header("Content-Type", FORM_CONTENT_TYPE)
            .method(signedRequest.method(), HttpRequest.BodyPublishers.ofString(signedRequest.formBody()));
      } else {
        builder.method(signedRequest.method(), HttpRequest.BodyPublishers.noBody());
      }
      HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      log.debug("send: {} {} -> {}", signedRequest.method(), signedRequest.uri(), response.statusCode());
      return new ApiResponse(response.statusCode(), response.body() == null ? "" : response.body());
    } catch (IOException e) {
      throw new BrokerAccessorException("HTTP request failed for " + signedRequest.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerAccessorException("HTTP request interrupted for " + signedRequest.uri(), e);
    }
  }

  /**
   * Parses a successful response body.
   *
   * @param response     the response
   * @param responseType target type
   * @param <T>          the type
   * @return the parsed body
   * @throws BrokerAccessorException if the status is not 2xx or the body does not parse
   */
  public <T> T read(final ApiResponse response, final Class<T> responseType) {
    checkStatus(response);
    try {
      return objectMapper.readValue(response.body(), responseType);
    } catch (JsonProcessingException e) {
      throw new BrokerAccessorException("Unable to parse broker response as " + responseType.getSimpleName(), e);
    }
  }

  /**
   * Parses a successful response body into a generic type.
   *
   * @param response     the response
   * @param responseType target type
   * @param <T>          the type
   * @return the parsed body
   * @throws BrokerAccessorException if the status is not 2xx or the body does not parse
   */
  public <T> T read(final ApiResponse response, final TypeReference<T> responseType) {
    checkStatus(response);
    try {
      return objectMapper.readValue(response.body(), responseType);
    } catch (JsonProcessingException e) {
      throw new BrokerAccessorException("Unable to parse broker response as " + responseType.getType(), e);
    }
  }

  private void checkStatus(ApiResponse response) {
    if (!response.isSuccess()) {
      throw new BrokerAccessorException(
          "Broker returned HTTP " + response.statusCode() + ": " + response.body(), response.statusCode());
    }
  }
}
