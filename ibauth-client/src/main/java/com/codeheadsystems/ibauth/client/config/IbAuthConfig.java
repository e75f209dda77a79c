package com.codeheadsystems.ibauth.client.config;

import com.codeheadsystems.ibauth.rfc.exceptions.ConfigurationException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable client configuration.
 * <p>
 * Built from {@code IB_*} keys by {@link #fromEnvironment(Map)}; tests pass a map rather than
 * touching the process environment.
 *
 * @param consumerKey       OAuth consumer key
 * @param realm             OAuth realm
 * @param signatureKeyPath  PEM RSA signing key
 * @param encryptionKeyPath PEM RSA encryption key
 * @param dhParamPath       PEM DH parameters
 * @param tokenFile         token persistence file
 * @param accessToken       pre-authorized access token, may be null
 * @param accessTokenSecret pre-authorized encrypted access token secret, may be null
 * @param apiBaseUrl        cloud API base
 * @param gatewayBaseUrl    local gateway base, may be null to skip the gateway
 * @param httpTimeout       per-call timeout
 */
public record IbAuthConfig(String consumerKey,
                           String realm,
                           Path signatureKeyPath,
                           Path encryptionKeyPath,
                           Path dhParamPath,
                           Path tokenFile,
                           String accessToken,
                           String accessTokenSecret,
                           URI apiBaseUrl,
                           URI gatewayBaseUrl,
                           Duration httpTimeout) {

  public static final String CONSUMER_KEY = "IB_CONSUMER_KEY";
  public static final String REALM = "IB_REALM";
  public static final String SIGNATURE_KEY_PATH = "IB_SIGNATURE_KEY_PATH";
  public static final String ENCRYPTION_KEY_PATH = "IB_ENCRYPTION_KEY_PATH";
  public static final String DH_PARAM_PATH = "IB_DH_PARAM_PATH";
  public static final String TOKEN_FILE = "IB_TOKEN_FILE";
  public static final String ACCESS_TOKEN = "IB_ACCESS_TOKEN";
  public static final String ACCESS_TOKEN_SECRET = "IB_ACCESS_TOKEN_SECRET";
  public static final String API_BASE_URL = "IB_API_BASE_URL";
  public static final String GATEWAY_BASE_URL = "IB_GATEWAY_BASE_URL";
  public static final String HTTP_TIMEOUT_SECONDS = "IB_HTTP_TIMEOUT_SECONDS";

  public static final String DEFAULT_REALM = "limited_poa";
  public static final String DEFAULT_API_BASE_URL = "https://api.ibkr.com/v1/api";
  public static final String DEFAULT_GATEWAY_BASE_URL = "https://localhost:5000/v1/api";
  public static final String DEFAULT_TOKEN_FILE_NAME = ".ib_rest_tokens.json";
  public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

  /**
   * Reads configuration from the process environment.
   *
   * @return the config
   */
  public static IbAuthConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads configuration from the given key/value map.
   * <p>
   * An empty {@code IB_GATEWAY_BASE_URL} disables the gateway attempt during session init.
   *
   * @param env the environment
   * @return the config
   * @throws ConfigurationException if a required key is missing or a value is malformed
   */
  public static IbAuthConfig fromEnvironment(Map<String, String> env) {
    String tokenFile = optional(env, TOKEN_FILE);
    String gateway = env.containsKey(GATEWAY_BASE_URL)
        ? env.get(GATEWAY_BASE_URL).trim()
        : DEFAULT_GATEWAY_BASE_URL;
    String accessToken = optional(env, ACCESS_TOKEN);
    String accessTokenSecret = optional(env, ACCESS_TOKEN_SECRET);
    if ((accessToken == null) != (accessTokenSecret == null)) {
      throw new ConfigurationException(ACCESS_TOKEN + " and " + ACCESS_TOKEN_SECRET + " must be set together");
    }
    return new IbAuthConfig(
        required(env, CONSUMER_KEY),
        orDefault(env, REALM, DEFAULT_REALM),
        Path.of(required(env, SIGNATURE_KEY_PATH)),
        Path.of(required(env, ENCRYPTION_KEY_PATH)),
        Path.of(required(env, DH_PARAM_PATH)),
        tokenFile == null
            ? Path.of(System.getProperty("user.home"), DEFAULT_TOKEN_FILE_NAME)
            : Path.of(tokenFile),
        accessToken,
        accessTokenSecret,
        uri(API_BASE_URL, orDefault(env, API_BASE_URL, DEFAULT_API_BASE_URL)),
        gateway.isEmpty() ? null : uri(GATEWAY_BASE_URL, gateway),
        timeout(optional(env, HTTP_TIMEOUT_SECONDS)));
  }

  /**
   * Whether an access token and secret were supplied up front.
   *
   * @return true if the token bootstrap can be skipped
   */
  public boolean hasPreAuthorizedAccessToken() {
    return accessToken != null && accessTokenSecret != null;
  }

  private static String optional(Map<String, String> env, String key) {
    String value = env.get(key);
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String orDefault(Map<String, String> env, String key, String defaultValue) {
    String value = optional(env, key);
    return value == null ? defaultValue : value;
  }

  private static String required(Map<String, String> env, String key) {
    String value = optional(env, key);
    if (value == null) {
      throw new ConfigurationException("Missing required configuration " + key);
    }
    return value;
  }

  private static URI uri(String key, String value) {
    try {
      URI uri = URI.create(value.endsWith("/") ? value.substring(0, value.length() - 1) : value);
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new ConfigurationException(key + " must be an absolute URL: " + value);
      }
      return uri;
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(key + " is not a valid URL: " + value, e);
    }
  }

  private static Duration timeout(String seconds) {
    if (seconds == null) {
      return DEFAULT_HTTP_TIMEOUT;
    }
    try {
      long value = Long.parseLong(seconds);
      if (value <= 0) {
        throw new ConfigurationException(HTTP_TIMEOUT_SECONDS + " must be positive: " + seconds);
      }
      return Duration.ofSeconds(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException(HTTP_TIMEOUT_SECONDS + " is not a number: " + seconds, e);
    }
  }

  @Override
  public String toString() {
    return "IbAuthConfig[consumerKey=" + consumerKey
        + ", realm=" + realm
        + ", tokenFile=" + tokenFile
        + ", preAuthorized=" + hasPreAuthorizedAccessToken()
        + ", apiBaseUrl=" + apiBaseUrl
        + ", gatewayBaseUrl=" + gatewayBaseUrl
        + ", httpTimeout=" + httpTimeout + "]";
  }
}
