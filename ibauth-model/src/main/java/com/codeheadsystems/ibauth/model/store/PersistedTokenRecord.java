package com.codeheadsystems.ibauth.model.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token set persisted between runs.
 * <p>
 * The access token secret is stored exactly as issued (RSA ciphertext, base64); the decrypted
 * form never reaches disk. A record without an access token or a live session token is not
 * usable and forces re-authentication, as is one without the access token secret, since a
 * rejected LST can only be re-derived with it.
 *
 * @param accessToken                the access token
 * @param accessTokenSecret          encrypted access token secret, base64
 * @param liveSessionToken           the LST, base64
 * @param consumerKey                the consumer key the tokens belong to
 * @param realm                      the realm
 * @param timestamp                  ISO-8601 instant of the last update
 * @param liveSessionTokenExpiration LST expiry in epoch milliseconds, may be null
 * @param liveSessionTokenVerified   whether the broker's LST signature matched; null when unknown
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PersistedTokenRecord(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("access_token_secret") String accessTokenSecret,
    @JsonProperty("live_session_token") String liveSessionToken,
    @JsonProperty("consumer_key") String consumerKey,
    @JsonProperty("realm") String realm,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("live_session_token_expiration") Long liveSessionTokenExpiration,
    @JsonProperty("live_session_token_verified") Boolean liveSessionTokenVerified) {

  /**
   * Whether the access token, its secret and the live session token are all present.
   *
   * @return true if usable
   */
  @JsonIgnore
  public boolean isComplete() {
    return accessToken != null && !accessToken.isBlank()
        && accessTokenSecret != null && !accessTokenSecret.isBlank()
        && liveSessionToken != null && !liveSessionToken.isBlank();
  }

  @Override
  public String toString() {
    return "PersistedTokenRecord[accessToken=" + accessToken
        + ", consumerKey=" + consumerKey
        + ", realm=" + realm
        + ", timestamp=" + timestamp + "]";
  }
}
