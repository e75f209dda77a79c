package com.codeheadsystems.ibauth.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to {@code POST /oauth/access_token}.
 * <p>
 * The secret arrives RSA-encrypted to the consumer's encryption key and base64-encoded; it is
 * kept in that form.
 *
 * @param oauthToken       the access token
 * @param oauthTokenSecret base64 ciphertext of the access token secret
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessTokenResponse(
    @JsonProperty("oauth_token") String oauthToken,
    @JsonProperty("oauth_token_secret") String oauthTokenSecret) {

  @Override
  public String toString() {
    return "AccessTokenResponse[oauthToken=" + oauthToken + ", oauthTokenSecret=***]";
  }
}
