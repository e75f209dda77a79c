package com.codeheadsystems.ibauth.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to {@code POST /oauth/request_token}.
 * <p>
 * The request token is short-lived and only used to obtain the access token.
 *
 * @param oauthToken the request token
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestTokenResponse(
    @JsonProperty("oauth_token") String oauthToken) {
}
