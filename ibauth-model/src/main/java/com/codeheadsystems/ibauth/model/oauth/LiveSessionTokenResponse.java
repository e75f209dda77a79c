package com.codeheadsystems.ibauth.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to {@code POST /oauth/live_session_token}.
 *
 * @param diffieHellmanResponse     the server's public value B, hex
 * @param liveSessionTokenSignature hex HMAC-SHA1 of the consumer key keyed with the LST
 * @param liveSessionTokenExpiration expiry in epoch milliseconds, if supplied
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LiveSessionTokenResponse(
    @JsonProperty("diffie_hellman_response") String diffieHellmanResponse,
    @JsonProperty("live_session_token_signature") String liveSessionTokenSignature,
    @JsonProperty("live_session_token_expiration") Long liveSessionTokenExpiration) {
}
