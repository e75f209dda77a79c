package com.codeheadsystems.ibauth.model.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response to {@code GET /tickle}.
 *
 * @param session    the session id
 * @param ssoExpires milliseconds until the SSO session expires
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TickleResponse(
    @JsonProperty("session") String session,
    @JsonProperty("ssoExpires") Long ssoExpires) {
}
