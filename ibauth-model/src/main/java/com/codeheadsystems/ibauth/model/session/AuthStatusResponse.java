package com.codeheadsystems.ibauth.model.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Brokerage session state as returned by {@code POST /iserver/auth/ssodh/init} and
 * {@code GET /iserver/auth/status}.
 *
 * @param authenticated whether the brokerage session is authenticated
 * @param competing     whether another session competes for the same user
 * @param connected     whether the backend is connected
 * @param message       free-form server message, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthStatusResponse(
    @JsonProperty("authenticated") boolean authenticated,
    @JsonProperty("competing") boolean competing,
    @JsonProperty("connected") boolean connected,
    @JsonProperty("message") String message) {
}
