package com.codeheadsystems.ibauth.model.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of {@code GET /portfolio/accounts}.
 *
 * @param accountId    the account id
 * @param accountTitle the account title
 * @param type         the account type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Account(
    @JsonProperty("accountId") String accountId,
    @JsonProperty("accountTitle") String accountTitle,
    @JsonProperty("type") String type) {
}
