package com.codeheadsystems.ibauth.client.model;

/**
 * Short-lived request token obtained in the first bootstrap step.
 *
 * @param value the token
 */
public record RequestToken(String value) {
}
