package com.codeheadsystems.ibauth.client.exceptions;

import com.codeheadsystems.ibauth.client.model.AuthStep;
import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;

/**
 * A token exchange step was rejected by the broker or could not reach it.
 */
public class TokenExchangeException extends IbAuthException {

  /**
   * Status used when no HTTP response was received.
   */
  public static final int NO_RESPONSE = -1;

  private final AuthStep step;
  private final int statusCode;
  private final String body;

  /**
   * Instantiates a new Token exchange exception for an HTTP failure.
   *
   * @param step       the failed step
   * @param statusCode the HTTP status
   * @param body       the response body
   */
  public TokenExchangeException(final AuthStep step, final int statusCode, final String body) {
    super(step + " failed with HTTP " + statusCode + ": " + body);
    this.step = step;
    this.statusCode = statusCode;
    this.body = body;
  }

  /**
   * Instantiates a new Token exchange exception for a failure without a usable response.
   *
   * @param step    the failed step
   * @param message the message
   * @param cause   the cause
   */
  public TokenExchangeException(final AuthStep step, final String message, final Throwable cause) {
    super(step + " failed: " + message, cause);
    this.step = step;
    this.statusCode = NO_RESPONSE;
    this.body = null;
  }

  public AuthStep step() {
    return step;
  }

  public int statusCode() {
    return statusCode;
  }

  public String body() {
    return body;
  }

  public boolean isUnauthorized() {
    return statusCode == 401;
  }
}
