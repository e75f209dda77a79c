package com.codeheadsystems.ibauth.client.exceptions;

import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;

/**
 * An HTTP exchange with the broker failed: I/O error, timeout, interruption, an unexpected
 * status, or an unreadable body.
 */
public class BrokerAccessorException extends IbAuthException {

  private final int statusCode;

  /**
   * Instantiates a new Broker accessor exception without a response.
   *
   * @param message the message
   * @param cause   the cause
   */
  public BrokerAccessorException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = TokenExchangeException.NO_RESPONSE;
  }

  /**
   * Instantiates a new Broker accessor exception for an unexpected status.
   *
   * @param message    the message
   * @param statusCode the status
   */
  public BrokerAccessorException(final String message, final int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
