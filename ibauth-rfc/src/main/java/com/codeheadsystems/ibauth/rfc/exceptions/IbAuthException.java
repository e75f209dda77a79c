package com.codeheadsystems.ibauth.rfc.exceptions;

/**
 * Root of the ibauth exception hierarchy.
 */
public class IbAuthException extends RuntimeException {

  /**
   * Instantiates a new Ib auth exception.
   *
   * @param message the message
   */
  public IbAuthException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Ib auth exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public IbAuthException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
