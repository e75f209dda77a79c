package com.codeheadsystems.ibauth.client.exceptions;

import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;

/**
 * An authenticated call was still rejected after the live session token was re-derived once.
 */
public class SessionExpiredException extends IbAuthException {

  public SessionExpiredException(final String message) {
    super(message);
  }

  public SessionExpiredException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
