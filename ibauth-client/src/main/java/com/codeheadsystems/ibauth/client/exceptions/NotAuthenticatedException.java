package com.codeheadsystems.ibauth.client.exceptions;

import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;

/**
 * A signed call was requested before any live session token exists.
 */
public class NotAuthenticatedException extends IbAuthException {

  public NotAuthenticatedException(final String message) {
    super(message);
  }
}
