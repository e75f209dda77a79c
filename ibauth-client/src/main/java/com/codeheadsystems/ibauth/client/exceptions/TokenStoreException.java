package com.codeheadsystems.ibauth.client.exceptions;

import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;

/**
 * The token file could not be read or written.
 */
public class TokenStoreException extends IbAuthException {

  public TokenStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
