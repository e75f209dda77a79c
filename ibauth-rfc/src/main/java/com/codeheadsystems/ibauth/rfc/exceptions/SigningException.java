package com.codeheadsystems.ibauth.rfc.exceptions;

/**
 * A local cryptographic failure: RSA signing or decryption, HMAC computation, or malformed
 * key material such as a live session token that is not valid base64.
 */
public class SigningException extends IbAuthException {

  /**
   * Instantiates a new Signing exception.
   *
   * @param message the message
   */
  public SigningException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Signing exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SigningException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
