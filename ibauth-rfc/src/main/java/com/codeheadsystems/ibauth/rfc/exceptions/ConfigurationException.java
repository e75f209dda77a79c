package com.codeheadsystems.ibauth.rfc.exceptions;

/**
 * Missing or unreadable configuration: key files, DH parameters or required settings.
 * Not retryable without operator intervention.
 */
public class ConfigurationException extends IbAuthException {

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   */
  public ConfigurationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
