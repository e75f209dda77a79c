package com.codeheadsystems.ibauth.rfc.oauth;

/**
 * The two signature methods the broker accepts.
 */
public enum SignatureMethod {

  /**
   * Request token, access token and live session token requests.
   */
  RSA_SHA256("RSA-SHA256"),

  /**
   * Every call after the live session token exists, keyed by that token.
   */
  HMAC_SHA256("HMAC-SHA256");

  private final String wireName;

  SignatureMethod(final String wireName) {
    this.wireName = wireName;
  }

  /**
   * The value of {@code oauth_signature_method}.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }
}
