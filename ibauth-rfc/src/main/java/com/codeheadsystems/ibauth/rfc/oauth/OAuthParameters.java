package com.codeheadsystems.ibauth.rfc.oauth;

/**
 * Parameter names and fixed values used on the wire.
 */
public final class OAuthParameters {

  public static final String REALM = "realm";
  public static final String CONSUMER_KEY = "oauth_consumer_key";
  public static final String NONCE = "oauth_nonce";
  public static final String SIGNATURE = "oauth_signature";
  public static final String SIGNATURE_METHOD = "oauth_signature_method";
  public static final String TIMESTAMP = "oauth_timestamp";
  public static final String TOKEN = "oauth_token";
  public static final String CALLBACK = "oauth_callback";
  public static final String VERIFIER = "oauth_verifier";
  public static final String VERSION = "oauth_version";
  public static final String DH_CHALLENGE = "diffie_hellman_challenge";

  public static final String CALLBACK_OUT_OF_BAND = "oob";
  public static final String VERSION_1_0 = "1.0";

  private OAuthParameters() {
  }
}
