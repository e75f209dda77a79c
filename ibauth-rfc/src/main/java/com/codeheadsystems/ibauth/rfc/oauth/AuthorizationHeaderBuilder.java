package com.codeheadsystems.ibauth.rfc.oauth;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Assembles the {@code Authorization: OAuth realm="...", k="v", ...} header value.
 * <p>
 * The broker expects the signature in two different forms depending on the step, so there are
 * two separately named entry points and no attempt to infer which one applies:
 * <ul>
 *   <li>{@link #withRawSignature} for the RSA-SHA256 bootstrap requests: the base64 signature
 *       goes into the header exactly as produced;</li>
 *   <li>{@link #withPercentEncodedSignature} for HMAC-SHA256 calls: the base64 signature is
 *       percent-encoded.</li>
 * </ul>
 * All other parameter values are percent-encoded in both forms. Parameters are emitted in key
 * order after the realm.
 */
public class AuthorizationHeaderBuilder {

  private AuthorizationHeaderBuilder() {
  }

  /**
   * Header for RSA-signed bootstrap requests.
   *
   * @param realm        the realm
   * @param oauthParams  header parameters without signature or realm
   * @param rsaSignature base64 RSA signature
   * @return the header value
   */
  public static String withRawSignature(String realm, Map<String, String> oauthParams, String rsaSignature) {
    return header(realm, oauthParams, rsaSignature);
  }

  /**
   * Header for HMAC-signed calls.
   *
   * @param realm         the realm
   * @param oauthParams   header parameters without signature or realm
   * @param hmacSignature base64 HMAC signature
   * @return the header value
   */
  public static String withPercentEncodedSignature(String realm, Map<String, String> oauthParams,
                                                   String hmacSignature) {
    return header(realm, oauthParams, PercentEncoder.encode(hmacSignature));
  }

  private static String header(String realm, Map<String, String> oauthParams, String signatureValue) {
    TreeMap<String, String> sorted = new TreeMap<>();
    oauthParams.forEach((key, value) -> sorted.put(key, PercentEncoder.encode(value)));
    sorted.remove(OAuthParameters.REALM);
    sorted.put(OAuthParameters.SIGNATURE, signatureValue);
    StringJoiner joiner = new StringJoiner(", ");
    sorted.forEach((key, value) -> joiner.add(key + "=\"" + value + '"'));
    return "OAuth realm=\"" + realm + "\", " + joiner;
  }
}
