package com.codeheadsystems.ibauth.rfc.oauth;

import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Builds the OAuth 1.0a signature base string exactly as the broker canonicalizes it.
 * <p>
 * Steps, in order:
 * <ol>
 *   <li>sort the parameters by key;</li>
 *   <li>percent-encode each value and join as {@code key=value} pairs with {@code &};</li>
 *   <li>form {@code METHOD&enc(url)&enc(paramString)};</li>
 *   <li>prefix the optional prepend verbatim;</li>
 *   <li>collapse the doubly-encoded {@code %257C}, {@code %252C} and {@code %253A} back to
 *       {@code %7C}, {@code %2C} and {@code %3A}.</li>
 * </ol>
 * The last step departs from RFC 5849 but is what the server signs over when a value carries a
 * pipe, comma or colon (for example a comma-separated conid list).
 * <p>
 * The {@code realm} parameter never takes part in the base string and is dropped if present.
 */
public class CanonicalRequestBuilder {

  private static final String[][] CORRECTIONS = {
      {"%257C", "%7C"},
      {"%252C", "%2C"},
      {"%253A", "%3A"}
  };

  private CanonicalRequestBuilder() {
  }

  /**
   * Base string without a prepend.
   *
   * @param method the HTTP method
   * @param url    the URL without query string
   * @param params OAuth and request parameters
   * @return the base string
   */
  public static String build(String method, String url, Map<String, String> params) {
    return build(method, url, params, null);
  }

  /**
   * Base string with an optional prepend.
   *
   * @param method  the HTTP method
   * @param url     the URL without query string
   * @param params  OAuth and request parameters
   * @param prepend hex of the decrypted access token secret, or null
   * @return the base string
   */
  public static String build(String method, String url, Map<String, String> params, String prepend) {
    String baseString = method.toUpperCase(Locale.ROOT)
        + '&' + PercentEncoder.encode(url)
        + '&' + PercentEncoder.encode(parameterString(params));
    if (prepend != null && !prepend.isEmpty()) {
      baseString = prepend + baseString;
    }
    return correct(baseString);
  }

  /**
   * Sorted, value-encoded {@code key=value&...} string.
   *
   * @param params the params
   * @return the parameter string
   */
  public static String parameterString(Map<String, String> params) {
    TreeMap<String, String> sorted = new TreeMap<>(params);
    sorted.remove(OAuthParameters.REALM);
    StringJoiner joiner = new StringJoiner("&");
    sorted.forEach((key, value) -> joiner.add(key + '=' + PercentEncoder.encode(value)));
    return joiner.toString();
  }

  static String correct(String baseString) {
    String out = baseString;
    for (String[] correction : CORRECTIONS) {
      out = out.replace(correction[0], correction[1]);
    }
    return out;
  }
}
