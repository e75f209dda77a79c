package com.codeheadsystems.ibauth.rfc.oauth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * OAuth 1.0a percent encoding (RFC 5849 §3.6).
 * <p>
 * Only the unreserved set {@code ALPHA / DIGIT / "-" / "." / "_" / "~"} passes through; every
 * other byte of the UTF-8 encoding, including {@code /}, {@code :}, {@code ,} and space, becomes
 * {@code %XX} with upper-case hex digits. {@link URLEncoder} does form encoding, so its space,
 * asterisk and tilde output is rewritten to match.
 */
public class PercentEncoder {

  private PercentEncoder() {
  }

  /**
   * Percent-encodes the value.
   *
   * @param value the value
   * @return the encoded string
   */
  public static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("*", "%2A")
        .replace("%7E", "~");
  }
}
