package com.codeheadsystems.ibauth.client.model;

import java.time.Instant;

/**
 * The live session token: the base64 HMAC key for every authenticated call.
 *
 * @param value     base64 LST
 * @param expiresAt expiry if the broker supplied one, may be null
 * @param verified  whether the broker's LST signature matched the local derivation
 */
public record LiveSessionToken(String value, Instant expiresAt, boolean verified) {

  /**
   * A short prefix suitable for logs.
   *
   * @return the fingerprint
   */
  public String fingerprint() {
    return value == null || value.length() < 6 ? "***" : value.substring(0, 6) + "...";
  }

  /**
   * Whether the broker-supplied expiry has passed.
   *
   * @param now the current instant
   * @return true if expired
   */
  public boolean isExpired(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "LiveSessionToken[" + fingerprint() + ", expiresAt=" + expiresAt + ", verified=" + verified + "]";
  }
}
