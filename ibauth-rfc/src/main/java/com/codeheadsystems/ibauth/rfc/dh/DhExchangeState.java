package com.codeheadsystems.ibauth.rfc.dh;

import java.math.BigInteger;

/**
 * Client side of one live session token derivation. Lives only as long as the request that
 * carries the challenge; the private exponent is never persisted or logged.
 *
 * @param privateExponent the random exponent a
 * @param challenge       A = g^a mod p
 */
public record DhExchangeState(BigInteger privateExponent, BigInteger challenge) {

  /**
   * The challenge as lower-case hex without a {@code 0x} prefix, as sent in
   * {@code diffie_hellman_challenge}.
   *
   * @return the hex string
   */
  public String challengeHex() {
    return challenge.toString(16);
  }

  @Override
  public String toString() {
    return "DhExchangeState[challenge=" + challengeHex() + "]";
  }
}
