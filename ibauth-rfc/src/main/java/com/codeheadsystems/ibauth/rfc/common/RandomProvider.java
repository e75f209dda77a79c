package com.codeheadsystems.ibauth.rfc.common;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random generation.
 * Used for OAuth nonces and for the Diffie-Hellman private exponent.
 * <p>
 * {@link SecureRandom} is thread-safe, so a single instance may be shared by every request
 * signer in the process.
 *
 * @param random the random source
 */
public record RandomProvider(SecureRandom random) {

  private static final char[] NONCE_ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

  /**
   * Default nonce length in characters.
   */
  public static final int NONCE_LENGTH = 32;

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Uniformly random non-negative integer of at most {@code bits} bits.
   *
   * @param bits the bit length
   * @return the big integer
   */
  public BigInteger randomBits(int bits) {
    return new BigInteger(bits, random);
  }

  /**
   * A 32 character alphanumeric OAuth nonce.
   *
   * @return the nonce
   */
  public String nonce() {
    return nonce(NONCE_LENGTH);
  }

  /**
   * An alphanumeric OAuth nonce of the given length.
   *
   * @param length the length
   * @return the nonce
   */
  public String nonce(int length) {
    char[] out = new char[length];
    for (int i = 0; i < length; i++) {
      out[i] = NONCE_ALPHABET[random.nextInt(NONCE_ALPHABET.length)];
    }
    return new String(out);
  }
}
