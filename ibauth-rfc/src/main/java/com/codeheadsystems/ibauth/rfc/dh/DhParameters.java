package com.codeheadsystems.ibauth.rfc.dh;

import java.math.BigInteger;

/**
 * Diffie-Hellman domain parameters issued with the consumer key.
 *
 * @param prime     the prime modulus p
 * @param generator the generator g, typically 2
 */
public record DhParameters(BigInteger prime, BigInteger generator) {

  /**
   * Default generator when the parameter file omits it.
   */
  public static final BigInteger DEFAULT_GENERATOR = BigInteger.TWO;

  /**
   * Validates the parameters.
   */
  public DhParameters {
    if (prime == null || prime.compareTo(BigInteger.TWO) <= 0) {
      throw new IllegalArgumentException("DH prime must be greater than 2");
    }
    if (generator == null) {
      generator = DEFAULT_GENERATOR;
    }
    if (generator.signum() <= 0 || generator.compareTo(prime) >= 0) {
      throw new IllegalArgumentException("DH generator must be in (0, p)");
    }
  }

  /**
   * Parameters from a hex prime and the default generator.
   *
   * @param primeHex the prime in hex
   * @return the dh parameters
   */
  public static DhParameters fromHex(String primeHex) {
    return new DhParameters(new BigInteger(primeHex, 16), DEFAULT_GENERATOR);
  }
}
