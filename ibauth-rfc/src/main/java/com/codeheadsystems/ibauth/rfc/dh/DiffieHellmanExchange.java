package com.codeheadsystems.ibauth.rfc.dh;

import com.codeheadsystems.ibauth.rfc.common.ByteUtils;
import com.codeheadsystems.ibauth.rfc.common.RandomProvider;
import com.codeheadsystems.ibauth.rfc.exceptions.SigningException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.util.encoders.Hex;

/**
 * Finite-field Diffie-Hellman key agreement and live session token derivation.
 * <p>
 * <ol>
 *   <li>{@link #begin()} draws a 256-bit exponent {@code a} and computes {@code A = g^a mod p}.</li>
 *   <li>{@link #sharedSecret} computes {@code K = B^a mod p} from the server's hex response.</li>
 *   <li>{@link #deriveLiveSessionToken} computes
 *       {@code LST = HMAC-SHA1(K_bytes, base64decode(access_token_secret))} where
 *       {@code K_bytes} is the sign-padded big-endian encoding of {@code K}.</li>
 * </ol>
 */
public class DiffieHellmanExchange {

  /**
   * Bit length of the private exponent.
   */
  public static final int EXPONENT_BITS = 256;

  private static final String HMAC_SHA1 = "HmacSHA1";

  private final DhParameters parameters;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Diffie hellman exchange.
   *
   * @param parameters     the dh parameters
   * @param randomProvider the random provider
   */
  public DiffieHellmanExchange(final DhParameters parameters, final RandomProvider randomProvider) {
    this.parameters = parameters;
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a fresh exponent and the matching challenge.
   *
   * @return the dh exchange state
   */
  public DhExchangeState begin() {
    BigInteger a = randomProvider.randomBits(EXPONENT_BITS);
    while (a.signum() == 0) {
      a = randomProvider.randomBits(EXPONENT_BITS);
    }
    return begin(a);
  }

  /**
   * Challenge for a caller-supplied exponent.
   *
   * @param privateExponent the exponent
   * @return the dh exchange state
   */
  public DhExchangeState begin(BigInteger privateExponent) {
    return new DhExchangeState(privateExponent, publicValue(privateExponent));
  }

  /**
   * {@code g^x mod p}.
   *
   * @param exponent the exponent
   * @return the public value
   */
  public BigInteger publicValue(BigInteger exponent) {
    return parameters.generator().modPow(exponent, parameters.prime());
  }

  /**
   * {@code K = B^a mod p} for the server's hex response {@code B}.
   *
   * @param state       the client state
   * @param responseHex the server's diffie_hellman_response
   * @return K
   */
  public BigInteger sharedSecret(DhExchangeState state, String responseHex) {
    if (responseHex == null || responseHex.isBlank()) {
      throw new IllegalArgumentException("Missing Diffie-Hellman response");
    }
    BigInteger b = new BigInteger(responseHex.trim(), 16);
    if (b.compareTo(BigInteger.ONE) <= 0 || b.compareTo(parameters.prime().subtract(BigInteger.ONE)) >= 0) {
      throw new IllegalArgumentException("Diffie-Hellman response out of range");
    }
    return b.modPow(state.privateExponent(), parameters.prime());
  }

  /**
   * Sign-padded big-endian bytes of K.
   *
   * @param sharedSecret K
   * @return the byte [ ]
   * @see ByteUtils#toSignedBigEndian(BigInteger)
   */
  public static byte[] sharedSecretBytes(BigInteger sharedSecret) {
    return ByteUtils.toSignedBigEndian(sharedSecret);
  }

  /**
   * Derives the base64 live session token.
   *
   * @param sharedSecret            K
   * @param accessTokenSecretBase64 the encrypted access token secret as issued (base64)
   * @return the LST in base64
   */
  public static String deriveLiveSessionToken(BigInteger sharedSecret, String accessTokenSecretBase64) {
    if (sharedSecret == null || accessTokenSecretBase64 == null) {
      throw new SigningException("Shared secret and access token secret are required");
    }
    byte[] secret;
    try {
      secret = Base64.getDecoder().decode(accessTokenSecretBase64);
    } catch (IllegalArgumentException e) {
      throw new SigningException("Access token secret is not valid base64", e);
    }
    return Base64.getEncoder().encodeToString(hmacSha1(sharedSecretBytes(sharedSecret), secret));
  }

  /**
   * Checks the server's {@code live_session_token_signature}, which is the hex
   * {@code HMAC-SHA1(LST, consumer_key)}.
   *
   * @param liveSessionTokenBase64 the derived LST
   * @param consumerKey            the consumer key
   * @param signatureHex           the server's signature
   * @return true if they match
   */
  public static boolean verifyLiveSessionToken(String liveSessionTokenBase64, String consumerKey,
                                               String signatureHex) {
    if (signatureHex == null || signatureHex.isBlank()) {
      return false;
    }
    byte[] expected = hmacSha1(Base64.getDecoder().decode(liveSessionTokenBase64),
        consumerKey.getBytes(StandardCharsets.UTF_8));
    byte[] actual;
    try {
      actual = Hex.decode(signatureHex.trim());
    } catch (RuntimeException e) {
      return false;
    }
    return MessageDigest.isEqual(expected, actual);
  }

  private static byte[] hmacSha1(byte[] key, byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_SHA1);
      mac.init(new SecretKeySpec(key, HMAC_SHA1));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new SigningException("HMAC-SHA1 not available", e);
    }
  }
}
