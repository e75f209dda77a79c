package com.codeheadsystems.ibauth.rfc.common;

import java.math.BigInteger;
import org.bouncycastle.util.BigIntegers;

/**
 * Utility methods for big-integer and octet string encoding.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Minimal big-endian encoding of a non-negative integer, with a single {@code 0x00} byte
   * prepended when the most significant bit of the first byte is set.
   * <p>
   * This is the two's-complement form a Java {@code BigInteger} on the server side produces
   * for a positive value. Dropping the pad byte yields a different HMAC key and a live session
   * token the server rejects on first use.
   *
   * @param value the value, must not be negative
   * @return the byte [ ]
   */
  public static byte[] toSignedBigEndian(BigInteger value) {
    if (value.signum() < 0) {
      throw new IllegalArgumentException("Value must not be negative");
    }
    byte[] unsigned = BigIntegers.asUnsignedByteArray(value);
    if (unsigned.length > 0 && (unsigned[0] & 0x80) != 0) {
      return concat(new byte[]{0x00}, unsigned);
    }
    return unsigned;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }
}
