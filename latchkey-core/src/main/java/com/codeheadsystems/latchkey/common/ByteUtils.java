package com.codeheadsystems.latchkey.common;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Utility methods for octet string encoding and key material hygiene.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017, big-endian.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(int value, int length) {
    if (value < 0 || (length < 4 && value >= (1 << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Encodes a non-negative long as 8 little-endian bytes.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] littleEndian64(long value) {
    if (value < 0) {
      throw new IllegalArgumentException("Value must be non-negative: " + value);
    }
    byte[] result = new byte[8];
    for (int i = 0; i < 8; i++) {
      result[i] = (byte) (value & 0xFF);
      value >>>= 8;
    }
    return result;
  }

  /**
   * Encodes a non-negative integer as an unsigned big-endian octet string of exactly
   * {@code length} bytes, left-padded with zeros.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] toFixedLength(BigInteger value, int length) {
    if (value.signum() < 0) {
      throw new IllegalArgumentException("Value must be non-negative");
    }
    byte[] raw = value.toByteArray();
    int start = (raw.length > 1 && raw[0] == 0) ? 1 : 0;
    int significant = raw.length - start;
    if (significant > length) {
      throw new IllegalArgumentException("Value too large for " + length + " bytes");
    }
    byte[] result = new byte[length];
    System.arraycopy(raw, start, result, length - significant, significant);
    return result;
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

  /**
   * Overwrites every given array with zeros. Null entries are skipped.
   *
   * @param arrays the arrays to wipe
   */
  public static void zeroize(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        Arrays.fill(arr, (byte) 0);
      }
    }
  }

  /**
   * Null-safe copy.
   *
   * @param source the source
   * @return a copy, or null when source is null
   */
  public static byte[] copy(byte[] source) {
    return source == null ? null : source.clone();
  }
}
