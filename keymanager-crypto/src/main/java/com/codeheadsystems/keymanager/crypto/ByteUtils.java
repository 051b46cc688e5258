package com.codeheadsystems.keymanager.crypto;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Utility methods for byte array handling of key material.
 */
public class ByteUtils {

  private ByteUtils() {
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
   * Encodes a non-negative integer as a big-endian array of exactly {@code length} bytes.
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
    if (raw.length == length) {
      return raw;
    }
    byte[] fixed = new byte[length];
    if (raw.length > length) {
      // toByteArray() adds a leading sign byte when the high bit is set.
      int excess = raw.length - length;
      for (int i = 0; i < excess; i++) {
        if (raw[i] != 0) {
          throw new IllegalArgumentException("Value too large for " + length + " bytes");
        }
      }
      System.arraycopy(raw, excess, fixed, 0, length);
    } else {
      System.arraycopy(raw, 0, fixed, length - raw.length, raw.length);
    }
    return fixed;
  }

  /**
   * Overwrites the array with zeros. Null is ignored.
   *
   * @param bytes the bytes
   */
  public static void zeroize(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }
}
