package com.codeheadsystems.sealedbid.common;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Utility methods for the fixed-width octet encodings used by commitments.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017, widened to arbitrary precision.
   * Converts a non-negative integer to a big-endian octet string of exactly {@code length} bytes.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(BigInteger value, int length) {
    if (value.signum() < 0 || value.bitLength() > 8 * length) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] raw = value.toByteArray();
    byte[] result = new byte[length];
    // toByteArray() may carry a leading sign byte; only the low-order bytes are copied.
    int copy = Math.min(raw.length, length);
    System.arraycopy(raw, raw.length - copy, result, length - copy, copy);
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
   * Right-pads the input with zero bytes to exactly {@code length} bytes, the layout of a
   * Solidity {@code bytes32} built from a shorter string.
   *
   * @param input  the input
   * @param length the target length
   * @return a new, padded array
   */
  public static byte[] rightPad(byte[] input, int length) {
    if (input.length > length) {
      throw new IllegalArgumentException("Input longer than " + length + " bytes: " + input.length);
    }
    return Arrays.copyOf(input, length);
  }

  /**
   * Returns true when every byte is zero. An empty array counts as all-zero.
   *
   * @param bytes the bytes
   * @return whether all bytes are zero
   */
  public static boolean isAllZero(byte[] bytes) {
    for (byte b : bytes) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }
}
