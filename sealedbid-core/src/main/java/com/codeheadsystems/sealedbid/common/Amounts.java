package com.codeheadsystems.sealedbid.common;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Validation for monetary amounts and bid values, which are unsigned 256-bit integers.
 */
public class Amounts {

  /**
   * Largest representable amount, 2^256 - 1.
   */
  public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

  private Amounts() {
  }

  /**
   * Returns the amount if it lies in {@code [0, 2^256)}.
   *
   * @param amount the amount
   * @param name   name used in the error message
   * @return the amount
   * @throws IllegalArgumentException if the amount is negative or wider than 256 bits
   */
  public static BigInteger requireUnsigned(BigInteger amount, String name) {
    Objects.requireNonNull(amount, name);
    if (amount.signum() < 0 || amount.compareTo(MAX_UINT256) > 0) {
      throw new IllegalArgumentException(name + " must be an unsigned 256-bit integer: " + amount);
    }
    return amount;
  }
}
