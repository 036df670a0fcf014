package com.codeheadsystems.sealedbid.commitment;

import com.codeheadsystems.sealedbid.common.ByteUtils;
import java.util.Arrays;
import java.util.Objects;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * A 256-bit commitment digest binding a bidder to a hidden (value, fake, secret) triple.
 * <p>
 * Compared by content. The all-zero digest is reserved as the {@link #CONSUMED} sentinel that
 * marks a bid whose reveal has already been processed.
 *
 * @param bytes the 32 digest bytes
 */
public record Commitment(byte[] bytes) {

  /**
   * Digest length in bytes.
   */
  public static final int LENGTH = 32;

  /**
   * Sentinel stored in place of a commitment once its reveal has been processed.
   */
  public static final Commitment CONSUMED = new Commitment(new byte[LENGTH]);

  public Commitment {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("Commitment must be " + LENGTH + " bytes, got " + bytes.length);
    }
    bytes = bytes.clone();
  }

  /**
   * Parses a hex-encoded commitment; an optional {@code 0x} prefix is accepted.
   *
   * @param hex the hex string
   * @return the commitment
   */
  public static Commitment fromHex(String hex) {
    Objects.requireNonNull(hex, "hex");
    String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    try {
      return new Commitment(Hex.decode(digits));
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Commitment is not valid hex: " + hex, e);
    }
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Whether this is the consumed sentinel.
   *
   * @return true if all bytes are zero
   */
  public boolean isConsumed() {
    return ByteUtils.isAllZero(bytes);
  }

  /**
   * Lower-case hex encoding without prefix.
   *
   * @return the hex string
   */
  public String toHex() {
    return Hex.toHexString(bytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Commitment other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Commitment[" + toHex() + "]";
  }
}
