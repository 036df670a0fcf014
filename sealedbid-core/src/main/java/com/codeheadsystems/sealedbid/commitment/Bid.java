package com.codeheadsystems.sealedbid.commitment;

import com.codeheadsystems.sealedbid.common.Amounts;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A committed bid: the blinded digest plus the deposit taken into escrow with it.
 *
 * @param commitment the commitment, or {@link Commitment#CONSUMED} once revealed
 * @param deposit    the deposit held for this bid
 */
public record Bid(Commitment commitment, BigInteger deposit) {

  public Bid {
    Objects.requireNonNull(commitment, "commitment");
    Amounts.requireUnsigned(deposit, "deposit");
  }

  /**
   * Whether this bid has already been through reveal processing.
   *
   * @return the boolean
   */
  public boolean isConsumed() {
    return commitment.isConsumed();
  }

  /**
   * Returns a copy with the commitment cleared to the consumed sentinel.
   *
   * @return the consumed bid
   */
  public Bid consume() {
    return new Bid(Commitment.CONSUMED, deposit);
  }
}
