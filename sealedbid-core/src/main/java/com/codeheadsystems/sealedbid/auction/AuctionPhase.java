package com.codeheadsystems.sealedbid.auction;

import java.time.Instant;

/**
 * Global phase of an auction. Always derived from the current time and the ended flag, never
 * stored, so it cannot drift from the deadlines.
 */
public enum AuctionPhase {
  /**
   * Before the bidding deadline: commitments are accepted.
   */
  BIDDING,
  /**
   * From the bidding deadline (inclusive) to the reveal deadline (exclusive).
   */
  REVEAL,
  /**
   * At or after the reveal deadline, not yet settled.
   */
  SETTLEABLE,
  /**
   * Settled. Terminal.
   */
  ENDED;

  /**
   * Derives the phase.
   *
   * @param now             the current time
   * @param biddingDeadline the bidding deadline
   * @param revealDeadline  the reveal deadline
   * @param ended           whether settlement has completed
   * @return the phase
   */
  public static AuctionPhase of(Instant now, Instant biddingDeadline, Instant revealDeadline, boolean ended) {
    if (ended) {
      return ENDED;
    }
    if (now.isBefore(biddingDeadline)) {
      return BIDDING;
    }
    if (now.isBefore(revealDeadline)) {
      return REVEAL;
    }
    return SETTLEABLE;
  }
}
