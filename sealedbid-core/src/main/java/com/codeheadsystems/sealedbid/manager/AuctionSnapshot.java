package com.codeheadsystems.sealedbid.manager;

import com.codeheadsystems.sealedbid.auction.AuctionPhase;
import com.codeheadsystems.sealedbid.commitment.Bid;
import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, consistent view of an auction's complete state at one instant.
 *
 * @param beneficiary     the beneficiary
 * @param biddingDeadline the bidding deadline
 * @param revealDeadline  the reveal deadline
 * @param phase           the phase when the snapshot was taken
 * @param ended           whether the auction has been settled
 * @param highestBidder   the highest bidder, or null
 * @param highestBid      the highest bid
 * @param pendingReturns  outstanding withdrawal ledger entries
 * @param bids            every principal's bids in order
 * @param totalDeposits   sum of all deposits received
 */
public record AuctionSnapshot(
    Principal beneficiary,
    Instant biddingDeadline,
    Instant revealDeadline,
    AuctionPhase phase,
    boolean ended,
    Principal highestBidder,
    BigInteger highestBid,
    Map<Principal, BigInteger> pendingReturns,
    Map<Principal, List<Bid>> bids,
    BigInteger totalDeposits) {

  /**
   * Highest bidder, if any.
   *
   * @return the optional
   */
  public Optional<Principal> highestBidderIfPresent() {
    return Optional.ofNullable(highestBidder);
  }
}
