package com.codeheadsystems.sealedbid.auction;

import com.codeheadsystems.sealedbid.common.Amounts;
import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The authoritative mutable record of one auction.
 * <p>
 * Only {@link RevealProcessor} moves the highest bid and only {@link AuctionLifecycle} flips the
 * ended flag; both mutators are package-private. The highest bid never decreases.
 */
public class AuctionState {

  private final Principal beneficiary;
  private final Instant biddingDeadline;
  private final Instant revealDeadline;
  private boolean ended;
  private Principal highestBidder;
  private BigInteger highestBid = BigInteger.ZERO;

  /**
   * Instantiates a new Auction state.
   *
   * @param config the config
   */
  public AuctionState(final AuctionConfig config) {
    this.beneficiary = config.beneficiary();
    this.biddingDeadline = config.biddingDeadline();
    this.revealDeadline = config.revealDeadline();
  }

  public Principal beneficiary() {
    return beneficiary;
  }

  public Instant biddingDeadline() {
    return biddingDeadline;
  }

  public Instant revealDeadline() {
    return revealDeadline;
  }

  public boolean isEnded() {
    return ended;
  }

  public Optional<Principal> highestBidder() {
    return Optional.ofNullable(highestBidder);
  }

  public BigInteger highestBid() {
    return highestBid;
  }

  /**
   * Phase at the given instant.
   *
   * @param now the now
   * @return the auction phase
   */
  public AuctionPhase phase(Instant now) {
    return AuctionPhase.of(now, biddingDeadline, revealDeadline, ended);
  }

  void setHighest(Principal bidder, BigInteger bid) {
    Objects.requireNonNull(bidder, "bidder");
    Amounts.requireUnsigned(bid, "bid");
    if (bid.compareTo(highestBid) < 0) {
      throw new IllegalStateException("Highest bid may not decrease from " + highestBid + " to " + bid);
    }
    highestBidder = bidder;
    highestBid = bid;
  }

  void setEnded(boolean ended) {
    this.ended = ended;
  }
}
