package com.codeheadsystems.sealedbid.auction;

import com.codeheadsystems.sealedbid.common.Principal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Parameters fixed when an auction is created.
 *
 * @param beneficiary     receives the winning bid on settlement
 * @param biddingDeadline first instant at which bids are no longer accepted
 * @param revealDeadline  first instant at which reveals are no longer accepted
 */
public record AuctionConfig(
    Principal beneficiary,
    Instant biddingDeadline,
    Instant revealDeadline
) {

  public AuctionConfig {
    Objects.requireNonNull(beneficiary, "beneficiary");
    Objects.requireNonNull(biddingDeadline, "biddingDeadline");
    Objects.requireNonNull(revealDeadline, "revealDeadline");
    if (!biddingDeadline.isBefore(revealDeadline)) {
      throw new IllegalArgumentException("biddingDeadline " + biddingDeadline
          + " must be before revealDeadline " + revealDeadline);
    }
  }

  /**
   * Creates a configuration whose bidding phase starts now and lasts {@code biddingTime},
   * followed by a reveal phase of {@code revealTime}.
   *
   * @param now         the creation instant
   * @param biddingTime length of the bidding phase, not negative
   * @param revealTime  length of the reveal phase, positive
   * @param beneficiary the beneficiary
   * @return the auction config
   */
  public static AuctionConfig starting(Instant now, Duration biddingTime, Duration revealTime,
                                       Principal beneficiary) {
    Objects.requireNonNull(now, "now");
    if (biddingTime.isNegative()) {
      throw new IllegalArgumentException("biddingTime must not be negative: " + biddingTime);
    }
    Instant biddingDeadline = now.plus(biddingTime);
    return new AuctionConfig(beneficiary, biddingDeadline, biddingDeadline.plus(revealTime));
  }
}
