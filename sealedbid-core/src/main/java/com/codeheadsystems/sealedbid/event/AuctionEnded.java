package com.codeheadsystems.sealedbid.event;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Completion record of a settled auction.
 *
 * @param winner the highest bidder, or null when no bid was accepted
 * @param amount the amount paid to the beneficiary
 */
public record AuctionEnded(Principal winner, BigInteger amount) {

  /**
   * Winner, if any bid was accepted.
   *
   * @return the optional winner
   */
  public Optional<Principal> winnerIfPresent() {
    return Optional.ofNullable(winner);
  }
}
