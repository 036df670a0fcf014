package com.codeheadsystems.sealedbid.auction;

import com.codeheadsystems.sealedbid.commitment.Commitment;
import com.codeheadsystems.sealedbid.commitment.CommitmentStore;
import com.codeheadsystems.sealedbid.common.Amounts;
import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.EscrowTransfer;
import java.math.BigInteger;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts blinded bids during the bidding phase.
 */
public class BiddingProcessor {

  private static final Logger log = LoggerFactory.getLogger(BiddingProcessor.class);

  private final AuctionLifecycle lifecycle;
  private final CommitmentStore store;
  private final EscrowTransfer escrow;

  /**
   * Instantiates a new Bidding processor.
   *
   * @param lifecycle the lifecycle
   * @param store     the store
   * @param escrow    the escrow
   */
  public BiddingProcessor(final AuctionLifecycle lifecycle,
                          final CommitmentStore store,
                          final EscrowTransfer escrow) {
    this.lifecycle = lifecycle;
    this.store = store;
    this.escrow = escrow;
  }

  /**
   * Takes the deposit into custody and records the commitment. The deposit is kept whether or
   * not the bid is ever revealed correctly; only a verified reveal opens its refund path.
   *
   * @param principal  the bidder
   * @param commitment the blinded bid
   * @param deposit    the deposit
   * @return the bid's index within the principal's sequence
   * @throws com.codeheadsystems.sealedbid.exceptions.PhaseViolationException  after the bidding deadline
   * @throws com.codeheadsystems.sealedbid.exceptions.TransferFailureException if the deposit could not be
   *                                                                           collected; no bid is recorded
   */
  public int bid(Principal principal, Commitment commitment, BigInteger deposit) {
    Objects.requireNonNull(principal, "principal");
    Objects.requireNonNull(commitment, "commitment");
    Amounts.requireUnsigned(deposit, "deposit");
    if (commitment.isConsumed()) {
      throw new IllegalArgumentException("The all-zero commitment is reserved and cannot be revealed");
    }
    lifecycle.requirePhase("bid", AuctionPhase.BIDDING);
    escrow.deposit(principal, deposit);
    int index = store.append(principal, commitment, deposit);
    log.debug("bid(principal={}, index={}, deposit={})", principal, index, deposit);
    return index;
  }
}
