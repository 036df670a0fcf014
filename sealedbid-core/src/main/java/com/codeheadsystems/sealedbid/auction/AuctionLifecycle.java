package com.codeheadsystems.sealedbid.auction;

import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.EscrowTransfer;
import com.codeheadsystems.sealedbid.event.AuctionEnded;
import com.codeheadsystems.sealedbid.event.AuctionEventListener;
import com.codeheadsystems.sealedbid.exceptions.AlreadyEndedException;
import com.codeheadsystems.sealedbid.exceptions.PhaseViolationException;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import java.math.BigInteger;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase gating and the one-shot settlement of an auction.
 * <p>
 * {@code BIDDING -> REVEAL -> SETTLEABLE -> ENDED}. The first three transitions happen by the
 * passage of time; the last only through {@link #end()}.
 */
public class AuctionLifecycle {

  private static final Logger log = LoggerFactory.getLogger(AuctionLifecycle.class);

  private final AuctionState state;
  private final AuctionClock clock;
  private final EscrowTransfer escrow;
  private final AuctionEventListener listener;

  /**
   * Instantiates a new Auction lifecycle.
   *
   * @param state    the state
   * @param clock    the clock
   * @param escrow   the escrow
   * @param listener the listener
   */
  public AuctionLifecycle(final AuctionState state,
                          final AuctionClock clock,
                          final EscrowTransfer escrow,
                          final AuctionEventListener listener) {
    this.state = state;
    this.clock = clock;
    this.escrow = escrow;
    this.listener = listener;
  }

  /**
   * Current instant according to the auction clock.
   *
   * @return the instant
   */
  public Instant now() {
    return clock.now();
  }

  /**
   * Current phase.
   *
   * @return the auction phase
   */
  public AuctionPhase phase() {
    return state.phase(clock.now());
  }

  /**
   * Rejects the operation unless the auction is in the required phase.
   *
   * @param operation name reported in the exception
   * @param required  the required phase
   * @throws PhaseViolationException if the auction is in any other phase
   */
  public void requirePhase(String operation, AuctionPhase required) {
    AuctionPhase actual = phase();
    if (actual != required) {
      throw new PhaseViolationException(operation, required, actual);
    }
  }

  /**
   * Settles the auction: pays the highest bid to the beneficiary and marks the auction ended.
   * <p>
   * The ended flag is raised before the payout so a re-entrant call is refused, and lowered
   * again if the payout fails, leaving the auction settleable. A zero highest bid ends the
   * auction without a transfer.
   *
   * @return the completion record
   * @throws PhaseViolationException   before the reveal deadline
   * @throws AlreadyEndedException     if the auction was already settled
   * @throws TransferFailureException  if the beneficiary could not be paid; nothing changed
   */
  public AuctionEnded end() {
    AuctionPhase phase = phase();
    if (phase == AuctionPhase.ENDED) {
      throw new AlreadyEndedException();
    }
    if (phase != AuctionPhase.SETTLEABLE) {
      throw new PhaseViolationException("end", AuctionPhase.SETTLEABLE, phase);
    }
    Principal winner = state.highestBidder().orElse(null);
    BigInteger amount = state.highestBid();
    state.setEnded(true);
    if (amount.signum() > 0) {
      try {
        escrow.transfer(state.beneficiary(), amount);
      } catch (TransferFailureException e) {
        state.setEnded(false);
        log.warn("end() payout of {} to beneficiary={} failed: {}", amount, state.beneficiary(), e.getMessage());
        throw e;
      }
    }
    AuctionEnded event = new AuctionEnded(winner, amount);
    log.info("end() winner={} amount={} beneficiary={}", winner, amount, state.beneficiary());
    try {
      listener.onAuctionEnded(event);
    } catch (RuntimeException e) {
      log.warn("Listener failed on {}: {}", event, e.getMessage(), e);
    }
    return event;
  }
}
