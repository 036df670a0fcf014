package com.codeheadsystems.sealedbid.auction;

import com.codeheadsystems.sealedbid.commitment.Bid;
import com.codeheadsystems.sealedbid.commitment.CommitmentStore;
import com.codeheadsystems.sealedbid.commitment.RevealedBid;
import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.EscrowTransfer;
import com.codeheadsystems.sealedbid.event.AuctionEventListener;
import com.codeheadsystems.sealedbid.event.HighestBidIncreased;
import com.codeheadsystems.sealedbid.exceptions.LengthMismatchException;
import com.codeheadsystems.sealedbid.exceptions.PhaseViolationException;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import com.codeheadsystems.sealedbid.ledger.WithdrawalLedger;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies reveals against stored commitments, tracks the highest bid and refunds the rest.
 * <p>
 * For every recorded bid, in order: an opening that does not reproduce the commitment is
 * skipped and its deposit forfeit; otherwise the deposit joins the refund, a genuine bid whose
 * deposit covers its value competes for highest bid (keeping that value in escrow when it
 * wins), and the commitment is consumed so no later reveal can refund it again.
 */
public class RevealProcessor {

  private static final Logger log = LoggerFactory.getLogger(RevealProcessor.class);

  private final AuctionLifecycle lifecycle;
  private final AuctionState state;
  private final CommitmentStore store;
  private final WithdrawalLedger ledger;
  private final EscrowTransfer escrow;
  private final AuctionEventListener listener;

  /**
   * Instantiates a new Reveal processor.
   *
   * @param lifecycle the lifecycle
   * @param state     the state
   * @param store     the store
   * @param ledger    the ledger
   * @param escrow    the escrow
   * @param listener  the listener
   */
  public RevealProcessor(final AuctionLifecycle lifecycle,
                         final AuctionState state,
                         final CommitmentStore store,
                         final WithdrawalLedger ledger,
                         final EscrowTransfer escrow,
                         final AuctionEventListener listener) {
    this.lifecycle = lifecycle;
    this.state = state;
    this.store = store;
    this.ledger = ledger;
    this.escrow = escrow;
    this.listener = listener;
  }

  /**
   * Reveals the principal's bids from three parallel lists.
   *
   * @param principal the principal
   * @param values    the values, one per recorded bid
   * @param fakes     the fake flags, one per recorded bid
   * @param secrets   the 32-byte secrets, one per recorded bid
   * @return the reveal result
   * @throws PhaseViolationException   outside the reveal phase
   * @throws LengthMismatchException   if any list length differs from the recorded bid count
   * @throws TransferFailureException  if the refund could not be paid; it is queued in the
   *                                   withdrawal ledger and all other effects stand
   */
  public RevealResult reveal(Principal principal, List<BigInteger> values, List<Boolean> fakes,
                             List<byte[]> secrets) {
    Objects.requireNonNull(principal, "principal");
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(fakes, "fakes");
    Objects.requireNonNull(secrets, "secrets");
    lifecycle.requirePhase("reveal", AuctionPhase.REVEAL);
    int expected = store.count(principal);
    if (values.size() != expected || fakes.size() != expected || secrets.size() != expected) {
      throw new LengthMismatchException(expected, values.size(), fakes.size(), secrets.size());
    }
    List<RevealedBid> openings = new ArrayList<>(expected);
    for (int i = 0; i < expected; i++) {
      openings.add(new RevealedBid(values.get(i), fakes.get(i), secrets.get(i)));
    }
    return process(principal, openings);
  }

  /**
   * Reveals the principal's bids from one list of openings.
   *
   * @param principal the principal
   * @param openings  one opening per recorded bid, in bid order
   * @return the reveal result
   * @see #reveal(Principal, List, List, List)
   */
  public RevealResult reveal(Principal principal, List<RevealedBid> openings) {
    Objects.requireNonNull(principal, "principal");
    Objects.requireNonNull(openings, "openings");
    lifecycle.requirePhase("reveal", AuctionPhase.REVEAL);
    int expected = store.count(principal);
    if (openings.size() != expected) {
      throw new LengthMismatchException(expected, openings.size(), openings.size(), openings.size());
    }
    for (RevealedBid opening : openings) {
      Objects.requireNonNull(opening, "opening");
    }
    return process(principal, openings);
  }

  /**
   * Offers a value as the new highest bid. Ties go to the earlier bidder.
   * <p>
   * On acceptance the previous highest bidder is credited with their highest bid in the
   * withdrawal ledger and the resulting event is added to {@code events} for publication once
   * the reveal has finished changing state.
   *
   * @param bidder the bidder
   * @param value  the value
   * @param events collects the event of an accepted bid
   * @return whether the value became the highest bid
   */
  boolean placeBid(Principal bidder, BigInteger value, List<HighestBidIncreased> events) {
    if (value.compareTo(state.highestBid()) <= 0) {
      return false;
    }
    BigInteger previousBid = state.highestBid();
    state.highestBidder().ifPresent(previous -> ledger.credit(previous, previousBid));
    state.setHighest(bidder, value);
    events.add(new HighestBidIncreased(bidder, value));
    log.info("placeBid(bidder={}) new highest bid {}", bidder, value);
    return true;
  }

  private RevealResult process(Principal principal, List<RevealedBid> openings) {
    List<Bid> bids = store.bids(principal);
    List<Integer> verified = new ArrayList<>();
    List<Integer> unverified = new ArrayList<>();
    List<Integer> previouslyConsumed = new ArrayList<>();
    List<Integer> accepted = new ArrayList<>();
    List<HighestBidIncreased> events = new ArrayList<>();
    BigInteger refund = BigInteger.ZERO;

    for (int i = 0; i < bids.size(); i++) {
      Bid bid = bids.get(i);
      RevealedBid opening = openings.get(i);
      if (bid.isConsumed()) {
        previouslyConsumed.add(i);
        continue;
      }
      if (!opening.opens(bid.commitment())) {
        unverified.add(i);
        log.warn("reveal(principal={}) bid {} did not verify, no refund for deposit {}", principal, i, bid.deposit());
        continue;
      }
      verified.add(i);
      refund = refund.add(bid.deposit());
      if (!opening.fake() && bid.deposit().compareTo(opening.value()) >= 0
          && placeBid(principal, opening.value(), events)) {
        refund = refund.subtract(opening.value());
        accepted.add(i);
      }
      store.consume(principal, i);
    }

    log.debug("reveal(principal={}) verified={} unverified={} refund={}", principal, verified, unverified, refund);
    try {
      payRefund(principal, refund);
    } finally {
      events.forEach(this::publish);
    }
    return new RevealResult(refund, verified, unverified, previouslyConsumed, accepted);
  }

  private void payRefund(Principal principal, BigInteger refund) {
    if (refund.signum() == 0) {
      return;
    }
    try {
      escrow.transfer(principal, refund);
    } catch (TransferFailureException e) {
      ledger.credit(principal, refund);
      log.warn("reveal(principal={}) refund of {} failed, queued for withdrawal: {}",
          principal, refund, e.getMessage());
      throw new TransferFailureException(principal, refund,
          "Refund of " + refund + " could not be paid and was queued for withdrawal", e);
    }
  }

  private void publish(HighestBidIncreased event) {
    try {
      listener.onHighestBidIncreased(event);
    } catch (RuntimeException e) {
      log.warn("Listener failed on {}: {}", event, e.getMessage(), e);
    }
  }
}
