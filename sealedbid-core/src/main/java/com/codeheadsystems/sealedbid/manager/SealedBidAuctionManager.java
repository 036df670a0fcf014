package com.codeheadsystems.sealedbid.manager;

import com.codeheadsystems.sealedbid.auction.AuctionClock;
import com.codeheadsystems.sealedbid.auction.AuctionConfig;
import com.codeheadsystems.sealedbid.auction.AuctionLifecycle;
import com.codeheadsystems.sealedbid.auction.AuctionPhase;
import com.codeheadsystems.sealedbid.auction.AuctionState;
import com.codeheadsystems.sealedbid.auction.BiddingProcessor;
import com.codeheadsystems.sealedbid.auction.RevealProcessor;
import com.codeheadsystems.sealedbid.auction.RevealResult;
import com.codeheadsystems.sealedbid.commitment.Bid;
import com.codeheadsystems.sealedbid.commitment.Commitment;
import com.codeheadsystems.sealedbid.commitment.CommitmentStore;
import com.codeheadsystems.sealedbid.commitment.InMemoryCommitmentStore;
import com.codeheadsystems.sealedbid.commitment.RevealedBid;
import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.EscrowTransfer;
import com.codeheadsystems.sealedbid.event.AuctionEnded;
import com.codeheadsystems.sealedbid.event.AuctionEventListener;
import com.codeheadsystems.sealedbid.ledger.InMemoryWithdrawalLedger;
import com.codeheadsystems.sealedbid.ledger.WithdrawalLedger;
import com.codeheadsystems.sealedbid.ledger.WithdrawalProcessor;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic entry point for one sealed-bid auction.
 * <p>
 * Owns the auction's state, commitment store and withdrawal ledger and serializes every
 * operation, queries included, behind a single lock, so no caller ever observes a
 * half-applied mutation.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link com.codeheadsystems.sealedbid.exceptions.PhaseViolationException}: operation
 *       invoked outside its phase; retry later</li>
 *   <li>{@link com.codeheadsystems.sealedbid.exceptions.LengthMismatchException}: reveal
 *       inputs do not match the recorded bid count</li>
 *   <li>{@link com.codeheadsystems.sealedbid.exceptions.AlreadyEndedException}: duplicate
 *       settlement</li>
 *   <li>{@link com.codeheadsystems.sealedbid.exceptions.TransferFailureException}: the escrow
 *       could not move funds; the amount remains claimable</li>
 *   <li>{@link IllegalArgumentException} / {@link NullPointerException}: malformed input</li>
 * </ul>
 */
@Singleton
public class SealedBidAuctionManager {

  private static final Logger log = LoggerFactory.getLogger(SealedBidAuctionManager.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final AuctionState state;
  private final CommitmentStore store;
  private final WithdrawalLedger ledger;
  private final AuctionLifecycle lifecycle;
  private final BiddingProcessor biddingProcessor;
  private final RevealProcessor revealProcessor;
  private final WithdrawalProcessor withdrawalProcessor;

  /**
   * Production constructor with in-memory store and ledger.
   *
   * @param config   the config
   * @param clock    the clock
   * @param escrow   the escrow
   * @param listener the listener
   */
  @Inject
  public SealedBidAuctionManager(final AuctionConfig config,
                                 final Clock clock,
                                 final EscrowTransfer escrow,
                                 final AuctionEventListener listener) {
    this(config, clock, escrow, listener, new InMemoryCommitmentStore(), new InMemoryWithdrawalLedger());
  }

  /**
   * Instantiates a new Sealed bid auction manager with the supplied store and ledger.
   *
   * @param config   the config
   * @param clock    the clock
   * @param escrow   the escrow
   * @param listener the listener
   * @param store    the commitment store
   * @param ledger   the withdrawal ledger
   */
  public SealedBidAuctionManager(final AuctionConfig config,
                                 final Clock clock,
                                 final EscrowTransfer escrow,
                                 final AuctionEventListener listener,
                                 final CommitmentStore store,
                                 final WithdrawalLedger ledger) {
    log.info("SealedBidAuctionManager(beneficiary={}, biddingDeadline={}, revealDeadline={})",
        config.beneficiary(), config.biddingDeadline(), config.revealDeadline());
    this.state = new AuctionState(config);
    this.store = store;
    this.ledger = ledger;
    this.lifecycle = new AuctionLifecycle(state, new AuctionClock(clock), escrow, listener);
    this.biddingProcessor = new BiddingProcessor(lifecycle, store, escrow);
    this.revealProcessor = new RevealProcessor(lifecycle, state, store, ledger, escrow, listener);
    this.withdrawalProcessor = new WithdrawalProcessor(ledger, escrow);
  }

  // ── Operations ─────────────────────────────────────────────────────────────

  /**
   * Commits a blinded bid and takes its deposit into escrow.
   *
   * @param principal  the bidder
   * @param commitment the commitment
   * @param deposit    the deposit
   * @return the bid's index within the principal's sequence
   */
  public int bid(Principal principal, Commitment commitment, BigInteger deposit) {
    return locked(() -> biddingProcessor.bid(principal, commitment, deposit));
  }

  /**
   * Reveals the principal's bids from three parallel lists.
   *
   * @param principal the principal
   * @param values    the values
   * @param fakes     the fake flags
   * @param secrets   the secrets
   * @return the reveal result
   */
  public RevealResult reveal(Principal principal, List<BigInteger> values, List<Boolean> fakes,
                             List<byte[]> secrets) {
    return locked(() -> revealProcessor.reveal(principal, values, fakes, secrets));
  }

  /**
   * Reveals the principal's bids.
   *
   * @param principal the principal
   * @param openings  the openings, in bid order
   * @return the reveal result
   */
  public RevealResult reveal(Principal principal, List<RevealedBid> openings) {
    return locked(() -> revealProcessor.reveal(principal, openings));
  }

  /**
   * Pays out what the principal is owed.
   *
   * @param principal the principal
   * @return the amount paid
   */
  public BigInteger withdraw(Principal principal) {
    return locked(() -> withdrawalProcessor.withdraw(principal));
  }

  /**
   * Settles the auction.
   *
   * @return the completion record
   */
  public AuctionEnded end() {
    return locked(lifecycle::end);
  }

  // ── Queries ────────────────────────────────────────────────────────────────

  public AuctionPhase phase() {
    return locked(lifecycle::phase);
  }

  public BigInteger highestBid() {
    return locked(state::highestBid);
  }

  public Optional<Principal> highestBidder() {
    return locked(state::highestBidder);
  }

  public boolean isEnded() {
    return locked(state::isEnded);
  }

  /**
   * Amount the principal can currently withdraw.
   *
   * @param principal the principal
   * @return the amount
   */
  public BigInteger pendingReturns(Principal principal) {
    return locked(() -> ledger.owed(principal));
  }

  /**
   * The principal's bids in order.
   *
   * @param principal the principal
   * @return the bids
   */
  public List<Bid> bids(Principal principal) {
    return locked(() -> store.bids(principal));
  }

  /**
   * Consistent view of the whole auction.
   *
   * @return the snapshot
   */
  public AuctionSnapshot snapshot() {
    return locked(() -> {
      Map<Principal, List<Bid>> bids = new LinkedHashMap<>();
      for (Principal principal : store.principals()) {
        bids.put(principal, store.bids(principal));
      }
      return new AuctionSnapshot(
          state.beneficiary(),
          state.biddingDeadline(),
          state.revealDeadline(),
          lifecycle.phase(),
          state.isEnded(),
          state.highestBidder().orElse(null),
          state.highestBid(),
          ledger.balances(),
          Collections.unmodifiableMap(bids),
          store.totalDeposits());
    });
  }

  private <T> T locked(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
