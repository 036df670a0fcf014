package com.codeheadsystems.sealedbid.commitment;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Storage abstraction for committed bids.
 * <p>
 * Each principal owns an ordered, append-only sequence of {@link Bid}s. Insertion order is
 * significant: a reveal supplies its openings in the same order. Bids are never removed; the
 * only mutation after insertion is {@link #consume(Principal, int)}.
 * <p>
 * Implementations need not be thread-safe. All access goes through
 * {@link com.codeheadsystems.sealedbid.manager.SealedBidAuctionManager}, which serializes it.
 */
public interface CommitmentStore {

  /**
   * Appends a bid to the principal's sequence.
   *
   * @param principal  the bidder
   * @param commitment the blinded bid
   * @param deposit    the deposit taken into escrow with it
   * @return the bid's zero-based index within the principal's sequence
   */
  int append(Principal principal, Commitment commitment, BigInteger deposit);

  /**
   * Number of bids the principal has recorded.
   *
   * @param principal the principal
   * @return the count, zero for an unknown principal
   */
  int count(Principal principal);

  /**
   * The principal's bids in insertion order.
   *
   * @param principal the principal
   * @return an immutable snapshot, empty for an unknown principal
   */
  List<Bid> bids(Principal principal);

  /**
   * Replaces the commitment of the given bid with {@link Commitment#CONSUMED}.
   *
   * @param principal the principal
   * @param index     index within the principal's sequence
   * @throws IndexOutOfBoundsException if the principal has no such bid
   */
  void consume(Principal principal, int index);

  /**
   * Principals that have recorded at least one bid, in order of their first bid.
   *
   * @return the principals
   */
  Set<Principal> principals();

  /**
   * Sum of every deposit ever recorded.
   *
   * @return the total
   */
  BigInteger totalDeposits();
}
