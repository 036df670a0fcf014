package com.codeheadsystems.sealedbid.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sealedbid.MutableClock;
import com.codeheadsystems.sealedbid.auction.AuctionConfig;
import com.codeheadsystems.sealedbid.commitment.Bid;
import com.codeheadsystems.sealedbid.commitment.RevealedBid;
import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.InMemoryEscrow;
import com.codeheadsystems.sealedbid.event.AuctionEventListener;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Randomized auctions: whatever the bidders do, escrow always holds exactly what is still owed
 * and the highest bid never goes down.
 */
class EscrowConservationTest {

  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
  private static final Principal BENEFICIARY = Principal.of("beneficiary");

  @ParameterizedTest
  @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
  void escrowBalancesAfterEveryStep(long seed) {
    Random random = new Random(seed);
    MutableClock clock = new MutableClock(START);
    InMemoryEscrow escrow = new InMemoryEscrow();
    SealedBidAuctionManager manager = new SealedBidAuctionManager(
        AuctionConfig.starting(START, Duration.ofHours(1), Duration.ofHours(1), BENEFICIARY),
        clock, escrow, AuctionEventListener.NONE);

    List<Principal> bidders = new ArrayList<>();
    Map<Principal, List<RevealedBid>> openings = new HashMap<>();
    for (int i = 0; i < 5; i++) {
      Principal bidder = Principal.of("bidder-" + i);
      bidders.add(bidder);
      openings.put(bidder, new ArrayList<>());
      escrow.fund(bidder, BigInteger.valueOf(10_000));
    }

    for (int i = 0; i < 25; i++) {
      Principal bidder = bidders.get(random.nextInt(bidders.size()));
      RevealedBid opening = RevealedBid.of(random.nextInt(100), random.nextInt(4) == 0, "secret-" + i);
      manager.bid(bidder, opening.commitment(), BigInteger.valueOf(random.nextInt(120)));
      openings.get(bidder).add(opening);
      assertConserved(manager, escrow);
    }

    clock.advance(Duration.ofMinutes(90));
    BigInteger highest = manager.highestBid();
    for (int round = 0; round < 3; round++) {
      for (Principal bidder : bidders) {
        if (random.nextInt(3) == 0) {
          escrow.rejectTransfersTo(bidder);
        }
        List<RevealedBid> supplied = new ArrayList<>();
        for (RevealedBid opening : openings.get(bidder)) {
          // Occasionally garble an opening so the bid stays unverified.
          supplied.add(random.nextInt(5) == 0
              ? RevealedBid.of(opening.value().longValue() + 1, opening.fake(), "garbled")
              : opening);
        }
        try {
          manager.reveal(bidder, supplied);
        } catch (TransferFailureException e) {
          assertThat(manager.pendingReturns(bidder)).isGreaterThanOrEqualTo(e.amount());
        }
        escrow.acceptTransfersTo(bidder);
        assertThat(manager.highestBid()).isGreaterThanOrEqualTo(highest);
        highest = manager.highestBid();
        assertConserved(manager, escrow);
      }
      for (Principal bidder : bidders) {
        if (random.nextBoolean()) {
          manager.withdraw(bidder);
          assertConserved(manager, escrow);
        }
      }
    }

    clock.advance(Duration.ofHours(1));
    manager.end();
    assertConserved(manager, escrow);
    for (Principal bidder : bidders) {
      manager.withdraw(bidder);
    }
    assertConserved(manager, escrow);
    assertThat(manager.snapshot().pendingReturns()).isEmpty();
  }

  private static void assertConserved(SealedBidAuctionManager manager, InMemoryEscrow escrow) {
    AuctionSnapshot snapshot = manager.snapshot();
    BigInteger unrevealed = BigInteger.ZERO;
    for (List<Bid> bids : snapshot.bids().values()) {
      for (Bid bid : bids) {
        if (!bid.isConsumed()) {
          unrevealed = unrevealed.add(bid.deposit());
        }
      }
    }
    BigInteger outstanding = snapshot.pendingReturns().values().stream()
        .reduce(BigInteger.ZERO, BigInteger::add);
    BigInteger unpaidHighest = snapshot.ended() ? BigInteger.ZERO : snapshot.highestBid();

    assertThat(escrow.held()).isEqualTo(unrevealed.add(outstanding).add(unpaidHighest));
    assertThat(escrow.totalDeposited()).isEqualTo(snapshot.totalDeposits());
  }
}
