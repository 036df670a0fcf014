package com.codeheadsystems.sealedbid.commitment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory commitment store test.
 */
class InMemoryCommitmentStoreTest {

  private static final Principal ALICE = Principal.of("alice");
  private static final Principal BOB = Principal.of("bob");

  private InMemoryCommitmentStore store;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    store = new InMemoryCommitmentStore();
  }

  @Test
  void append_returnsPerPrincipalIndices() {
    assertThat(store.append(ALICE, RevealedBid.of(1, false, "a").commitment(), BigInteger.ONE)).isZero();
    assertThat(store.append(BOB, RevealedBid.of(2, false, "b").commitment(), BigInteger.TWO)).isZero();
    assertThat(store.append(ALICE, RevealedBid.of(3, false, "c").commitment(), BigInteger.TEN)).isEqualTo(1);

    assertThat(store.count(ALICE)).isEqualTo(2);
    assertThat(store.count(BOB)).isEqualTo(1);
    assertThat(store.totalDeposits()).isEqualTo(BigInteger.valueOf(13));
  }

  @Test
  void bids_preserveInsertionOrder() {
    Commitment first = RevealedBid.of(1, false, "a").commitment();
    Commitment second = RevealedBid.of(2, true, "b").commitment();
    store.append(ALICE, first, BigInteger.ONE);
    store.append(BOB, RevealedBid.of(9, false, "z").commitment(), BigInteger.ONE);
    store.append(ALICE, second, BigInteger.TWO);

    List<Bid> bids = store.bids(ALICE);
    assertThat(bids).extracting(Bid::commitment).containsExactly(first, second);
    assertThat(bids).extracting(Bid::deposit).containsExactly(BigInteger.ONE, BigInteger.TWO);
  }

  @Test
  void bids_unknownPrincipalIsEmpty() {
    assertThat(store.bids(ALICE)).isEmpty();
    assertThat(store.count(ALICE)).isZero();
  }

  @Test
  void bids_snapshotIsUnmodifiable() {
    store.append(ALICE, RevealedBid.of(1, false, "a").commitment(), BigInteger.ONE);
    List<Bid> bids = store.bids(ALICE);

    assertThatThrownBy(() -> bids.add(new Bid(Commitment.CONSUMED, BigInteger.ONE)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void consume_zeroesOnlyThatBid() {
    store.append(ALICE, RevealedBid.of(1, false, "a").commitment(), BigInteger.ONE);
    store.append(ALICE, RevealedBid.of(2, false, "b").commitment(), BigInteger.TWO);

    store.consume(ALICE, 1);

    List<Bid> bids = store.bids(ALICE);
    assertThat(bids.get(0).isConsumed()).isFalse();
    assertThat(bids.get(1).isConsumed()).isTrue();
    assertThat(bids.get(1).deposit()).isEqualTo(BigInteger.TWO);
  }

  @Test
  void consume_outOfRangeThrows() {
    store.append(ALICE, RevealedBid.of(1, false, "a").commitment(), BigInteger.ONE);

    assertThatThrownBy(() -> store.consume(ALICE, 1)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> store.consume(BOB, 0)).isInstanceOf(IndexOutOfBoundsException.class);
  }

  @Test
  void principals_inOrderOfFirstBid() {
    store.append(BOB, RevealedBid.of(1, false, "a").commitment(), BigInteger.ONE);
    store.append(ALICE, RevealedBid.of(1, false, "b").commitment(), BigInteger.ONE);
    store.append(BOB, RevealedBid.of(1, false, "c").commitment(), BigInteger.ONE);

    assertThat(store.principals()).containsExactly(BOB, ALICE);
  }
}
