package com.codeheadsystems.sealedbid.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryWithdrawalLedgerTest {

  private static final Principal ALICE = Principal.of("alice");
  private static final Principal BOB = Principal.of("bob");

  private InMemoryWithdrawalLedger ledger;

  @BeforeEach
  void setUp() {
    ledger = new InMemoryWithdrawalLedger();
  }

  @Test
  void credit_accumulates() {
    ledger.credit(ALICE, BigInteger.TEN);
    ledger.credit(ALICE, BigInteger.valueOf(5));
    ledger.credit(BOB, BigInteger.ONE);

    assertThat(ledger.owed(ALICE)).isEqualTo(BigInteger.valueOf(15));
    assertThat(ledger.totalOutstanding()).isEqualTo(BigInteger.valueOf(16));
    assertThat(ledger.balances()).containsOnlyKeys(ALICE, BOB);
  }

  @Test
  void credit_zeroLeavesNoEntry() {
    ledger.credit(ALICE, BigInteger.ZERO);

    assertThat(ledger.balances()).isEmpty();
  }

  @Test
  void credit_negativeRejected() {
    assertThatThrownBy(() -> ledger.credit(ALICE, BigInteger.valueOf(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void take_readsAndZeroes() {
    ledger.credit(ALICE, BigInteger.TEN);

    assertThat(ledger.take(ALICE)).isEqualTo(BigInteger.TEN);
    assertThat(ledger.take(ALICE)).isZero();
    assertThat(ledger.owed(ALICE)).isZero();
    assertThat(ledger.totalOutstanding()).isZero();
  }

  @Test
  void take_unknownPrincipalIsZero() {
    assertThat(ledger.take(BOB)).isZero();
  }
}
