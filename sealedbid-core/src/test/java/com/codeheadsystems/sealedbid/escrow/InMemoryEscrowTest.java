package com.codeheadsystems.sealedbid.escrow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryEscrowTest {

  private static final Principal ALICE = Principal.of("alice");
  private static final Principal BOB = Principal.of("bob");

  private InMemoryEscrow escrow;

  @BeforeEach
  void setUp() {
    escrow = new InMemoryEscrow();
    escrow.fund(ALICE, BigInteger.valueOf(100));
  }

  @Test
  void deposit_movesFundsIntoCustody() {
    escrow.deposit(ALICE, BigInteger.valueOf(40));

    assertThat(escrow.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(60));
    assertThat(escrow.held()).isEqualTo(BigInteger.valueOf(40));
    assertThat(escrow.totalDeposited()).isEqualTo(BigInteger.valueOf(40));
  }

  @Test
  void deposit_insufficientFundsChangesNothing() {
    assertThatThrownBy(() -> escrow.deposit(BOB, BigInteger.ONE))
        .isInstanceOf(TransferFailureException.class)
        .hasMessageContaining("Insufficient funds");

    assertThat(escrow.held()).isZero();
    assertThat(escrow.balanceOf(BOB)).isZero();
  }

  @Test
  void transfer_paysOutOfCustody() {
    escrow.deposit(ALICE, BigInteger.valueOf(40));

    escrow.transfer(BOB, BigInteger.valueOf(15));

    assertThat(escrow.balanceOf(BOB)).isEqualTo(BigInteger.valueOf(15));
    assertThat(escrow.held()).isEqualTo(BigInteger.valueOf(25));
    assertThat(escrow.totalPaidOut()).isEqualTo(BigInteger.valueOf(15));
  }

  @Test
  void transfer_rejectingDestinationFailsAtomically() {
    escrow.deposit(ALICE, BigInteger.valueOf(40));
    escrow.rejectTransfersTo(BOB);

    assertThatThrownBy(() -> escrow.transfer(BOB, BigInteger.TEN))
        .isInstanceOfSatisfying(TransferFailureException.class, e -> {
          assertThat(e.principal()).isEqualTo(BOB);
          assertThat(e.amount()).isEqualTo(BigInteger.TEN);
        });
    assertThat(escrow.held()).isEqualTo(BigInteger.valueOf(40));
    assertThat(escrow.balanceOf(BOB)).isZero();

    escrow.acceptTransfersTo(BOB);
    escrow.transfer(BOB, BigInteger.TEN);
    assertThat(escrow.balanceOf(BOB)).isEqualTo(BigInteger.TEN);
  }

  @Test
  void transfer_moreThanHeldIsAnAccountingError() {
    assertThatThrownBy(() -> escrow.transfer(BOB, BigInteger.ONE))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void fundAndDeposit_concurrentCallsLoseNothing() throws Exception {
    int threads = 4;
    int iterations = 1000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        futures.add(executor.submit(() -> {
          for (int i = 0; i < iterations; i++) {
            escrow.fund(ALICE, BigInteger.ONE);
            escrow.deposit(ALICE, BigInteger.ONE);
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(escrow.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(100));
    assertThat(escrow.held()).isEqualTo(BigInteger.valueOf(threads * iterations));
  }
}
