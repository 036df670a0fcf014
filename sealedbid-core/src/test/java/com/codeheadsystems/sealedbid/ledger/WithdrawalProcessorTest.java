package com.codeheadsystems.sealedbid.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.EscrowTransfer;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Withdrawal processor test.
 */
@ExtendWith(MockitoExtension.class)
class WithdrawalProcessorTest {

  private static final Principal ALICE = Principal.of("alice");

  @Mock private EscrowTransfer escrow;

  private InMemoryWithdrawalLedger ledger;
  private WithdrawalProcessor processor;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    ledger = new InMemoryWithdrawalLedger();
    processor = new WithdrawalProcessor(ledger, escrow);
  }

  @Test
  void withdraw_paysAndClears() {
    ledger.credit(ALICE, BigInteger.TEN);

    assertThat(processor.withdraw(ALICE)).isEqualTo(BigInteger.TEN);

    verify(escrow).transfer(ALICE, BigInteger.TEN);
    assertThat(ledger.owed(ALICE)).isZero();
  }

  @Test
  void withdraw_nothingOwedSkipsTransfer() {
    assertThat(processor.withdraw(ALICE)).isZero();

    verifyNoInteractions(escrow);
  }

  @Test
  void withdraw_failedTransferRestoresEntry() {
    ledger.credit(ALICE, BigInteger.TEN);
    doThrow(new TransferFailureException(ALICE, BigInteger.TEN, "rejected"))
        .when(escrow).transfer(any(), any());

    assertThatThrownBy(() -> processor.withdraw(ALICE))
        .isInstanceOf(TransferFailureException.class)
        .hasMessage("rejected");

    assertThat(ledger.owed(ALICE)).isEqualTo(BigInteger.TEN);
    assertThat(ledger.totalOutstanding()).isEqualTo(BigInteger.TEN);
  }

  @Test
  void withdraw_secondCallAfterSuccessPaysNothing() {
    ledger.credit(ALICE, BigInteger.TEN);
    processor.withdraw(ALICE);

    assertThat(processor.withdraw(ALICE)).isZero();
    verify(escrow).transfer(ALICE, BigInteger.TEN);
  }
}
