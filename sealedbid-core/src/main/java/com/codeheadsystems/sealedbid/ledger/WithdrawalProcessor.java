package com.codeheadsystems.sealedbid.ledger;

import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.escrow.EscrowTransfer;
import com.codeheadsystems.sealedbid.exceptions.TransferFailureException;
import java.math.BigInteger;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pays out {@link WithdrawalLedger} entries on demand. Valid in every auction phase.
 */
public class WithdrawalProcessor {

  private static final Logger log = LoggerFactory.getLogger(WithdrawalProcessor.class);

  private final WithdrawalLedger ledger;
  private final EscrowTransfer escrow;

  /**
   * Instantiates a new Withdrawal processor.
   *
   * @param ledger the ledger
   * @param escrow the escrow
   */
  public WithdrawalProcessor(final WithdrawalLedger ledger, final EscrowTransfer escrow) {
    this.ledger = ledger;
    this.escrow = escrow;
  }

  /**
   * Zeroes the principal's entry and transfers it. The entry is zeroed before the transfer so
   * a re-entrant call cannot pay it twice; if the transfer fails the entry is restored before
   * the failure is reported.
   *
   * @param principal the principal
   * @return the amount paid, zero when nothing was owed
   * @throws TransferFailureException if the escrow could not pay; the ledger is unchanged
   */
  public BigInteger withdraw(Principal principal) {
    Objects.requireNonNull(principal, "principal");
    BigInteger amount = ledger.take(principal);
    if (amount.signum() == 0) {
      log.debug("withdraw(principal={}) nothing owed", principal);
      return BigInteger.ZERO;
    }
    try {
      escrow.transfer(principal, amount);
    } catch (TransferFailureException e) {
      ledger.credit(principal, amount);
      log.warn("withdraw(principal={}) transfer of {} failed, restored to ledger: {}",
          principal, amount, e.getMessage());
      throw e;
    }
    log.info("withdraw(principal={}) paid {}", principal, amount);
    return amount;
  }
}
