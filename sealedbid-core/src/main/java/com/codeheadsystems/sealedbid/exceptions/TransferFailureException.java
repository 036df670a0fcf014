package com.codeheadsystems.sealedbid.exceptions;

import com.codeheadsystems.sealedbid.common.Principal;
import java.math.BigInteger;

/**
 * The escrow could not move funds to or from a principal.
 * <p>
 * Thrown by {@link com.codeheadsystems.sealedbid.escrow.EscrowTransfer} implementations and
 * re-reported by the engine once it has put the amount back where it can be claimed again.
 */
public class TransferFailureException extends AuctionException {

  private final Principal principal;
  private final BigInteger amount;

  /**
   * Instantiates a new Transfer failure exception.
   *
   * @param principal the counterparty of the failed transfer
   * @param amount    the amount that did not move
   * @param message   the message
   */
  public TransferFailureException(final Principal principal, final BigInteger amount, final String message) {
    super(message);
    this.principal = principal;
    this.amount = amount;
  }

  /**
   * Instantiates a new Transfer failure exception.
   *
   * @param principal the counterparty of the failed transfer
   * @param amount    the amount that did not move
   * @param message   the message
   * @param cause     the cause
   */
  public TransferFailureException(final Principal principal, final BigInteger amount,
                                  final String message, final Throwable cause) {
    super(message, cause);
    this.principal = principal;
    this.amount = amount;
  }

  public Principal principal() {
    return principal;
  }

  public BigInteger amount() {
    return amount;
  }
}
