package com.codeheadsystems.sealedbid.exceptions;

import com.codeheadsystems.sealedbid.auction.AuctionPhase;

/**
 * An operation was invoked outside the phase it is permitted in. The caller may retry once the
 * auction reaches the required phase; nothing was changed.
 */
public class PhaseViolationException extends AuctionException {

  private final String operation;
  private final AuctionPhase requiredPhase;
  private final AuctionPhase actualPhase;

  /**
   * Instantiates a new Phase violation exception.
   *
   * @param operation     the rejected operation
   * @param requiredPhase the phase the operation needs
   * @param actualPhase   the phase the auction was in
   */
  public PhaseViolationException(final String operation,
                                 final AuctionPhase requiredPhase,
                                 final AuctionPhase actualPhase) {
    super(operation + " requires phase " + requiredPhase + " but the auction is in " + actualPhase);
    this.operation = operation;
    this.requiredPhase = requiredPhase;
    this.actualPhase = actualPhase;
  }

  public String operation() {
    return operation;
  }

  public AuctionPhase requiredPhase() {
    return requiredPhase;
  }

  public AuctionPhase actualPhase() {
    return actualPhase;
  }
}
