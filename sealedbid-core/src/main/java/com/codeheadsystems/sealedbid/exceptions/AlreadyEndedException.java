package com.codeheadsystems.sealedbid.exceptions;

/**
 * The auction has already been settled; the beneficiary is never paid twice.
 */
public class AlreadyEndedException extends AuctionException {

  /**
   * Instantiates a new Already ended exception.
   */
  public AlreadyEndedException() {
    super("The auction has already ended");
  }
}
