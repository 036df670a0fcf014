package com.codeheadsystems.sealedbid.exceptions;

/**
 * Base type for every rejection the auction engine reports to a caller.
 * <p>
 * Rejections are synchronous; a thrown {@code AuctionException} means the operation left no
 * partial state behind unless the subclass documents otherwise.
 */
public abstract class AuctionException extends RuntimeException {

  /**
   * Instantiates a new Auction exception.
   *
   * @param message the message
   */
  protected AuctionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Auction exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  protected AuctionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
