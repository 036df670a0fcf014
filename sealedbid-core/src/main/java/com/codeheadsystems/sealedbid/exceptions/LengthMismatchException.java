package com.codeheadsystems.sealedbid.exceptions;

/**
 * The reveal inputs do not line up with the principal's recorded bids. Nothing was processed.
 */
public class LengthMismatchException extends AuctionException {

  private final int expected;

  /**
   * Instantiates a new Length mismatch exception.
   *
   * @param expected the number of recorded bids
   * @param values   number of values supplied
   * @param fakes    number of fake flags supplied
   * @param secrets  number of secrets supplied
   */
  public LengthMismatchException(final int expected, final int values, final int fakes, final int secrets) {
    super("Reveal expects " + expected + " entries per input, got values=" + values
        + ", fakes=" + fakes + ", secrets=" + secrets);
    this.expected = expected;
  }

  public int expected() {
    return expected;
  }
}
