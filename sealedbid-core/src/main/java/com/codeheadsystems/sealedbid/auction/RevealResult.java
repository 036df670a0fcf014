package com.codeheadsystems.sealedbid.auction;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of one reveal call. Indices refer to the principal's bid sequence.
 *
 * @param refund                   amount refunded to the principal by this call
 * @param verifiedIndices          bids whose opening matched and were consumed
 * @param unverifiedIndices        bids whose opening did not match; their deposits are forfeit
 * @param previouslyConsumedIndices bids already processed by an earlier reveal
 * @param acceptedIndices          verified bids that became the highest bid when processed
 */
public record RevealResult(
    BigInteger refund,
    List<Integer> verifiedIndices,
    List<Integer> unverifiedIndices,
    List<Integer> previouslyConsumedIndices,
    List<Integer> acceptedIndices) {

  public RevealResult {
    verifiedIndices = List.copyOf(verifiedIndices);
    unverifiedIndices = List.copyOf(unverifiedIndices);
    previouslyConsumedIndices = List.copyOf(previouslyConsumedIndices);
    acceptedIndices = List.copyOf(acceptedIndices);
  }
}
