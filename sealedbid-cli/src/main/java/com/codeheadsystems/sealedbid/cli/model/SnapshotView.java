package com.codeheadsystems.sealedbid.cli.model;

import com.codeheadsystems.sealedbid.commitment.Bid;
import com.codeheadsystems.sealedbid.common.Principal;
import com.codeheadsystems.sealedbid.manager.AuctionSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of an {@link AuctionSnapshot}.
 *
 * @param beneficiary     the beneficiary
 * @param biddingDeadline ISO-8601 bidding deadline
 * @param revealDeadline  ISO-8601 reveal deadline
 * @param phase           the phase
 * @param ended           whether settlement completed
 * @param highestBidder   the highest bidder, null if none
 * @param highestBid      the highest bid
 * @param pendingReturns  withdrawable amount per principal
 * @param unrevealedBids  bids still sealed per principal
 * @param totalDeposits   every deposit ever taken
 */
public record SnapshotView(@JsonProperty("beneficiary") String beneficiary,
                           @JsonProperty("biddingDeadline") String biddingDeadline,
                           @JsonProperty("revealDeadline") String revealDeadline,
                           @JsonProperty("phase") String phase,
                           @JsonProperty("ended") boolean ended,
                           @JsonProperty("highestBidder") String highestBidder,
                           @JsonProperty("highestBid") BigInteger highestBid,
                           @JsonProperty("pendingReturns") Map<String, BigInteger> pendingReturns,
                           @JsonProperty("unrevealedBids") Map<String, Integer> unrevealedBids,
                           @JsonProperty("totalDeposits") BigInteger totalDeposits) {

  public SnapshotView(AuctionSnapshot snapshot) {
    this(snapshot.beneficiary().id(),
        snapshot.biddingDeadline().toString(),
        snapshot.revealDeadline().toString(),
        snapshot.phase().name(),
        snapshot.ended(),
        snapshot.highestBidderIfPresent().map(Principal::id).orElse(null),
        snapshot.highestBid(),
        byId(snapshot.pendingReturns()),
        unrevealed(snapshot.bids()),
        snapshot.totalDeposits());
  }

  private static Map<String, BigInteger> byId(Map<Principal, BigInteger> amounts) {
    Map<String, BigInteger> result = new LinkedHashMap<>();
    amounts.forEach((principal, amount) -> result.put(principal.id(), amount));
    return result;
  }

  private static Map<String, Integer> unrevealed(Map<Principal, List<Bid>> bids) {
    Map<String, Integer> result = new LinkedHashMap<>();
    bids.forEach((principal, list) ->
        result.put(principal.id(), (int) list.stream().filter(b -> !b.isConsumed()).count()));
    return result;
  }
}
