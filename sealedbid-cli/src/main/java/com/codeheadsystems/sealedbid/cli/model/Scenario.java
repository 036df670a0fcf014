package com.codeheadsystems.sealedbid.cli.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * A scripted auction: { start, beneficiary, biddingSeconds, revealSeconds, wallets, steps }.
 *
 * @param start          ISO-8601 instant the auction opens; defaults to the Unix epoch when absent
 * @param beneficiary    principal paid the winning bid
 * @param biddingSeconds length of the bidding phase
 * @param revealSeconds  length of the reveal phase
 * @param wallets        initial wallet balance per principal
 * @param steps          the steps to replay, in order
 */
public record Scenario(@JsonProperty("start") String start,
                       @JsonProperty("beneficiary") String beneficiary,
                       @JsonProperty("biddingSeconds") long biddingSeconds,
                       @JsonProperty("revealSeconds") long revealSeconds,
                       @JsonProperty("wallets") Map<String, BigInteger> wallets,
                       @JsonProperty("steps") List<ScenarioStep> steps) {

  public Scenario {
    if (beneficiary == null || beneficiary.isBlank()) {
      throw new IllegalArgumentException("Missing required field: beneficiary");
    }
    wallets = wallets == null ? Map.of() : Map.copyOf(wallets);
    steps = steps == null ? List.of() : List.copyOf(steps);
  }
}
