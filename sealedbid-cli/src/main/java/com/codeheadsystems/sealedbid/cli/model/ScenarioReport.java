package com.codeheadsystems.sealedbid.cli.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Everything a scenario run produced.
 *
 * @param steps       one outcome per step
 * @param snapshot    the auction after the last step
 * @param wallets     wallet balances after the last step
 * @param escrowHeld  value still in escrow custody
 */
public record ScenarioReport(@JsonProperty("steps") List<StepOutcome> steps,
                             @JsonProperty("snapshot") SnapshotView snapshot,
                             @JsonProperty("wallets") Map<String, BigInteger> wallets,
                             @JsonProperty("escrowHeld") BigInteger escrowHeld) {
}
