package com.codeheadsystems.sealedbid.cli.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.util.List;

/**
 * One timed step of a scenario.
 * <p>
 * A {@code bid} takes either an explicit {@code commitment} or the {@code value}/{@code fake}/
 * {@code secret} to seal, plus a {@code deposit}. A {@code reveal} lists one opening per bid the
 * principal placed. The other actions only need a principal, except {@code end} which needs none.
 *
 * @param at         seconds after the scenario start at which the step runs
 * @param action     the action
 * @param principal  the acting principal
 * @param value      bid value to seal
 * @param fake       whether the sealed bid is a decoy
 * @param secret     secret to seal with, read like {@link Opening#secret()}: a {@code 0x} prefix
 *                   always means 32 hex-encoded bytes
 * @param commitment hex commitment, used instead of sealing value/fake/secret
 * @param deposit    amount sent with the bid
 * @param reveals    openings for a reveal
 */
public record ScenarioStep(@JsonProperty("at") long at,
                           @JsonProperty("action") StepAction action,
                           @JsonProperty("principal") String principal,
                           @JsonProperty("value") BigInteger value,
                           @JsonProperty("fake") boolean fake,
                           @JsonProperty("secret") String secret,
                           @JsonProperty("commitment") String commitment,
                           @JsonProperty("deposit") BigInteger deposit,
                           @JsonProperty("reveals") List<Opening> reveals) {

  public ScenarioStep {
    if (action == null) {
      throw new IllegalArgumentException("Missing required field: action");
    }
    reveals = reveals == null ? List.of() : List.copyOf(reveals);
  }
}
