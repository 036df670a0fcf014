package com.codeheadsystems.sealedbid.cli.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a scenario step does.
 */
public enum StepAction {
  @JsonProperty("bid") BID,
  @JsonProperty("reveal") REVEAL,
  @JsonProperty("withdraw") WITHDRAW,
  @JsonProperty("end") END,
  // Simulated escrow failures for the named principal.
  @JsonProperty("rejectTransfers") REJECT_TRANSFERS,
  @JsonProperty("acceptTransfers") ACCEPT_TRANSFERS
}
