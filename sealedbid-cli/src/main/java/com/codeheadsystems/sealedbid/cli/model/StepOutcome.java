package com.codeheadsystems.sealedbid.cli.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of replaying one step.
 *
 * @param at        seconds after start
 * @param action    the action
 * @param principal the acting principal, null for {@code end}
 * @param phase     the auction phase when the step ran
 * @param ok        whether the step succeeded
 * @param result    human-readable result of a successful step
 * @param error     exception type and message of a failed step
 */
public record StepOutcome(@JsonProperty("at") long at,
                          @JsonProperty("action") StepAction action,
                          @JsonProperty("principal") String principal,
                          @JsonProperty("phase") String phase,
                          @JsonProperty("ok") boolean ok,
                          @JsonProperty("result") String result,
                          @JsonProperty("error") String error) {
}
