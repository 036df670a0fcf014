package com.codeheadsystems.sealedbid.auction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sealedbid.MutableClock;
import com.codeheadsystems.sealedbid.common.Principal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AuctionPhaseTest {

  private static final Instant BIDDING_DEADLINE = Instant.parse("2026-01-01T01:00:00Z");
  private static final Instant REVEAL_DEADLINE = Instant.parse("2026-01-01T02:00:00Z");

  @Test
  void of_deadlinesBelongToTheLaterPhase() {
    assertThat(phaseAt(BIDDING_DEADLINE.minusNanos(1))).isEqualTo(AuctionPhase.BIDDING);
    assertThat(phaseAt(BIDDING_DEADLINE)).isEqualTo(AuctionPhase.REVEAL);
    assertThat(phaseAt(REVEAL_DEADLINE.minusNanos(1))).isEqualTo(AuctionPhase.REVEAL);
    assertThat(phaseAt(REVEAL_DEADLINE)).isEqualTo(AuctionPhase.SETTLEABLE);
  }

  @Test
  void of_endedOverridesTime() {
    assertThat(AuctionPhase.of(BIDDING_DEADLINE.minusSeconds(5), BIDDING_DEADLINE, REVEAL_DEADLINE, true))
        .isEqualTo(AuctionPhase.ENDED);
  }

  @Test
  void config_startingAddsDurations() {
    Instant now = Instant.parse("2026-01-01T00:00:00Z");
    AuctionConfig config = AuctionConfig.starting(now, Duration.ofHours(1), Duration.ofHours(1),
        Principal.of("beneficiary"));

    assertThat(config.biddingDeadline()).isEqualTo(BIDDING_DEADLINE);
    assertThat(config.revealDeadline()).isEqualTo(REVEAL_DEADLINE);
  }

  @Test
  void config_rejectsEmptyRevealWindow() {
    assertThatThrownBy(() -> new AuctionConfig(Principal.of("b"), REVEAL_DEADLINE, REVEAL_DEADLINE))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> AuctionConfig.starting(BIDDING_DEADLINE, Duration.ofSeconds(-1),
        Duration.ofHours(1), Principal.of("b")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void clock_neverRunsBackwards() {
    MutableClock source = new MutableClock(REVEAL_DEADLINE);
    AuctionClock clock = new AuctionClock(source);

    assertThat(clock.now()).isEqualTo(REVEAL_DEADLINE);
    source.set(BIDDING_DEADLINE);
    assertThat(clock.now()).isEqualTo(REVEAL_DEADLINE);
    source.advance(Duration.ofHours(3));
    assertThat(clock.now()).isEqualTo(BIDDING_DEADLINE.plus(Duration.ofHours(3)));
  }

  private static AuctionPhase phaseAt(Instant now) {
    return AuctionPhase.of(now, BIDDING_DEADLINE, REVEAL_DEADLINE, false);
  }
}
