package com.codeheadsystems.sealedbid.auction;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Monotonic view of an externally supplied {@link Clock}. If the underlying clock steps
 * backwards, the last reading is repeated until it catches up, so phases never regress.
 */
public class AuctionClock {

  private final Clock clock;
  private Instant last = Instant.MIN;

  /**
   * Instantiates a new Auction clock.
   *
   * @param clock the underlying clock
   */
  public AuctionClock(final Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Now instant.
   *
   * @return the instant, never earlier than any previous reading
   */
  public synchronized Instant now() {
    Instant reading = clock.instant();
    if (reading.isAfter(last)) {
      last = reading;
    }
    return last;
  }
}
