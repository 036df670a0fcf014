package com.codeheadsystems.sealedbid.cli;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock whose time is set by the scenario being replayed.
 */
public class ScriptedClock extends Clock {

  private Instant instant;

  public ScriptedClock(Instant start) {
    this.instant = start;
  }

  public void set(Instant instant) {
    this.instant = instant;
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return Clock.fixed(instant, zone);
  }

  @Override
  public Instant instant() {
    return instant;
  }
}
