package com.voltageems.alarmsrv.repository;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class RuleClock {

  private final Clock clock;
  private final AtomicLong lastMillis = new AtomicLong(Long.MIN_VALUE);

  public RuleClock(Clock clock) {
    this.clock = clock;
  }

  public Instant next() {
    long now = clock.millis();
    long issued = lastMillis.accumulateAndGet(now, (previous, current) ->
        previous == Long.MIN_VALUE ? current : Math.max(previous + 1, current));
    return Instant.ofEpochMilli(issued);
  }
}
