package io.flexscheduler.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Strongly-typed configuration for the scheduler's threads and clock.
 *
 * @param timerThreads threads waiting on trigger timers
 * @param dispatchThreads threads running job actions, 0 for an unbounded cached pool
 * @param zone the zone weekly slots are expressed in
 * @param shutdownTimeout how long {@code close()} waits for running actions
 */
public record SchedulerConfig(
    int timerThreads, int dispatchThreads, ZoneId zone, Duration shutdownTimeout) {
  public SchedulerConfig {
    if (timerThreads <= 0) {
      throw new IllegalArgumentException("timerThreads must be > 0, got " + timerThreads);
    }
    if (dispatchThreads < 0) {
      throw new IllegalArgumentException("dispatchThreads must be >= 0, got " + dispatchThreads);
    }
    if (zone == null) {
      throw new IllegalArgumentException("zone must not be null");
    }
    if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("shutdownTimeout must be >= 0");
    }
  }

  /** Two timer threads, a cached dispatch pool, the system zone and a five second shutdown. */
  public static SchedulerConfig defaults() {
    return new SchedulerConfig(2, 0, ZoneId.systemDefault(), Duration.ofSeconds(5));
  }
}
