package io.flexscheduler.clock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * The time source and timer of the scheduling engine.
 *
 * <p>Trigger sequences read the current time and arm one-shot timers through this abstraction,
 * so the same code runs against the wall clock ({@link SystemSchedulerClock}) or a clock that is
 * advanced by hand ({@link VirtualClock}).
 */
public interface SchedulerClock {

  /**
   * Returns the current instant.
   *
   * @return the current instant
   */
  Instant now();

  /**
   * Returns the zone used to resolve local weekdays and times of day.
   *
   * @return the zone
   */
  ZoneId zone();

  /**
   * Returns the current time in the clock's zone.
   *
   * @return the current local time
   */
  default ZonedDateTime localNow() {
    return now().atZone(zone());
  }

  /**
   * Runs a task once after the given delay.
   *
   * @param task the task to run
   * @param delay the delay, zero or negative to run as soon as possible
   * @return a handle that cancels the task if it has not started
   */
  TimerHandle schedule(Runnable task, Duration delay);
}
