package io.flexscheduler.clock;

/** A pending one-shot timer. */
@FunctionalInterface
public interface TimerHandle {
  /**
   * Cancels the timer. A task that is already running is not interrupted.
   *
   * @return true if the task was prevented from running
   */
  boolean cancel();
}
