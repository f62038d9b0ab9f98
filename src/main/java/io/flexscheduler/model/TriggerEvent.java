package io.flexscheduler.model;

import java.time.Instant;

/**
 * One activation of a job.
 *
 * @param job the job that fired
 * @param triggerTime the instant the trigger fired
 * @param runCount the 1-based run count within the job's sequence
 */
public record TriggerEvent(Job job, Instant triggerTime, int runCount) {
  /** Validates the run count. */
  public TriggerEvent {
    if (runCount < 1) {
      throw new IllegalArgumentException("runCount must be >= 1, got " + runCount);
    }
  }
}
