package io.flexscheduler.model;

import java.time.Instant;

/**
 * Decides when a job's trigger sequence ends.
 *
 * <p>Both fields may be set, in which case {@code maxRun} takes priority and {@code tillTime} is
 * ignored.
 *
 * @param maxRun the maximum number of runs (may be null)
 * @param tillTime the instant after which no run is scheduled (may be null)
 */
public record ExitCondition(Integer maxRun, Instant tillTime) {

  private static final ExitCondition UNBOUNDED = new ExitCondition(null, null);

  /** The type of exit condition. */
  public enum Kind {
    /** The sequence never ends on its own. */
    UNBOUNDED,
    /** The sequence ends after a fixed number of runs. */
    MAX_RUN,
    /** The sequence ends at a wall-clock instant. */
    TILL_TIME
  }

  /** Validates the run limit. */
  public ExitCondition {
    if (maxRun != null && maxRun < 0) {
      throw new IllegalArgumentException("maxRun must be >= 0, got " + maxRun);
    }
  }

  /**
   * Returns a condition that never ends the sequence.
   *
   * @return the unbounded condition
   */
  public static ExitCondition unbounded() {
    return UNBOUNDED;
  }

  /**
   * Creates a condition that allows exactly {@code maxRun} runs.
   *
   * @param maxRun the number of runs
   * @return a new run-limited condition
   */
  public static ExitCondition maxRun(int maxRun) {
    return new ExitCondition(maxRun, null);
  }

  /**
   * Creates a condition that stops scheduling runs at the given instant.
   *
   * @param tillTime the end instant
   * @return a new time-limited condition
   */
  public static ExitCondition tillTime(Instant tillTime) {
    return new ExitCondition(null, tillTime);
  }

  /**
   * Returns the effective kind of this condition.
   *
   * @return the kind
   */
  public Kind kind() {
    if (maxRun != null) {
      return Kind.MAX_RUN;
    }
    if (tillTime != null) {
      return Kind.TILL_TIME;
    }
    return Kind.UNBOUNDED;
  }
}
