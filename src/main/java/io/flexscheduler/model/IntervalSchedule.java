package io.flexscheduler.model;

/**
 * A schedule that fires at a fixed interval.
 *
 * @param intervalSeconds the step between runs in seconds
 * @param triggerAtStart whether the first run fires after the start delay
 * @param afterStartSeconds the start delay in seconds
 * @param exitCondition the exit condition
 */
public record IntervalSchedule(
    int intervalSeconds, boolean triggerAtStart, int afterStartSeconds, ExitCondition exitCondition)
    implements JobSchedule {

  /** The persisted type name. */
  public static final String TYPE_NAME = "IntervalSchedule";

  /** Validates the timings and defaults the exit condition. */
  public IntervalSchedule {
    if (intervalSeconds <= 0) {
      throw new IllegalArgumentException("intervalSeconds must be > 0, got " + intervalSeconds);
    }
    if (afterStartSeconds < 0) {
      throw new IllegalArgumentException(
          "afterStartSeconds must be >= 0, got " + afterStartSeconds);
    }
    exitCondition = exitCondition == null ? ExitCondition.unbounded() : exitCondition;
  }

  /**
   * Creates an unbounded interval schedule that waits a full interval before the first run.
   *
   * @param intervalSeconds the interval in seconds
   * @return a new interval schedule
   */
  public static IntervalSchedule every(int intervalSeconds) {
    return new IntervalSchedule(intervalSeconds, false, 0, ExitCondition.unbounded());
  }

  @Override
  public String typeName() {
    return TYPE_NAME;
  }

  @Override
  public IntervalSchedule withTriggerAtStart(boolean triggerAtStart) {
    return new IntervalSchedule(intervalSeconds, triggerAtStart, afterStartSeconds, exitCondition);
  }

  @Override
  public IntervalSchedule withAfterStartSeconds(int afterStartSeconds) {
    return new IntervalSchedule(intervalSeconds, triggerAtStart, afterStartSeconds, exitCondition);
  }

  @Override
  public IntervalSchedule withExitCondition(ExitCondition exitCondition) {
    return new IntervalSchedule(intervalSeconds, triggerAtStart, afterStartSeconds, exitCondition);
  }
}
