package io.flexscheduler.model;

/**
 * Sealed interface for job schedules.
 *
 * <p>There are 2 types of schedules:
 *
 * <ul>
 *   <li>{@link IntervalSchedule} - "every 120 seconds"
 *   <li>{@link FixedWeeklySchedule} - "every friday at 09:30 and every day at 18:00"
 * </ul>
 *
 * <p>All schedules share the start behaviour ({@link #triggerAtStart()}, {@link
 * #afterStartSeconds()}) and an {@link ExitCondition}.
 */
public sealed interface JobSchedule permits IntervalSchedule, FixedWeeklySchedule {

  /**
   * Returns the variant name. It is used as the persisted discriminator and as part of the job
   * key.
   *
   * @return the variant name
   */
  String typeName();

  /**
   * Whether the first run fires after {@link #afterStartSeconds()} instead of waiting a full step.
   * The run at start counts as run 1.
   *
   * @return true to trigger at start
   */
  boolean triggerAtStart();

  /**
   * Returns the delay before the first run when {@link #triggerAtStart()} is set.
   *
   * @return the delay in seconds
   */
  int afterStartSeconds();

  /**
   * Returns the exit condition, never null.
   *
   * @return the exit condition
   */
  ExitCondition exitCondition();

  /**
   * Returns a copy with the specified trigger-at-start flag.
   *
   * @param triggerAtStart the flag
   * @return a new schedule
   */
  JobSchedule withTriggerAtStart(boolean triggerAtStart);

  /**
   * Returns a copy with the specified start delay.
   *
   * @param afterStartSeconds the delay in seconds
   * @return a new schedule
   */
  JobSchedule withAfterStartSeconds(int afterStartSeconds);

  /**
   * Returns a copy with the specified exit condition.
   *
   * @param exitCondition the exit condition
   * @return a new schedule
   */
  JobSchedule withExitCondition(ExitCondition exitCondition);
}
