package io.flexscheduler.eval;

import io.flexscheduler.SchedulerException;
import io.flexscheduler.model.ExitCondition;
import io.flexscheduler.model.FixedWeeklySchedule;
import io.flexscheduler.model.IntervalSchedule;
import io.flexscheduler.model.JobSchedule;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.function.Function;

/**
 * The step arithmetic of a schedule: how long to wait before the first run and between runs.
 *
 * <p>An interval schedule has a fixed step. A fixed weekly schedule recomputes its step from the
 * current time before every run, because its slots are not evenly spaced.
 */
public final class Cadence {
  private final JobSchedule schedule;
  private final Function<ZonedDateTime, Duration> step;

  private Cadence(JobSchedule schedule, Function<ZonedDateTime, Duration> step) {
    this.schedule = schedule;
    this.step = step;
  }

  /**
   * Builds the cadence of a schedule.
   *
   * @param schedule the schedule
   * @return the cadence
   * @throws SchedulerException if the schedule is null or of an unsupported type
   */
  public static Cadence of(JobSchedule schedule) throws SchedulerException {
    if (schedule instanceof IntervalSchedule is) {
      Duration interval = Duration.ofSeconds(is.intervalSeconds());
      return new Cadence(schedule, now -> interval);
    }
    if (schedule instanceof FixedWeeklySchedule fw) {
      return new Cadence(
          schedule, now -> Duration.ofSeconds(WeeklySlotCalculator.secondsToNext(fw.slots(), now)));
    }
    if (schedule == null) {
      throw SchedulerException.unsupportedSchedule("job has no schedule");
    }
    throw SchedulerException.unsupportedSchedule(
        schedule.getClass().getName() + " is not supported");
  }

  /**
   * Returns the wait before the first run: the start delay when the schedule triggers at start,
   * otherwise one full step.
   *
   * @param now the subscription time
   * @return the first delay
   */
  public Duration firstDelay(ZonedDateTime now) {
    if (schedule.triggerAtStart()) {
      return Duration.ofSeconds(schedule.afterStartSeconds());
    }
    return step.apply(now);
  }

  /**
   * Returns the wait between the run that just fired and the next one.
   *
   * @param now the time the previous run fired
   * @return the next delay
   */
  public Duration nextDelay(ZonedDateTime now) {
    return step.apply(now);
  }

  /**
   * Returns the schedule's exit condition.
   *
   * @return the exit condition
   */
  public ExitCondition exitCondition() {
    return schedule.exitCondition();
  }
}
