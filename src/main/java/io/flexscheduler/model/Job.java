package io.flexscheduler.model;

import java.util.Objects;

/**
 * A named job: a schedule plus the action it triggers.
 *
 * @param name the job name
 * @param schedule the schedule (may be null for a definition whose type was not recognized)
 * @param action the action (may be null for a definition-only job)
 */
public record Job(String name, JobSchedule schedule, JobAction action) {
  /** Validates the name. */
  public Job {
    Objects.requireNonNull(name, "name");
  }

  /**
   * Creates a job running a synchronous action.
   *
   * @param name the job name
   * @param schedule the schedule
   * @param action the action
   * @return a new job
   */
  public static Job of(String name, JobSchedule schedule, JobAction.Blocking action) {
    return new Job(name, schedule, JobAction.of(action));
  }

  /**
   * Creates a job running an asynchronous action.
   *
   * @param name the job name
   * @param schedule the schedule
   * @param action the action
   * @return a new job
   */
  public static Job async(String name, JobSchedule schedule, JobAction action) {
    return new Job(name, schedule, action);
  }

  /**
   * Creates a job without an action, as read from a stored definition.
   *
   * @param name the job name
   * @param schedule the schedule
   * @return a new job
   */
  public static Job definition(String name, JobSchedule schedule) {
    return new Job(name, schedule, null);
  }

  /**
   * Returns the registry key: the schedule type name and the job name joined by an underscore.
   *
   * @return the key
   */
  public String key() {
    return schedule == null ? name : schedule.typeName() + "_" + name;
  }

  /**
   * Returns a copy bound to the given action.
   *
   * @param action the action
   * @return a new job
   */
  public Job withAction(JobAction action) {
    return new Job(name, schedule, action);
  }

  @Override
  public String toString() {
    return "Job[" + key() + "]";
  }
}
