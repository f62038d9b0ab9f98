package io.flexscheduler.model;

import java.util.Objects;

/**
 * A recurring point in the seven-day cycle.
 *
 * @param dayOfWeek the day the slot is pinned to, or null for every day
 * @param timeOfDay the time of day
 */
public record WeeklySlot(Weekday dayOfWeek, TimeOfDay timeOfDay) {
  /** Validates the time of day. */
  public WeeklySlot {
    Objects.requireNonNull(timeOfDay, "timeOfDay");
  }

  /**
   * Creates a slot that fires every day at the given time.
   *
   * @param timeOfDay the time of day
   * @return a new daily slot
   */
  public static WeeklySlot daily(TimeOfDay timeOfDay) {
    return new WeeklySlot(null, timeOfDay);
  }

  /**
   * Creates a slot pinned to a weekday.
   *
   * @param day the weekday
   * @param timeOfDay the time of day
   * @return a new weekly slot
   */
  public static WeeklySlot on(Weekday day, TimeOfDay timeOfDay) {
    return new WeeklySlot(Objects.requireNonNull(day, "day"), timeOfDay);
  }

  @Override
  public String toString() {
    return dayOfWeek == null ? "daily " + timeOfDay : dayOfWeek + " " + timeOfDay;
  }
}
