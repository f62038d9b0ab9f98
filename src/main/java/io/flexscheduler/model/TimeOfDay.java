package io.flexscheduler.model;

/**
 * Represents a time of day (hour, minute and second).
 *
 * <p>The upper bounds are inclusive: an hour of 24 and a minute or second of 60 are accepted and
 * simply roll over when converted to seconds.
 *
 * @param hour the hour (0-24)
 * @param minute the minute (0-60)
 * @param second the second (0-60)
 */
public record TimeOfDay(int hour, int minute, int second) {
  /** Validates the components. */
  public TimeOfDay {
    if (hour < 0 || hour > 24) {
      throw new IllegalArgumentException("hour must be between 0 and 24, got " + hour);
    }
    if (minute < 0 || minute > 60) {
      throw new IllegalArgumentException("minute must be between 0 and 60, got " + minute);
    }
    if (second < 0 || second > 60) {
      throw new IllegalArgumentException("second must be between 0 and 60, got " + second);
    }
  }

  /**
   * Creates a time of day on the whole minute.
   *
   * @param hour the hour (0-24)
   * @param minute the minute (0-60)
   */
  public TimeOfDay(int hour, int minute) {
    this(hour, minute, 0);
  }

  /**
   * Returns the time as total seconds from midnight.
   *
   * @return total seconds from midnight
   */
  public int secondOfDay() {
    return hour * 3600 + minute * 60 + second;
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d:%02d", hour, minute, second);
  }
}
