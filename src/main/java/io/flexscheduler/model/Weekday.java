package io.flexscheduler.model;

import java.util.Map;
import java.util.Optional;

/** Represents a day of the week. */
public enum Weekday {
  MONDAY("Monday"),
  TUESDAY("Tuesday"),
  WEDNESDAY("Wednesday"),
  THURSDAY("Thursday"),
  FRIDAY("Friday"),
  SATURDAY("Saturday"),
  SUNDAY("Sunday");

  private final String displayName;

  Weekday(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns the position of this day in the scheduling week (Sunday=0, Monday=1, ...,
   * Saturday=6). Week-second arithmetic is based on this ordinal.
   *
   * @return the week ordinal
   */
  public int weekOrdinal() {
    return switch (this) {
      case SUNDAY -> 0;
      case MONDAY -> 1;
      case TUESDAY -> 2;
      case WEDNESDAY -> 3;
      case THURSDAY -> 4;
      case FRIDAY -> 5;
      case SATURDAY -> 6;
    };
  }

  /**
   * Returns the capitalized English name, as written in job definitions.
   *
   * @return the display name
   */
  public String displayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("monday", MONDAY), Map.entry("mon", MONDAY),
          Map.entry("tuesday", TUESDAY), Map.entry("tue", TUESDAY),
          Map.entry("wednesday", WEDNESDAY), Map.entry("wed", WEDNESDAY),
          Map.entry("thursday", THURSDAY), Map.entry("thu", THURSDAY),
          Map.entry("friday", FRIDAY), Map.entry("fri", FRIDAY),
          Map.entry("saturday", SATURDAY), Map.entry("sat", SATURDAY),
          Map.entry("sunday", SUNDAY), Map.entry("sun", SUNDAY));

  /**
   * Parses a weekday name (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase()));
  }

  /**
   * Returns a Weekday from its week ordinal.
   *
   * @param ordinal the week ordinal (Sunday=0 to Saturday=6)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromWeekOrdinal(int ordinal) {
    if (ordinal < 0 || ordinal > 6) {
      return Optional.empty();
    }
    return Optional.of(ordinal == 0 ? SUNDAY : values()[ordinal - 1]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(java.time.DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }
}
