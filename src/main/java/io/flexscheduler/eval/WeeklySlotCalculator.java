package io.flexscheduler.eval;

import io.flexscheduler.model.Weekday;
import io.flexscheduler.model.WeeklySlot;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the distance to the closest upcoming weekly slot.
 *
 * <h2>Week Seconds</h2>
 *
 * <p>Instants and slots are placed on a single seven-day axis:
 *
 * <p>Formula: weekSecond = weekOrdinal * 86400 + hour * 3600 + minute * 60 + second
 *
 * <p>where weekOrdinal runs from Sunday=0 to Saturday=6. A slot without a weekday is placed on
 * the current weekday.
 *
 * <h2>Slot Order</h2>
 *
 * <p>Slots are scanned ordered by weekday (daily slots first) and then by hour only. The first
 * slot in scan order that lies after the current week second wins, so the scan order decides
 * between slots that are not ordered by minute or second.
 *
 * <h2>Boundary</h2>
 *
 * <p>The comparison is strict: a slot exactly at the current second has just fired and is not
 * selected again. The result is therefore never zero, so a sequence re-arming at a slot's own
 * instant moves on to the next slot instead of firing twice, and other slots of the week are not
 * skipped.
 *
 * <h2>Wraparound</h2>
 *
 * <p>When no slot is ahead in the current week, the distance wraps to the earliest slot of the
 * next week: {@code WEEK_SECONDS - curr + min}.
 */
public final class WeeklySlotCalculator {
  /** Seconds in one day. */
  public static final long DAY_SECONDS = 86_400L;

  /** Seconds in the full weekly cycle. */
  public static final long WEEK_SECONDS = 7 * DAY_SECONDS;

  private static final Comparator<WeeklySlot> SLOT_ORDER =
      Comparator.comparing(
              WeeklySlot::dayOfWeek,
              Comparator.nullsFirst(Comparator.comparingInt(Weekday::weekOrdinal)))
          .thenComparingInt(slot -> slot.timeOfDay().hour());

  private WeeklySlotCalculator() {}

  /**
   * Returns the number of seconds from {@code now} until the closest upcoming slot.
   *
   * @param slots the weekly slots, must not be empty
   * @param now the reference time, in the zone the slots are expressed in
   * @return the distance in seconds, always greater than zero
   */
  public static long secondsToNext(List<WeeklySlot> slots, ZonedDateTime now) {
    if (slots.isEmpty()) {
      throw new IllegalArgumentException("slots must not be empty");
    }
    int today = Weekday.fromDayOfWeek(now.getDayOfWeek()).weekOrdinal();
    long curr = weekSecond(today, now.getHour() * 3600 + now.getMinute() * 60 + now.getSecond());

    long min = Long.MAX_VALUE;
    long diff = -1;
    for (WeeklySlot slot : slots.stream().sorted(SLOT_ORDER).toList()) {
      int day = slot.dayOfWeek() != null ? slot.dayOfWeek().weekOrdinal() : today;
      long expected = weekSecond(day, slot.timeOfDay().secondOfDay());
      min = Math.min(min, expected);
      if (diff < 0 && expected > curr) {
        diff = expected - curr;
      }
    }

    if (diff > 0) {
      return diff;
    }
    return WEEK_SECONDS - curr + min;
  }

  /**
   * Returns the position of a day and second-of-day on the weekly axis.
   *
   * @param weekOrdinal the week ordinal (Sunday=0)
   * @param secondOfDay the second of the day
   * @return the week second
   */
  public static long weekSecond(int weekOrdinal, int secondOfDay) {
    return weekOrdinal * DAY_SECONDS + secondOfDay;
  }
}
