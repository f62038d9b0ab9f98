package io.flexscheduler.model;

import java.util.List;

/**
 * A schedule that fires at fixed slots of the week.
 *
 * @param slots the weekly slots, in declaration order
 * @param triggerAtStart whether the first run fires after the start delay
 * @param afterStartSeconds the start delay in seconds
 * @param exitCondition the exit condition
 */
public record FixedWeeklySchedule(
    List<WeeklySlot> slots,
    boolean triggerAtStart,
    int afterStartSeconds,
    ExitCondition exitCondition)
    implements JobSchedule {

  /** The persisted type name. */
  public static final String TYPE_NAME = "FixedWeeklySchedule";

  /** Creates a new FixedWeeklySchedule with a defensive copy of the slots. */
  public FixedWeeklySchedule {
    if (slots == null || slots.isEmpty()) {
      throw new IllegalArgumentException("slots must not be empty");
    }
    slots = List.copyOf(slots);
    if (afterStartSeconds < 0) {
      throw new IllegalArgumentException(
          "afterStartSeconds must be >= 0, got " + afterStartSeconds);
    }
    exitCondition = exitCondition == null ? ExitCondition.unbounded() : exitCondition;
  }

  /**
   * Creates an unbounded schedule over the given slots.
   *
   * @param slots the slots
   * @return a new fixed weekly schedule
   */
  public static FixedWeeklySchedule at(WeeklySlot... slots) {
    return new FixedWeeklySchedule(List.of(slots), false, 0, ExitCondition.unbounded());
  }

  @Override
  public String typeName() {
    return TYPE_NAME;
  }

  @Override
  public FixedWeeklySchedule withTriggerAtStart(boolean triggerAtStart) {
    return new FixedWeeklySchedule(slots, triggerAtStart, afterStartSeconds, exitCondition);
  }

  @Override
  public FixedWeeklySchedule withAfterStartSeconds(int afterStartSeconds) {
    return new FixedWeeklySchedule(slots, triggerAtStart, afterStartSeconds, exitCondition);
  }

  @Override
  public FixedWeeklySchedule withExitCondition(ExitCondition exitCondition) {
    return new FixedWeeklySchedule(slots, triggerAtStart, afterStartSeconds, exitCondition);
  }
}
