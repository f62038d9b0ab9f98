package io.flexscheduler.display;

import io.flexscheduler.model.ExitCondition;
import io.flexscheduler.model.FixedWeeklySchedule;
import io.flexscheduler.model.IntervalSchedule;
import io.flexscheduler.model.JobSchedule;
import io.flexscheduler.model.WeeklySlot;
import java.util.stream.Collectors;

/** Renders schedules as canonical strings. */
public final class Display {
  private Display() {}

  /**
   * Renders a schedule as a canonical string, for example {@code "every 120s, at start after 5s,
   * max 3 runs"} or {@code "at Friday 09:30:00, daily 18:00:00, until 2026-03-01T00:00:00Z"}.
   *
   * @param schedule the schedule to render (may be null)
   * @return the canonical string representation
   */
  public static String render(JobSchedule schedule) {
    if (schedule == null) {
      return "no schedule";
    }
    StringBuilder sb = new StringBuilder();

    if (schedule instanceof IntervalSchedule is) {
      sb.append(String.format("every %ds", is.intervalSeconds()));
    } else if (schedule instanceof FixedWeeklySchedule fw) {
      sb.append("at ");
      sb.append(fw.slots().stream().map(WeeklySlot::toString).collect(Collectors.joining(", ")));
    }

    if (schedule.triggerAtStart()) {
      sb.append(", at start");
      if (schedule.afterStartSeconds() > 0) {
        sb.append(String.format(" after %ds", schedule.afterStartSeconds()));
      }
    }

    String exit = renderExit(schedule.exitCondition());
    if (!exit.isEmpty()) {
      sb.append(", ").append(exit);
    }

    return sb.toString();
  }

  private static String renderExit(ExitCondition exit) {
    return switch (exit.kind()) {
      case UNBOUNDED -> "";
      case MAX_RUN -> exit.maxRun() == 1 ? "once" : String.format("max %d runs", exit.maxRun());
      case TILL_TIME -> "until " + exit.tillTime();
    };
  }
}
