package io.flexscheduler.display;

import static org.junit.jupiter.api.Assertions.*;

import io.flexscheduler.model.ExitCondition;
import io.flexscheduler.model.FixedWeeklySchedule;
import io.flexscheduler.model.IntervalSchedule;
import io.flexscheduler.model.TimeOfDay;
import io.flexscheduler.model.Weekday;
import io.flexscheduler.model.WeeklySlot;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DisplayTest {

  @Test
  void testRendersInterval() {
    assertEquals("every 60s", Display.render(IntervalSchedule.every(60)));
    assertEquals(
        "every 120s, at start after 5s, max 3 runs",
        Display.render(
            IntervalSchedule.every(120)
                .withTriggerAtStart(true)
                .withAfterStartSeconds(5)
                .withExitCondition(ExitCondition.maxRun(3))));
    assertEquals(
        "every 10s, at start, once",
        Display.render(
            IntervalSchedule.every(10)
                .withTriggerAtStart(true)
                .withExitCondition(ExitCondition.maxRun(1))));
  }

  @Test
  void testRendersWeekly() {
    FixedWeeklySchedule schedule =
        FixedWeeklySchedule.at(
                WeeklySlot.on(Weekday.FRIDAY, new TimeOfDay(9, 30)),
                WeeklySlot.daily(new TimeOfDay(18, 0)))
            .withExitCondition(ExitCondition.tillTime(Instant.parse("2026-03-01T00:00:00Z")));
    assertEquals(
        "at Friday 09:30:00, daily 18:00:00, until 2026-03-01T00:00:00Z",
        Display.render(schedule));
  }

  @Test
  void testRendersMissingSchedule() {
    assertEquals("no schedule", Display.render(null));
  }
}
