package io.flexscheduler.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Unit tests for the schedule data model. */
public class ModelTest {

  @Test
  void testTimeOfDayAcceptsInclusiveUpperBounds() {
    TimeOfDay t = new TimeOfDay(24, 60, 60);
    assertEquals(24 * 3600 + 60 * 60 + 60, t.secondOfDay());
  }

  @Test
  void testTimeOfDayRejectsOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> new TimeOfDay(25, 0));
    assertThrows(IllegalArgumentException.class, () -> new TimeOfDay(-1, 0));
    assertThrows(IllegalArgumentException.class, () -> new TimeOfDay(10, 61));
    assertThrows(IllegalArgumentException.class, () -> new TimeOfDay(10, 0, 61));
    assertThrows(IllegalArgumentException.class, () -> new TimeOfDay(10, 0, -1));
  }

  @Test
  void testTimeOfDayDefaultsSecond() {
    TimeOfDay t = new TimeOfDay(9, 30);
    assertEquals(0, t.second());
    assertEquals("09:30:00", t.toString());
  }

  @Test
  void testWeekdayOrdinalStartsOnSunday() {
    assertEquals(0, Weekday.SUNDAY.weekOrdinal());
    assertEquals(1, Weekday.MONDAY.weekOrdinal());
    assertEquals(6, Weekday.SATURDAY.weekOrdinal());
    for (Weekday day : Weekday.values()) {
      assertEquals(day, Weekday.fromWeekOrdinal(day.weekOrdinal()).orElseThrow());
    }
    assertTrue(Weekday.fromWeekOrdinal(7).isEmpty());
  }

  @Test
  void testWeekdayParse() {
    assertEquals(Weekday.FRIDAY, Weekday.parse("Friday").orElseThrow());
    assertEquals(Weekday.MONDAY, Weekday.parse("mon").orElseThrow());
    assertTrue(Weekday.parse("someday").isEmpty());
  }

  @Test
  void testExitConditionKind() {
    assertEquals(ExitCondition.Kind.UNBOUNDED, ExitCondition.unbounded().kind());
    assertEquals(ExitCondition.Kind.MAX_RUN, ExitCondition.maxRun(3).kind());
    assertEquals(ExitCondition.Kind.TILL_TIME, ExitCondition.tillTime(Instant.EPOCH).kind());
    // both present: the run limit wins
    assertEquals(ExitCondition.Kind.MAX_RUN, new ExitCondition(3, Instant.EPOCH).kind());
    assertThrows(IllegalArgumentException.class, () -> ExitCondition.maxRun(-1));
  }

  @Test
  void testScheduleValidation() {
    assertThrows(IllegalArgumentException.class, () -> IntervalSchedule.every(0));
    assertThrows(
        IllegalArgumentException.class, () -> IntervalSchedule.every(10).withAfterStartSeconds(-1));
    assertThrows(
        IllegalArgumentException.class,
        () -> new FixedWeeklySchedule(List.of(), false, 0, null));
  }

  @Test
  void testScheduleDefaultsExitConditionToUnbounded() {
    IntervalSchedule s = new IntervalSchedule(10, false, 0, null);
    assertEquals(ExitCondition.unbounded(), s.exitCondition());
  }

  @Test
  void testWithersKeepOtherFields() {
    IntervalSchedule s =
        IntervalSchedule.every(120)
            .withTriggerAtStart(true)
            .withAfterStartSeconds(5)
            .withExitCondition(ExitCondition.maxRun(2));
    assertEquals(new IntervalSchedule(120, true, 5, ExitCondition.maxRun(2)), s);
  }

  @Test
  void testJobKeyJoinsTypeAndName() {
    Job interval = Job.definition("Report", IntervalSchedule.every(60));
    Job weekly =
        Job.definition(
            "Report", FixedWeeklySchedule.at(WeeklySlot.daily(new TimeOfDay(8, 0))));
    assertEquals("IntervalSchedule_Report", interval.key());
    assertEquals("FixedWeeklySchedule_Report", weekly.key());
    assertEquals("Orphan", Job.definition("Orphan", null).key());
  }

  @Test
  void testTriggerEventRunCountIsOneBased() {
    Job job = Job.definition("x", IntervalSchedule.every(1));
    assertThrows(IllegalArgumentException.class, () -> new TriggerEvent(job, Instant.EPOCH, 0));
  }
}
