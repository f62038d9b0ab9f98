package io.flexscheduler.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.flexscheduler.ErrorKind;
import io.flexscheduler.SchedulerException;
import io.flexscheduler.model.ExitCondition;
import io.flexscheduler.model.FixedWeeklySchedule;
import io.flexscheduler.model.IntervalSchedule;
import io.flexscheduler.model.Job;
import io.flexscheduler.model.TimeOfDay;
import io.flexscheduler.model.TriggerEvent;
import io.flexscheduler.model.Weekday;
import io.flexscheduler.model.WeeklySlot;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Tests for planned trigger times. */
class TriggerPlannerTest {

  private static final ZonedDateTime START = ZonedDateTime.parse("2026-02-06T12:00:00Z");

  private static List<Long> offsets(List<TriggerEvent> events) {
    return events.stream()
        .map(e -> e.triggerTime().getEpochSecond() - START.toEpochSecond())
        .collect(Collectors.toList());
  }

  @Test
  void testMaxRunPlan() throws SchedulerException {
    Job job =
        Job.definition(
            "tick", IntervalSchedule.every(1).withExitCondition(ExitCondition.maxRun(5)));
    List<TriggerEvent> plan = TriggerPlanner.nextN(job, START, 100);
    assertEquals(List.of(1L, 2L, 3L, 4L, 5L), offsets(plan));
    for (int i = 0; i < plan.size(); i++) {
      assertEquals(i + 1, plan.get(i).runCount());
    }
  }

  @Test
  void testTriggerAtStartUsesStartDelay() throws SchedulerException {
    Job job =
        Job.definition(
            "tick",
            IntervalSchedule.every(60).withTriggerAtStart(true).withAfterStartSeconds(5));
    assertEquals(List.of(5L, 65L, 125L), offsets(TriggerPlanner.nextN(job, START, 3)));
  }

  @Test
  void testTillTimePlan() throws SchedulerException {
    Instant till = START.toInstant().plusSeconds(360);
    Job job =
        Job.definition(
            "tick", IntervalSchedule.every(120).withExitCondition(ExitCondition.tillTime(till)));
    assertEquals(List.of(120L, 240L, 360L), offsets(TriggerPlanner.nextN(job, START, 10)));
  }

  @Test
  void testWeeklyPlanVisitsEverySlot() throws SchedulerException {
    Job job =
        Job.definition(
            "weekly",
            FixedWeeklySchedule.at(
                WeeklySlot.on(Weekday.FRIDAY, new TimeOfDay(13, 30)),
                WeeklySlot.on(Weekday.MONDAY, new TimeOfDay(8, 0))));
    List<TriggerEvent> plan = TriggerPlanner.nextN(job, START, 4);
    assertEquals(
        List.of(
            Instant.parse("2026-02-06T13:30:00Z"),
            Instant.parse("2026-02-09T08:00:00Z"),
            Instant.parse("2026-02-13T13:30:00Z"),
            Instant.parse("2026-02-16T08:00:00Z")),
        plan.stream().map(TriggerEvent::triggerTime).collect(Collectors.toList()));
  }

  @Test
  void testOccurrencesIsLazyForUnboundedJobs() throws SchedulerException {
    Job job = Job.definition("forever", IntervalSchedule.every(1));
    assertEquals(3, TriggerPlanner.occurrences(job, START).limit(3).count());
  }

  @Test
  void testNextNIsCapped() throws SchedulerException {
    Job job = Job.definition("forever", IntervalSchedule.every(1));
    assertEquals(10_000, TriggerPlanner.nextN(job, START, 50_000).size());
  }

  @Test
  void testBetweenIsInclusive() throws SchedulerException {
    Job job = Job.definition("tick", IntervalSchedule.every(60));
    List<TriggerEvent> events =
        TriggerPlanner.between(job, START, START.plusMinutes(3)).collect(Collectors.toList());
    assertEquals(List.of(60L, 120L, 180L), offsets(events));
  }

  @Test
  void testMaxRunZeroPlansNothing() throws SchedulerException {
    Job job =
        Job.definition(
            "never", IntervalSchedule.every(1).withExitCondition(ExitCondition.maxRun(0)));
    assertTrue(TriggerPlanner.nextN(job, START, 5).isEmpty());
  }

  @Test
  void testJobWithoutScheduleIsUnsupported() {
    SchedulerException e =
        assertThrows(
            SchedulerException.class,
            () -> TriggerPlanner.nextN(Job.definition("orphan", null), START, 1));
    assertEquals(ErrorKind.UNSUPPORTED_SCHEDULE, e.kind());
  }
}
