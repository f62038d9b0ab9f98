package io.flexscheduler.stream;

import static org.junit.jupiter.api.Assertions.*;

import io.flexscheduler.SchedulerException;
import io.flexscheduler.clock.VirtualClock;
import io.flexscheduler.model.ExitCondition;
import io.flexscheduler.model.FixedWeeklySchedule;
import io.flexscheduler.model.IntervalSchedule;
import io.flexscheduler.model.Job;
import io.flexscheduler.model.TimeOfDay;
import io.flexscheduler.model.TriggerEvent;
import io.flexscheduler.model.WeeklySlot;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TriggerFeedTest {

  // a Friday
  private static final Instant T0 = Instant.parse("2026-02-06T12:00:00Z");

  private static Job intervalJob() {
    return Job.definition(
        "poll",
        IntervalSchedule.every(120)
            .withExitCondition(ExitCondition.tillTime(T0.plus(Duration.ofMinutes(10)))));
  }

  private static Job weeklyJob() {
    return Job.definition(
        "report",
        FixedWeeklySchedule.at(WeeklySlot.daily(new TimeOfDay(12, 10)))
            .withExitCondition(ExitCondition.maxRun(1)));
  }

  @Test
  void testMergesEventsOfEveryJob() throws SchedulerException {
    VirtualClock clock = VirtualClock.startingAt(T0);
    RecordingSink sink = new RecordingSink();
    TriggerFeed feed = TriggerFeed.of(List.of(intervalJob(), weeklyJob()), clock);
    assertEquals(2, feed.size());

    feed.subscribe(sink);
    for (int minutes : new int[] {2, 4, 6, 8, 11}) {
      clock.advanceTo(T0.plus(Duration.ofMinutes(minutes)));
    }

    List<String> keys = sink.events.stream().map(e -> e.job().key()).collect(Collectors.toList());
    assertEquals(5, keys.stream().filter("IntervalSchedule_poll"::equals).count());
    assertEquals(1, keys.stream().filter("FixedWeeklySchedule_report"::equals).count());
    assertEquals(1, sink.completions);

    Instant last = sink.events.get(sink.events.size() - 1).triggerTime();
    assertFalse(last.isBefore(T0.plus(Duration.ofMinutes(10))));
    assertFalse(clock.now().isAfter(T0.plus(Duration.ofMinutes(12))));
  }

  @Test
  void testEventsArriveInFiringOrder() throws SchedulerException {
    VirtualClock clock = VirtualClock.startingAt(T0);
    RecordingSink sink = new RecordingSink();
    Job fast =
        Job.definition(
            "fast", IntervalSchedule.every(30).withExitCondition(ExitCondition.maxRun(4)));
    Job slow =
        Job.definition(
            "slow", IntervalSchedule.every(50).withExitCondition(ExitCondition.maxRun(2)));
    TriggerFeed.of(List.of(fast, slow), clock).subscribe(sink);

    clock.runUntilIdle();

    List<Instant> times =
        sink.events.stream().map(TriggerEvent::triggerTime).collect(Collectors.toList());
    assertEquals(6, times.size());
    for (int i = 1; i < times.size(); i++) {
      assertFalse(times.get(i).isBefore(times.get(i - 1)));
    }
  }

  @Test
  void testEmptyFeedCompletesImmediately() {
    RecordingSink sink = new RecordingSink();
    Subscription subscription = TriggerFeed.merge(List.of()).subscribe(sink);
    assertEquals(1, sink.completions);
    assertFalse(subscription.isActive());
  }

  @Test
  void testCompletesOnlyAfterEverySequence() throws SchedulerException {
    VirtualClock clock = VirtualClock.startingAt(T0);
    RecordingSink sink = new RecordingSink();
    Job shortJob =
        Job.definition(
            "short", IntervalSchedule.every(1).withExitCondition(ExitCondition.maxRun(1)));
    Job longJob =
        Job.definition(
            "long", IntervalSchedule.every(100).withExitCondition(ExitCondition.maxRun(1)));
    TriggerFeed.of(List.of(shortJob, longJob), clock).subscribe(sink);

    clock.advanceBy(Duration.ofSeconds(10));
    assertEquals(0, sink.completions);
    clock.advanceBy(Duration.ofSeconds(100));
    assertEquals(1, sink.completions);
  }

  @Test
  void testCancelStopsEverySequence() throws SchedulerException {
    VirtualClock clock = VirtualClock.startingAt(T0);
    RecordingSink sink = new RecordingSink();
    Subscription subscription =
        TriggerFeed.of(List.of(intervalJob(), weeklyJob()), clock).subscribe(sink);
    assertEquals(2, clock.pendingTimers());

    subscription.cancel();

    assertFalse(subscription.isActive());
    assertEquals(0, clock.pendingTimers());
    clock.advanceBy(Duration.ofHours(1));
    assertTrue(sink.events.isEmpty());
    assertEquals(0, sink.completions);
  }
}
