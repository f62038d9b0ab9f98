package io.flexscheduler.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.flexscheduler.model.ExitCondition;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ExitEvaluatorTest {

  private static final Instant T0 = Instant.parse("2026-02-06T12:00:00Z");

  @Test
  void testUnboundedAlwaysContinues() {
    assertTrue(ExitEvaluator.shouldContinue(null, 1_000_000, T0));
    assertTrue(ExitEvaluator.shouldContinue(ExitCondition.unbounded(), 1_000_000, T0));
  }

  @Test
  void testMaxRunAllowsExactlyThatManyRuns() {
    ExitCondition exit = ExitCondition.maxRun(5);
    assertTrue(ExitEvaluator.shouldContinue(exit, 1, T0));
    assertTrue(ExitEvaluator.shouldContinue(exit, 5, T0));
    assertFalse(ExitEvaluator.shouldContinue(exit, 6, T0));
  }

  @Test
  void testMaxRunAtIntegerLimit() {
    ExitCondition exit = ExitCondition.maxRun(Integer.MAX_VALUE);
    assertTrue(ExitEvaluator.shouldContinue(exit, 1, T0));
    assertTrue(ExitEvaluator.shouldContinue(exit, Integer.MAX_VALUE, T0));
  }

  @Test
  void testMaxRunZeroAllowsNothing() {
    assertFalse(ExitEvaluator.shouldContinue(ExitCondition.maxRun(0), 1, T0));
  }

  @Test
  void testTillTimeStopsOneSecondEarly() {
    ExitCondition exit = ExitCondition.tillTime(T0.plusSeconds(360));
    assertTrue(ExitEvaluator.shouldContinue(exit, 3, T0.plusSeconds(240)));
    assertTrue(ExitEvaluator.shouldContinue(exit, 3, T0.plusSeconds(359)));
    assertFalse(ExitEvaluator.shouldContinue(exit, 4, T0.plusMillis(359_500)));
    assertFalse(ExitEvaluator.shouldContinue(exit, 4, T0.plusSeconds(360)));
  }

  @Test
  void testMaxRunTakesPriorityOverTillTime() {
    ExitCondition both = new ExitCondition(2, T0.minusSeconds(3600));
    // the time limit has long passed but only the run limit is consulted
    assertTrue(ExitEvaluator.shouldContinue(both, 2, T0));
    assertFalse(ExitEvaluator.shouldContinue(both, 3, T0));
  }
}
