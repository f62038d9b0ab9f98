package io.flexscheduler.eval;

import io.flexscheduler.model.ExitCondition;
import java.time.Instant;

/** Evaluates exit conditions. */
public final class ExitEvaluator {
  private ExitEvaluator() {}

  /**
   * Decides whether the run with ordinal {@code runCount} may be scheduled.
   *
   * <p>{@code now} is the time the decision is taken: the subscription instant for the first run,
   * otherwise the instant the previous run fired. A time limit stops one second early so that a
   * run landing exactly on the limit is the last one.
   *
   * @param exit the exit condition (null means unbounded)
   * @param runCount the 1-based ordinal of the run about to be scheduled
   * @param now the current time
   * @return true if the run may be scheduled
   */
  public static boolean shouldContinue(ExitCondition exit, int runCount, Instant now) {
    if (exit == null) {
      return true;
    }
    return switch (exit.kind()) {
      case UNBOUNDED -> true;
      case MAX_RUN -> runCount <= exit.maxRun();
      case TILL_TIME -> !now.isAfter(exit.tillTime().minusSeconds(1));
    };
  }
}
