package io.flexscheduler.model;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * The work bound to a job. It is called with the trigger instant and the 1-based run count of the
 * job's sequence.
 *
 * <p>The returned stage signals completion of an asynchronous action; its value is ignored. A
 * synchronous action can be adapted with {@link #of(Blocking)}.
 */
@FunctionalInterface
public interface JobAction {

  /**
   * Runs the action.
   *
   * @param triggerTime the instant the trigger fired
   * @param runCount the 1-based run count
   * @return a stage that completes when the action is done, or null if it already is
   * @throws Exception if the action fails synchronously
   */
  CompletionStage<?> execute(Instant triggerTime, int runCount) throws Exception;

  /**
   * Adapts a synchronous action.
   *
   * @param action the synchronous action
   * @return an action whose completion stage is already complete
   */
  static JobAction of(Blocking action) {
    return (triggerTime, runCount) -> {
      action.execute(triggerTime, runCount);
      return CompletableFuture.completedFuture(null);
    };
  }

  /** A synchronous job action. */
  @FunctionalInterface
  interface Blocking {
    /**
     * Runs the action.
     *
     * @param triggerTime the instant the trigger fired
     * @param runCount the 1-based run count
     * @throws Exception if the action fails
     */
    void execute(Instant triggerTime, int runCount) throws Exception;
  }
}
