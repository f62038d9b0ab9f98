package io.flexscheduler.eval;

import io.flexscheduler.SchedulerException;
import io.flexscheduler.model.Job;
import io.flexscheduler.model.TriggerEvent;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Plans the triggers of a job without waiting for them.
 *
 * <p>The plan applies the same rules as a live trigger sequence, assuming every run fires exactly
 * on time: the start delay, the step of the schedule, and the exit condition checked before each
 * run against the time of the previous one.
 */
public final class TriggerPlanner {
  /** Maximum number of planned triggers returned by {@link #nextN}. */
  private static final int MAX_ITERATIONS = 10_000;

  private TriggerPlanner() {}

  /**
   * Returns a lazy stream of the triggers a job would produce when subscribed at {@code from}.
   *
   * @param job the job
   * @param from the subscription time
   * @return a stream of planned trigger events, finite only if the exit condition ends it
   * @throws SchedulerException if the job's schedule is unsupported
   */
  public static Stream<TriggerEvent> occurrences(Job job, ZonedDateTime from)
      throws SchedulerException {
    Cadence cadence = Cadence.of(job.schedule());
    Iterator<TriggerEvent> iterator =
        new Iterator<>() {
          private ZonedDateTime current = from;
          private int runCount = 1;
          private TriggerEvent next = null;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              if (ExitEvaluator.shouldContinue(
                  cadence.exitCondition(), runCount, current.toInstant())) {
                current =
                    current.plus(
                        runCount == 1 ? cadence.firstDelay(current) : cadence.nextDelay(current));
                next = new TriggerEvent(job, current.toInstant(), runCount);
                runCount++;
              } else {
                next = null;
              }
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return next != null;
          }

          @Override
          public TriggerEvent next() {
            computeNext();
            if (next == null) {
              throw new NoSuchElementException();
            }
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Returns the next n planned triggers.
   *
   * @param job the job
   * @param from the subscription time
   * @param n the number of triggers to compute
   * @return up to n planned trigger events
   * @throws SchedulerException if the job's schedule is unsupported
   */
  public static List<TriggerEvent> nextN(Job job, ZonedDateTime from, int n)
      throws SchedulerException {
    List<TriggerEvent> results = new ArrayList<>();
    occurrences(job, from).limit(Math.min(n, MAX_ITERATIONS)).forEach(results::add);
    return results;
  }

  /**
   * Returns a lazy stream of planned triggers where triggerTime &lt;= to.
   *
   * @param job the job
   * @param from the subscription time
   * @param to the end time (inclusive)
   * @return a stream of planned trigger events in the range
   * @throws SchedulerException if the job's schedule is unsupported
   */
  public static Stream<TriggerEvent> between(Job job, ZonedDateTime from, ZonedDateTime to)
      throws SchedulerException {
    return occurrences(job, from).takeWhile(e -> !e.triggerTime().isAfter(to.toInstant()));
  }
}
