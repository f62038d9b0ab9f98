package io.flexscheduler.stream;

import io.flexscheduler.SchedulerException;
import io.flexscheduler.clock.SchedulerClock;
import io.flexscheduler.clock.TimerHandle;
import io.flexscheduler.eval.Cadence;
import io.flexscheduler.eval.ExitEvaluator;
import io.flexscheduler.model.Job;
import io.flexscheduler.model.TriggerEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The timed trigger sequence of one job.
 *
 * <p>The sequence holds at most one armed timer. When it fires, the sequence builds the event for
 * the current run, decides with the exit condition whether another run follows, arms the timer
 * for that run, and only then hands the event to the sink. A slow or failing sink therefore never
 * delays or stops the job's own timing.
 *
 * <p>Cancelling a subscription waits for an event that is being delivered, so once {@link
 * Subscription#cancel()} returns the sink receives nothing more. A sink must therefore not block
 * on a thread that is cancelling its own subscription.
 *
 * <p>A sequence can be subscribed once. Convert the job again for a fresh sequence.
 */
public final class TriggerSequence {
  private static final Logger LOG = LoggerFactory.getLogger(TriggerSequence.class);

  private final Job job;
  private final Cadence cadence;
  private final SchedulerClock clock;
  private final AtomicBoolean subscribed = new AtomicBoolean(false);

  private TriggerSequence(Job job, Cadence cadence, SchedulerClock clock) {
    this.job = job;
    this.cadence = cadence;
    this.clock = clock;
  }

  /**
   * Converts a job into a fresh trigger sequence.
   *
   * @param job the job
   * @param clock the clock the sequence waits on
   * @return a new, unsubscribed sequence
   * @throws SchedulerException if the job's schedule is unsupported
   */
  public static TriggerSequence of(Job job, SchedulerClock clock) throws SchedulerException {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(clock, "clock");
    return new TriggerSequence(job, Cadence.of(job.schedule()), clock);
  }

  /**
   * Returns the job this sequence triggers.
   *
   * @return the job
   */
  public Job job() {
    return job;
  }

  /**
   * Starts the sequence. The first timer is armed relative to the clock's current time.
   *
   * @param sink the receiver of the events
   * @return the subscription
   * @throws IllegalStateException if the sequence was already subscribed
   */
  public Subscription subscribe(TriggerSink sink) {
    Objects.requireNonNull(sink, "sink");
    if (!subscribed.compareAndSet(false, true)) {
      throw new IllegalStateException("trigger sequence of " + job.key() + " already subscribed");
    }
    Run run = new Run(sink);
    run.begin();
    return run;
  }

  private final class Run implements Subscription {
    private final Object lock = new Object();
    private final TriggerSink sink;
    private TimerHandle pending;
    private boolean cancelled;
    private boolean done;

    private Run(TriggerSink sink) {
      this.sink = sink;
    }

    private void begin() {
      Instant now = clock.now();
      if (ExitEvaluator.shouldContinue(cadence.exitCondition(), 1, now)) {
        Duration delay = cadence.firstDelay(now.atZone(clock.zone()));
        LOG.debug("{} run 1 armed in {}", job.key(), delay);
        arm(1, delay);
      } else {
        complete();
      }
    }

    private void arm(int runCount, Duration delay) {
      synchronized (lock) {
        if (cancelled) {
          return;
        }
        pending = clock.schedule(() -> fire(runCount), delay);
      }
    }

    private void fire(int runCount) {
      synchronized (lock) {
        if (cancelled) {
          return;
        }
        pending = null;
      }
      Instant now = clock.now();
      TriggerEvent event = new TriggerEvent(job, now, runCount);
      boolean more = ExitEvaluator.shouldContinue(cadence.exitCondition(), runCount + 1, now);
      if (more) {
        arm(runCount + 1, cadence.nextDelay(now.atZone(clock.zone())));
      }
      // delivery holds the lock, so cancel() returns only once no event is in flight
      synchronized (lock) {
        if (cancelled) {
          return;
        }
        try {
          sink.onTrigger(event);
        } catch (RuntimeException e) {
          LOG.warn("Sink failed on {} run {}", job.key(), runCount, e);
        }
      }
      if (!more) {
        complete();
      }
    }

    private void complete() {
      synchronized (lock) {
        if (cancelled || done) {
          return;
        }
        done = true;
      }
      LOG.debug("{} trigger sequence completed", job.key());
      try {
        sink.onComplete();
      } catch (RuntimeException e) {
        LOG.warn("Sink failed on completion of {}", job.key(), e);
      }
    }

    /**
     * Cancels the pending timer. If an event is being delivered on another thread, waits until
     * the sink has returned; a timer that already fired but has not yet delivered delivers
     * nothing.
     */
    @Override
    public void cancel() {
      synchronized (lock) {
        if (cancelled) {
          return;
        }
        cancelled = true;
        if (pending != null) {
          pending.cancel();
          pending = null;
        }
      }
      LOG.debug("{} trigger sequence cancelled", job.key());
    }

    @Override
    public boolean isActive() {
      synchronized (lock) {
        return !cancelled && !done;
      }
    }
  }
}
