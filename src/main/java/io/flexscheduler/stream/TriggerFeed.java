package io.flexscheduler.stream;

import io.flexscheduler.SchedulerException;
import io.flexscheduler.clock.SchedulerClock;
import io.flexscheduler.model.Job;
import io.flexscheduler.model.TriggerEvent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A fan-in of independent trigger sequences.
 *
 * <p>Every sequence delivers straight into the shared sink from its own timer context. Nothing is
 * buffered or reordered, so events of different jobs arrive in the order they fire, possibly
 * concurrently. Completion is signalled once every sequence has completed.
 */
public final class TriggerFeed {
  private final List<TriggerSequence> sequences;

  private TriggerFeed(List<TriggerSequence> sequences) {
    this.sequences = sequences;
  }

  /**
   * Merges the given sequences into one feed.
   *
   * @param sequences the sequences, each not yet subscribed
   * @return a new feed
   */
  public static TriggerFeed merge(List<TriggerSequence> sequences) {
    return new TriggerFeed(List.copyOf(sequences));
  }

  /**
   * Converts each job into a fresh sequence and merges them.
   *
   * @param jobs the jobs
   * @param clock the clock the sequences wait on
   * @return a new feed
   * @throws SchedulerException if any job's schedule is unsupported
   */
  public static TriggerFeed of(Collection<Job> jobs, SchedulerClock clock)
      throws SchedulerException {
    List<TriggerSequence> sequences = new ArrayList<>(jobs.size());
    for (Job job : jobs) {
      sequences.add(TriggerSequence.of(job, clock));
    }
    return new TriggerFeed(sequences);
  }

  /**
   * Returns the number of merged sequences.
   *
   * @return the sequence count
   */
  public int size() {
    return sequences.size();
  }

  /**
   * Subscribes the sink to every sequence. An empty feed completes immediately.
   *
   * @param sink the receiver of all events
   * @return a subscription that cancels every sequence
   */
  public Subscription subscribe(TriggerSink sink) {
    Merged merged = new Merged(sink, sequences.size());
    if (sequences.isEmpty()) {
      merged.completeOne();
      return merged;
    }
    for (TriggerSequence sequence : sequences) {
      merged.members.add(sequence.subscribe(merged));
    }
    return merged;
  }

  private static final class Merged implements Subscription, TriggerSink {
    private final List<Subscription> members = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicInteger remaining;
    private final TriggerSink sink;

    private Merged(TriggerSink sink, int size) {
      this.sink = sink;
      this.remaining = new AtomicInteger(Math.max(size, 1));
    }

    @Override
    public void onTrigger(TriggerEvent event) {
      sink.onTrigger(event);
    }

    @Override
    public void onComplete() {
      completeOne();
    }

    private void completeOne() {
      if (remaining.decrementAndGet() == 0
          && !cancelled.get()
          && completed.compareAndSet(false, true)) {
        sink.onComplete();
      }
    }

    @Override
    public void cancel() {
      cancelled.set(true);
      for (Subscription member : members) {
        member.cancel();
      }
    }

    @Override
    public boolean isActive() {
      return !cancelled.get() && !completed.get();
    }
  }
}
