package io.flexscheduler.clock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * A clock that only moves when told to.
 *
 * <p>Timers run on the thread that advances the clock, in due-time order, with the clock set to
 * each timer's due time while it runs. Timers armed while advancing run in the same pass if they
 * fall due before the target.
 */
public final class VirtualClock implements SchedulerClock {
  /** Maximum timers run by a single {@link #runUntilIdle()} call. */
  private static final int MAX_TASKS = 1_000_000;

  private static final Comparator<Timer> DUE_ORDER =
      Comparator.comparing((Timer t) -> t.due).thenComparingLong(t -> t.sequence);

  private final Object lock = new Object();
  private final PriorityQueue<Timer> queue = new PriorityQueue<>(DUE_ORDER);
  private final ZoneId zone;
  private Instant now;
  private long sequence;

  public VirtualClock(Instant start, ZoneId zone) {
    this.now = Objects.requireNonNull(start);
    this.zone = Objects.requireNonNull(zone);
  }

  /**
   * Creates a virtual clock in UTC.
   *
   * @param start the initial time
   * @return a new virtual clock
   */
  public static VirtualClock startingAt(Instant start) {
    return new VirtualClock(start, ZoneId.of("UTC"));
  }

  @Override
  public Instant now() {
    synchronized (lock) {
      return now;
    }
  }

  @Override
  public ZoneId zone() {
    return zone;
  }

  @Override
  public TimerHandle schedule(Runnable task, Duration delay) {
    synchronized (lock) {
      Instant due = delay.isNegative() ? now : now.plus(delay);
      Timer timer = new Timer(task, due, sequence++);
      queue.add(timer);
      return timer;
    }
  }

  /**
   * Moves the clock forward by the given amount, running every timer that falls due.
   *
   * @param delta the amount of time to advance
   */
  public void advanceBy(Duration delta) {
    advanceTo(now().plus(delta));
  }

  /**
   * Moves the clock to the given instant, running every timer that falls due.
   *
   * @param target the new time, not before the current time
   */
  public void advanceTo(Instant target) {
    synchronized (lock) {
      if (target.isBefore(now)) {
        throw new IllegalArgumentException("cannot move clock back from " + now + " to " + target);
      }
    }
    Timer timer;
    while ((timer = pollDue(target)) != null) {
      timer.task.run();
    }
    synchronized (lock) {
      if (now.isBefore(target)) {
        now = target;
      }
    }
  }

  /**
   * Runs timers in due order until none are pending, advancing the clock to each one.
   *
   * @throws IllegalStateException if the timers never run out
   */
  public void runUntilIdle() {
    for (int i = 0; i < MAX_TASKS; i++) {
      Timer timer = pollDue(null);
      if (timer == null) {
        return;
      }
      timer.task.run();
    }
    throw new IllegalStateException("still busy after " + MAX_TASKS + " timers");
  }

  /**
   * Returns the number of timers waiting to run.
   *
   * @return the pending timer count
   */
  public int pendingTimers() {
    synchronized (lock) {
      return queue.size();
    }
  }

  private Timer pollDue(Instant limit) {
    synchronized (lock) {
      Timer head = queue.peek();
      if (head == null || (limit != null && head.due.isAfter(limit))) {
        return null;
      }
      queue.poll();
      if (head.due.isAfter(now)) {
        now = head.due;
      }
      return head;
    }
  }

  private final class Timer implements TimerHandle {
    private final Runnable task;
    private final Instant due;
    private final long sequence;

    private Timer(Runnable task, Instant due, long sequence) {
      this.task = task;
      this.due = due;
      this.sequence = sequence;
    }

    @Override
    public boolean cancel() {
      synchronized (lock) {
        return queue.remove(this);
      }
    }
  }
}
