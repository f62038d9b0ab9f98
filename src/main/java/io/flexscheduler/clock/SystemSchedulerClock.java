package io.flexscheduler.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Production clock backed by the system clock and a ScheduledExecutorService. */
public final class SystemSchedulerClock implements SchedulerClock, AutoCloseable {

  private final Clock clock;
  private final ScheduledExecutorService executor;

  public SystemSchedulerClock(Clock clock, ScheduledExecutorService executor) {
    this.clock = Objects.requireNonNull(clock);
    this.executor = Objects.requireNonNull(executor);
  }

  /**
   * Creates a clock with its own pool of daemon timer threads.
   *
   * @param zone the zone for local times
   * @param timerThreads the number of timer threads
   * @return a new clock
   */
  public static SystemSchedulerClock create(ZoneId zone, int timerThreads) {
    return new SystemSchedulerClock(
        Clock.system(zone),
        Executors.newScheduledThreadPool(timerThreads, daemonThreads("flexscheduler-timer-")));
  }

  @Override
  public Instant now() {
    return clock.instant();
  }

  @Override
  public ZoneId zone() {
    return clock.getZone();
  }

  @Override
  public TimerHandle schedule(Runnable task, Duration delay) {
    ScheduledFuture<?> future = executor.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  /**
   * Returns a factory of named daemon threads.
   *
   * @param prefix the thread name prefix
   * @return the thread factory
   */
  public static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
