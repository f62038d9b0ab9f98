package io.flexscheduler;

import io.flexscheduler.clock.SchedulerClock;
import io.flexscheduler.clock.SystemSchedulerClock;
import io.flexscheduler.config.SchedulerConfig;
import io.flexscheduler.config.SchedulerConfigLoader;
import io.flexscheduler.display.Display;
import io.flexscheduler.model.Job;
import io.flexscheduler.model.JobAction;
import io.flexscheduler.model.TriggerEvent;
import io.flexscheduler.stream.Subscription;
import io.flexscheduler.stream.TriggerFeed;
import io.flexscheduler.stream.TriggerSink;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point: a registry of jobs and the lifecycle of their merged trigger feed.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (Scheduler scheduler = Scheduler.create()) {
 *   scheduler
 *       .addJob(Job.of("report", IntervalSchedule.every(60), (at, run) -> sendReport()))
 *       .addJob(Job.of("backup", FixedWeeklySchedule.at(
 *           WeeklySlot.on(Weekday.SUNDAY, new TimeOfDay(3, 0))), (at, run) -> backup()))
 *       .start();
 *   awaitShutdown();
 * }
 * }</pre>
 *
 * <p>Jobs are registered before {@link #start()}. On start every job is converted into its own
 * trigger sequence and the sequences are merged into one feed. Each trigger is handed to the
 * dispatch executor, so an action never holds up the timers, and an action failure is reported to
 * the {@link JobErrorHandler} without affecting any sequence. Runs of the same job may overlap.
 */
public final class Scheduler implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Scheduler.class);

  private final Map<String, Job> jobs = Collections.synchronizedMap(new LinkedHashMap<>());
  private final SchedulerClock clock;
  private final Executor dispatchExecutor;
  private final JobErrorHandler errorHandler;
  private final Runnable releaseResources;

  private final Object lifecycle = new Object();
  private Subscription subscription;
  private boolean started;
  private boolean closed;

  /**
   * Creates a scheduler on caller-owned resources. Closing it leaves the clock and executor
   * running.
   *
   * @param clock the clock the trigger sequences wait on
   * @param dispatchExecutor the executor running job actions
   * @param errorHandler the receiver of action failures
   */
  public Scheduler(
      SchedulerClock clock, Executor dispatchExecutor, JobErrorHandler errorHandler) {
    this(clock, dispatchExecutor, errorHandler, () -> {});
  }

  private Scheduler(
      SchedulerClock clock,
      Executor dispatchExecutor,
      JobErrorHandler errorHandler,
      Runnable releaseResources) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    this.releaseResources = releaseResources;
  }

  /**
   * Creates a scheduler configured from {@code flexscheduler.properties}, or with defaults if
   * the file is absent.
   *
   * @return a new scheduler owning its clock and executor
   */
  public static Scheduler create() {
    return create(SchedulerConfigLoader.load());
  }

  /**
   * Creates a scheduler with its own wall clock and dispatch pool, both released by {@link
   * #close()}.
   *
   * @param config the configuration
   * @return a new scheduler owning its clock and executor
   */
  public static Scheduler create(SchedulerConfig config) {
    SystemSchedulerClock clock = SystemSchedulerClock.create(config.zone(), config.timerThreads());
    ExecutorService dispatch =
        config.dispatchThreads() == 0
            ? Executors.newCachedThreadPool(
                SystemSchedulerClock.daemonThreads("flexscheduler-dispatch-"))
            : Executors.newFixedThreadPool(
                config.dispatchThreads(),
                SystemSchedulerClock.daemonThreads("flexscheduler-dispatch-"));
    return new Scheduler(
        clock,
        dispatch,
        JobErrorHandler.logging(),
        () -> release(clock, dispatch, config.shutdownTimeout()));
  }

  /**
   * Registers a job under its key. If the key is already registered the call is ignored and the
   * first registration is kept.
   *
   * @param job the job
   * @return this scheduler
   */
  public Scheduler addJob(Job job) {
    Objects.requireNonNull(job, "job");
    if (jobs.putIfAbsent(job.key(), job) != null) {
      LOG.debug("Job {} already registered, keeping the first registration", job.key());
    } else {
      LOG.debug("Registered job {} ({})", job.key(), Display.render(job.schedule()));
    }
    return this;
  }

  /**
   * Starts every registered job. Calling it again while started has no effect.
   *
   * @return this scheduler
   * @throws SchedulerException if a job's schedule is unsupported; the scheduler stays stopped
   * @throws IllegalStateException if the scheduler is closed
   */
  public Scheduler start() throws SchedulerException {
    synchronized (lifecycle) {
      if (closed) {
        throw new IllegalStateException("scheduler is closed");
      }
      if (started) {
        return this;
      }
      TriggerFeed feed = TriggerFeed.of(jobs(), clock);
      subscription = feed.subscribe(new Dispatcher());
      started = true;
      LOG.info("Scheduler started with {} job(s)", feed.size());
    }
    return this;
  }

  /**
   * Cancels every pending trigger. A trigger being dispatched on a timer thread is waited for,
   * so no action is dispatched after this returns. Running actions are not interrupted. The
   * scheduler can be started again with the same jobs.
   */
  public void stop() {
    synchronized (lifecycle) {
      if (!started) {
        return;
      }
      subscription.cancel();
      subscription = null;
      started = false;
      LOG.info("Scheduler stopped");
    }
  }

  /** Stops the scheduler and releases the clock and executor it owns. */
  @Override
  public void close() {
    synchronized (lifecycle) {
      if (closed) {
        return;
      }
      stop();
      closed = true;
    }
    releaseResources.run();
  }

  /**
   * Whether the trigger feed is subscribed.
   *
   * @return true between {@link #start()} and {@link #stop()}
   */
  public boolean isStarted() {
    synchronized (lifecycle) {
      return started;
    }
  }

  /**
   * Returns the registered jobs in registration order.
   *
   * @return an immutable snapshot of the jobs
   */
  public List<Job> jobs() {
    synchronized (jobs) {
      return List.copyOf(jobs.values());
    }
  }

  /**
   * Returns the job registered under a key.
   *
   * @param key the job key
   * @return the job, or empty if none is registered
   */
  public Optional<Job> job(String key) {
    return Optional.ofNullable(jobs.get(key));
  }

  private void dispatch(TriggerEvent event) {
    JobAction action = event.job().action();
    if (action == null) {
      LOG.debug("{} has no action, run {} skipped", event.job().key(), event.runCount());
      return;
    }
    try {
      dispatchExecutor.execute(() -> invoke(action, event));
    } catch (RejectedExecutionException e) {
      report(event, e);
    }
  }

  private void invoke(JobAction action, TriggerEvent event) {
    LOG.trace("{} run {} at {}", event.job().key(), event.runCount(), event.triggerTime());
    CompletionStage<?> completion;
    try {
      completion = action.execute(event.triggerTime(), event.runCount());
    } catch (Exception e) {
      report(event, e);
      return;
    }
    if (completion != null) {
      completion.whenComplete(
          (ignored, failure) -> {
            if (failure != null) {
              report(event, unwrap(failure));
            }
          });
    }
  }

  private void report(TriggerEvent event, Throwable error) {
    try {
      errorHandler.onError(event, error);
    } catch (RuntimeException e) {
      LOG.error(
          "Error handler failed for {} run {}", event.job().key(), event.runCount(), e);
    }
  }

  private static Throwable unwrap(Throwable failure) {
    if ((failure instanceof CompletionException || failure instanceof ExecutionException)
        && failure.getCause() != null) {
      return failure.getCause();
    }
    return failure;
  }

  private static void release(
      SystemSchedulerClock clock, ExecutorService dispatch, Duration timeout) {
    clock.close();
    dispatch.shutdown();
    try {
      if (!dispatch.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("Job actions still running after {}, interrupting them", timeout);
        dispatch.shutdownNow();
      }
    } catch (InterruptedException e) {
      dispatch.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private final class Dispatcher implements TriggerSink {
    @Override
    public void onTrigger(TriggerEvent event) {
      dispatch(event);
    }

    @Override
    public void onComplete() {
      LOG.info("All trigger sequences completed");
    }
  }
}
