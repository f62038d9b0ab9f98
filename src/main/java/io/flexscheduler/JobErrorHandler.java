package io.flexscheduler;

import io.flexscheduler.model.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Receives failures of job actions. A failure never reaches the trigger feed or other jobs. */
@FunctionalInterface
public interface JobErrorHandler {

  /**
   * Called when a job action throws or its completion stage fails.
   *
   * @param event the trigger that ran the action
   * @param error the failure
   */
  void onError(TriggerEvent event, Throwable error);

  /**
   * Returns a handler that logs failures at error level.
   *
   * @return the logging handler
   */
  static JobErrorHandler logging() {
    Logger log = LoggerFactory.getLogger(JobErrorHandler.class);
    return (event, error) ->
        log.error(
            "Job {} failed on run {} triggered at {}",
            event.job().key(),
            event.runCount(),
            event.triggerTime(),
            error);
  }
}
