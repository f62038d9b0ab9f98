package io.flexscheduler.stream;

import io.flexscheduler.model.TriggerEvent;

/**
 * Receives trigger events. A sink attached to a merged feed may be called concurrently from the
 * timer contexts of different jobs.
 */
@FunctionalInterface
public interface TriggerSink {

  /**
   * Called once per trigger.
   *
   * @param event the trigger event
   */
  void onTrigger(TriggerEvent event);

  /** Called once when the source ends on its own. Not called after cancellation. */
  default void onComplete() {}
}
