package io.flexscheduler.stream;

import io.flexscheduler.model.TriggerEvent;
import java.util.ArrayList;
import java.util.List;

/** Collects everything a sequence delivers. */
final class RecordingSink implements TriggerSink {
  final List<TriggerEvent> events = new ArrayList<>();
  int completions;

  @Override
  public void onTrigger(TriggerEvent event) {
    events.add(event);
  }

  @Override
  public void onComplete() {
    completions++;
  }

  List<Integer> runCounts() {
    List<Integer> counts = new ArrayList<>();
    for (TriggerEvent event : events) {
      counts.add(event.runCount());
    }
    return counts;
  }
}
