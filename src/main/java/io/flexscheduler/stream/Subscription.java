package io.flexscheduler.stream;

/** A live attachment of a sink to a trigger source. Closing it cancels it. */
public interface Subscription extends AutoCloseable {

  /** Cancels every pending timer of the source. Idempotent. */
  void cancel();

  /**
   * Whether the source may still deliver events.
   *
   * @return false once cancelled or completed
   */
  boolean isActive();

  @Override
  default void close() {
    cancel();
  }
}
