package io.flexscheduler;

import java.util.Optional;

/** Exception thrown when a job definition cannot be read or a schedule cannot be run. */
public final class SchedulerException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input, if any. */
  private final String input;

  private SchedulerException(ErrorKind kind, String message, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new format error.
   *
   * @param message the error message
   * @param input the input that could not be read (may be null)
   * @return a new SchedulerException for a format error
   */
  public static SchedulerException format(String message, String input) {
    return new SchedulerException(ErrorKind.FORMAT, message, input, null);
  }

  /**
   * Creates a new format error caused by a lower-level failure.
   *
   * @param message the error message
   * @param input the input that could not be read (may be null)
   * @param cause the underlying failure
   * @return a new SchedulerException for a format error
   */
  public static SchedulerException format(String message, String input, Throwable cause) {
    return new SchedulerException(ErrorKind.FORMAT, message, input, cause);
  }

  /**
   * Creates a new unsupported-schedule error.
   *
   * @param message the error message
   * @return a new SchedulerException for an unsupported schedule
   */
  public static SchedulerException unsupportedSchedule(String message) {
    return new SchedulerException(ErrorKind.UNSUPPORTED_SCHEDULE, message, null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the input that caused the error, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }
}
