package io.flexscheduler;

/** The type of error raised while building or reading schedules. */
public enum ErrorKind {
  /** Format error - a stored job definition cannot be read. */
  FORMAT("format"),
  /** Unsupported schedule - a job's schedule cannot be turned into a trigger sequence. */
  UNSUPPORTED_SCHEDULE("unsupported-schedule");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return value;
  }
}
