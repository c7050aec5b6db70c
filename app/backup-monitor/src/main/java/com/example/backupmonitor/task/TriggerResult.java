package com.example.backupmonitor.task;

/** Outcome of asking the scheduler to run a task now. */
public enum TriggerResult {
  ACCEPTED(null),
  BUSY("busy"),
  UNKNOWN_TASK("unknown_task"),
  DISABLED("disabled"),
  SHUTTING_DOWN("shutting_down");

  private final String reason;

  TriggerResult(String reason) {
    this.reason = reason;
  }

  public boolean accepted() {
    return this == ACCEPTED;
  }

  /** Machine-readable rejection reason, {@code null} when accepted. */
  public String reason() {
    return reason;
  }
}
