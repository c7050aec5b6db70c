package com.example.backupmonitor.task;

import java.util.Locale;

/** What started a task run; logged and audited with the run. */
public enum TaskTrigger {
  SCHEDULED,
  MANUAL;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
