package com.example.backupmonitor.api.response;

import com.example.backupmonitor.task.TaskStatus;
import java.time.Instant;

public record TaskStatusResponse(
    String name,
    Instant lastRunAt,
    String lastRunStatus,
    Long lastRunDurationMs,
    boolean enabled,
    boolean running,
    long intervalSeconds) {

  public static TaskStatusResponse from(TaskStatus status) {
    return new TaskStatusResponse(
        status.name(),
        status.lastRunAt(),
        status.lastRunStatus() == null ? null : status.lastRunStatus().name(),
        status.lastRunDurationMs(),
        status.enabled(),
        status.running(),
        status.intervalSeconds());
  }
}
