package com.example.backupmonitor.task;

import com.example.backupmonitor.model.TaskRunStatus;
import java.time.Instant;

/** Point-in-time view of one task for the control API. Run fields are null before the first run. */
public record TaskStatus(
    String name,
    Instant lastRunAt,
    TaskRunStatus lastRunStatus,
    Long lastRunDurationMs,
    boolean enabled,
    boolean running,
    long intervalSeconds) {}
