package com.example.backupmonitor.api.response;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record SchedulerStatusResponse(List<TaskStatusResponse> tasks, long uptimeSeconds) {}
