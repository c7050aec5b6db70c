package com.example.backupmonitor.service;

import java.util.LinkedHashMap;
import java.util.Map;

/** Counts from one overdue-check pass, written to the task's audit entry. */
public record OverdueCheckSummary(
    int evaluated,
    int overdue,
    int opened,
    int retried,
    int escalated,
    int recovered,
    int closed,
    int withoutHistory,
    int failedJobs,
    int orphansRemoved) {

  public Map<String, Object> toDetail() {
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("evaluated", evaluated);
    detail.put("overdue", overdue);
    detail.put("opened", opened);
    detail.put("retried", retried);
    detail.put("escalated", escalated);
    detail.put("recovered", recovered);
    detail.put("closed", closed);
    detail.put("withoutHistory", withoutHistory);
    detail.put("failedJobs", failedJobs);
    detail.put("orphansRemoved", orphansRemoved);
    return detail;
  }
}
