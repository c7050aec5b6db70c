package com.example.backupmonitor.api.response;

/** Liveness answer; {@code DEGRADED} means the store kept failing across ticks. */
public record HealthResponse(String status, int consecutiveStoreFailures) {

  public static final String UP = "UP";
  public static final String DEGRADED = "DEGRADED";
}
