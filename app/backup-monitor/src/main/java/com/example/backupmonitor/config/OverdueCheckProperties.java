/*
 * どこで: Backup monitor の設定バインド
 * 何を: 遅延検知の間隔・許容幅・間隔推定・再通知の設定を保持する
 * なぜ: 判定パラメータを環境ごとに調整し、起動時に妥当性を検証するため
 */
package com.example.backupmonitor.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Overdue detection settings.
 *
 * <p>When a job has no explicit expected interval and {@code defaultExpectedInterval} is unset,
 * the interval is inferred from the gaps between its last {@code historySampleSize} successful
 * runs using {@code intervalInference}.
 */
@ConfigurationProperties(prefix = "backup-monitor.overdue")
@Validated
public record OverdueCheckProperties(
    boolean enabled,
    @NotNull Duration checkInterval,
    @NotNull Duration defaultTolerance,
    Duration defaultExpectedInterval,
    @NotNull IntervalInference intervalInference,
    @Min(2) int historySampleSize,
    @NotNull Duration renotifyInterval,
    boolean notifyOnRecovery) {

  public enum IntervalInference {
    MEDIAN,
    MOST_RECENT
  }

  @AssertTrue(message = "backup-monitor.overdue.check-interval must be positive")
  public boolean isCheckIntervalPositive() {
    return checkInterval != null && !checkInterval.isZero() && !checkInterval.isNegative();
  }

  @AssertTrue(message = "backup-monitor.overdue.default-tolerance must not be negative")
  public boolean isDefaultToleranceNotNegative() {
    return defaultTolerance != null && !defaultTolerance.isNegative();
  }

  @AssertTrue(message = "backup-monitor.overdue.default-expected-interval must be positive")
  public boolean isDefaultExpectedIntervalPositive() {
    // 未設定は履歴からの推定を意味するので許容する
    return defaultExpectedInterval == null
        || (!defaultExpectedInterval.isZero() && !defaultExpectedInterval.isNegative());
  }

  @AssertTrue(message = "backup-monitor.overdue.renotify-interval must not be negative")
  public boolean isRenotifyIntervalNotNegative() {
    return renotifyInterval != null && !renotifyInterval.isNegative();
  }

  public boolean escalationEnabled() {
    return renotifyInterval != null && !renotifyInterval.isZero();
  }
}
