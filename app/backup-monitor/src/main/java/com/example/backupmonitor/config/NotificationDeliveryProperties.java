/*
 * どこで: Backup monitor の設定バインド
 * 何を: 通知送信のリトライ/バックオフ/タイムアウト設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.backupmonitor.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "backup-monitor.delivery")
@Validated
public record NotificationDeliveryProperties(
    @Positive int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    Duration sendTimeout,
    Duration dispatchTimeout,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "backup-monitor.delivery.backoff-jitter-min must not exceed jitter-max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin >= 0 && backoffJitterMin <= backoffJitterMax;
  }

  @AssertTrue(message = "backup-monitor.delivery.send-timeout and dispatch-timeout must be positive")
  public boolean isTimeoutsPositive() {
    return isPositive(sendTimeout) && isPositive(dispatchTimeout);
  }

  @AssertTrue(
      message =
          "backup-monitor.delivery.dispatch-timeout must cover max-attempts sends (connect + read"
              + " send-timeout each) and the backoffs between them")
  public boolean isDispatchTimeoutCoveringRetries() {
    if (!isTimeoutsPositive() || backoffMax == null || maxAttempts <= 0) {
      // 個別の検証で報告する
      return true;
    }
    return dispatchTimeout.compareTo(worstCaseDeliveryDuration()) >= 0;
  }

  /** Longest time one channel can spend in a dispatch when every attempt runs to its timeouts. */
  public Duration worstCaseDeliveryDuration() {
    final Duration sends = sendTimeout.multipliedBy(2L * maxAttempts);
    final long cappedBackoffMillis = (long) Math.ceil(backoffMax.toMillis() * backoffJitterMax);
    final long minMillis = backoffMin == null ? 0L : backoffMin.toMillis();
    final long backoffMillis = Math.max(minMillis, cappedBackoffMillis);
    return sends.plusMillis(backoffMillis * (maxAttempts - 1L));
  }

  private boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
