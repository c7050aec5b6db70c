/*
 * どこで: Backup monitor 通知チャネル
 * 何を: 選択されたチャネルへ並行に送信し、一時失敗はバックオフ付きで再試行する
 * なぜ: 遅いチャネルが他を塞がず、送信全体を上限時間内に収めるため
 */
package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.config.NotificationDeliveryProperties;
import com.example.backupmonitor.model.ChannelKind;
import com.example.backupmonitor.model.OverdueAlert;
import com.example.backupmonitor.service.BackupMonitorMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

@Service
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<NotificationChannel> channels;
  private final NotificationDeliveryProperties properties;
  private final ThreadPoolTaskExecutor dispatchExecutor;
  private final BackoffSleeper sleeper;
  private final BackupMonitorMetrics metrics;

  public NotificationDispatcher(
      Collection<NotificationChannel> channels,
      NotificationDeliveryProperties properties,
      @Qualifier("dispatchExecutor") ThreadPoolTaskExecutor dispatchExecutor,
      BackoffSleeper sleeper,
      BackupMonitorMetrics metrics) {
    this.channels = List.copyOf(channels);
    this.properties = properties;
    this.dispatchExecutor = dispatchExecutor;
    this.sleeper = sleeper;
    this.metrics = metrics;
  }

  /** Whether any of the selected channels is configured. */
  public boolean canDeliver(Set<ChannelKind> selection) {
    return selection.stream().map(this::channelFor).anyMatch(this::isConfigured);
  }

  public DispatchResult dispatch(OverdueAlert alert, Set<ChannelKind> selection) {
    final Map<ChannelKind, Future<ChannelResult>> pending = new LinkedHashMap<>();
    final List<ChannelResult> results = new ArrayList<>();
    for (ChannelKind kind : ChannelKind.values()) {
      if (!selection.contains(kind)) {
        continue;
      }
      final NotificationChannel channel = channelFor(kind);
      if (!isConfigured(channel)) {
        results.add(ChannelResult.notConfigured(kind));
        continue;
      }
      pending.put(kind, dispatchExecutor.submit(() -> sendWithRetry(channel, alert)));
    }
    final long deadline = System.nanoTime() + properties.dispatchTimeout().toNanos();
    pending.forEach((kind, future) -> results.add(collect(kind, future, deadline)));
    final DispatchResult result = new DispatchResult(results);
    for (ChannelResult channelResult : result.results()) {
      if (channelResult.outcome() != ChannelResult.Outcome.NOT_CONFIGURED) {
        metrics.recordDelivery(channelResult.channel(), channelResult.outcome().value());
      }
    }
    logger.info(
        "notification dispatched jobId={} kind={} outcome={}",
        alert.jobId(),
        alert.kind(),
        result.outcome());
    return result;
  }

  private NotificationChannel channelFor(ChannelKind kind) {
    return channels.stream().filter(channel -> channel.kind() == kind).findFirst().orElse(null);
  }

  private boolean isConfigured(NotificationChannel channel) {
    return channel != null && channel.isConfigured();
  }

  /**
   * Waits for one channel until the shared deadline. A channel still running at the deadline is
   * interrupted, and its retry loop stops before the next attempt.
   */
  private ChannelResult collect(ChannelKind kind, Future<ChannelResult> future, long deadline) {
    try {
      final long remaining = Math.max(0L, deadline - System.nanoTime());
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.warn(
          "notification dispatch timed out channel={} timeout={}",
          kind.value(),
          properties.dispatchTimeout());
      return ChannelResult.transientFailure(kind, 0, "dispatch timeout");
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      logger.warn("notification dispatch interrupted channel={}", kind.value());
      return ChannelResult.transientFailure(kind, 0, "interrupted");
    } catch (ExecutionException ex) {
      // sendWithRetry は例外を結果に変換するため、ここに来るのは想定外の失敗のみ
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      logger.error("notification dispatch failed channel={}", kind.value(), cause);
      return ChannelResult.transientFailure(kind, 0, truncateError(cause.getMessage()));
    }
  }

  @VisibleForTesting
  ChannelResult sendWithRetry(NotificationChannel channel, OverdueAlert alert) {
    final int maxAttempts = properties.maxAttempts();
    for (int attempt = 1; ; attempt++) {
      if (Thread.currentThread().isInterrupted()) {
        // タイムアウト後は送信しない。送れば次 tick の再送と二重になる
        logger.warn(
            "notification delivery abandoned after dispatch timeout channel={} jobId={} attempt={}",
            channel.kind().value(),
            alert.jobId(),
            attempt);
        return ChannelResult.transientFailure(channel.kind(), attempt - 1, "interrupted");
      }
      try {
        channel.send(alert);
        return ChannelResult.sent(channel.kind(), attempt);
      } catch (ChannelDeliveryException ex) {
        if (ex.permanent()) {
          logger.warn(
              "notification channel failed permanently channel={} jobId={} attempt={}",
              channel.kind().value(),
              alert.jobId(),
              attempt,
              ex);
          return ChannelResult.permanentFailure(
              channel.kind(), attempt, truncateError(ex.getMessage()));
        }
        if (attempt >= maxAttempts) {
          logger.warn(
              "notification channel retries exhausted channel={} jobId={} attempts={}",
              channel.kind().value(),
              alert.jobId(),
              attempt,
              ex);
          return ChannelResult.transientFailure(
              channel.kind(), attempt, truncateError(ex.getMessage()));
        }
        final Duration backoff = computeBackoffDuration(attempt);
        logger.warn(
            "notification channel retry scheduled channel={} jobId={} attempt={} backoff={}",
            channel.kind().value(),
            alert.jobId(),
            attempt,
            backoff);
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return ChannelResult.transientFailure(channel.kind(), attempt, "interrupted");
        }
      } catch (RuntimeException ex) {
        // 分類できない失敗は再試行せず次 tick に任せる
        logger.error(
            "notification channel failed unexpectedly channel={} jobId={}",
            channel.kind().value(),
            alert.jobId(),
            ex);
        return ChannelResult.transientFailure(
            channel.kind(), attempt, truncateError(ex.getMessage()));
      }
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), attempt - 1);
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }
}
