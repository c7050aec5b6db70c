/*
 * どこで: Backup monitor サービス層
 * 何を: 遅延件数/遷移/配信結果/タスク実行のアプリ固有メトリクスを記録する
 * なぜ: 検知と通知の健全性を Prometheus から直接観測できるようにするため
 */
package com.example.backupmonitor.service;

import com.example.backupmonitor.model.ChannelKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class BackupMonitorMetrics {

  private static final String METRIC_OVERDUE_CURRENT = "backup_monitor.overdue.jobs.current";
  private static final String METRIC_TRANSITIONS_TOTAL = "backup_monitor.overdue.transitions.total";
  private static final String METRIC_DELIVERY_TOTAL = "backup_monitor.delivery.total";
  private static final String METRIC_TASK_RUNS_TOTAL = "backup_monitor.task.runs.total";
  private static final String METRIC_TASK_DURATION = "backup_monitor.task.duration";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger overdueCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> taskTimers = new ConcurrentHashMap<>();

  public BackupMonitorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OVERDUE_CURRENT, overdueCurrent, AtomicInteger::get)
        .description("Number of jobs overdue in the latest check")
        .register(meterRegistry);
  }

  public void updateOverdueCurrent(int overdueCount) {
    overdueCurrent.set(Math.max(overdueCount, 0));
  }

  public void recordTransition(String transition) {
    counter(METRIC_TRANSITIONS_TOTAL, "Overdue episode transitions", Tags.of("transition", transition))
        .increment();
  }

  public void recordDelivery(ChannelKind channel, String result) {
    counter(
            METRIC_DELIVERY_TOTAL,
            "Notification delivery outcomes per channel",
            Tags.of("channel", channel.value(), "result", result))
        .increment();
  }

  public void recordTaskRun(String task, String status, Duration duration) {
    counter(METRIC_TASK_RUNS_TOTAL, "Scheduled task runs", Tags.of("task", task, "status", status))
        .increment();
    if (duration != null && !duration.isNegative()) {
      taskTimers
          .computeIfAbsent(
              task,
              ignored ->
                  Timer.builder(METRIC_TASK_DURATION)
                      .description("Scheduled task run duration")
                      .tags(Tags.of("task", task))
                      .register(meterRegistry))
          .record(duration);
    }
  }

  public void recordTaskSkipped(String task) {
    counter(
            METRIC_TASK_RUNS_TOTAL,
            "Scheduled task runs",
            Tags.of("task", task, "status", "skipped_busy"))
        .increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key =
        name
            + tags.stream()
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
