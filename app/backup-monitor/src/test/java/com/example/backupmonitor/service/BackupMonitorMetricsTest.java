/*
 * どこで: Backup monitor メトリクステスト
 * 何を: 遅延件数/遷移/配信結果/タスク実行メトリクスが記録されることを検証する
 * なぜ: 監視ダッシュボードが参照する指標名とタグの回帰を防ぐため
 */
package com.example.backupmonitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.backupmonitor.model.ChannelKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackupMonitorMetricsTest {

  @Test
  void recordsOverdueDeliveryAndTaskMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BackupMonitorMetrics metrics = new BackupMonitorMetrics(registry);

    metrics.updateOverdueCurrent(3);
    metrics.recordTransition("open");
    metrics.recordTransition("open");
    metrics.recordDelivery(ChannelKind.PUSH, "sent");
    metrics.recordDelivery(ChannelKind.EMAIL, "permanent_failure");
    metrics.recordTaskRun("overdue-check", "succeeded", Duration.ofMillis(120));
    metrics.recordTaskSkipped("overdue-check");

    assertThat(registry.get("backup_monitor.overdue.jobs.current").gauge().value()).isEqualTo(3.0d);
    assertThat(
            registry
                .get("backup_monitor.overdue.transitions.total")
                .tag("transition", "open")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("backup_monitor.delivery.total")
                .tags("channel", "email", "result", "permanent_failure")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("backup_monitor.task.runs.total")
                .tags("task", "overdue-check", "status", "skipped_busy")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("backup_monitor.task.duration").tag("task", "overdue-check").timer().count())
        .isEqualTo(1L);
  }

  @Test
  void negativeOverdueCountIsClampedToZero() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BackupMonitorMetrics metrics = new BackupMonitorMetrics(registry);

    metrics.updateOverdueCurrent(-1);

    assertThat(registry.get("backup_monitor.overdue.jobs.current").gauge().value()).isZero();
  }
}
