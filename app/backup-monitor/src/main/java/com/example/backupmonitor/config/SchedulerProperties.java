/*
 * どこで: Backup monitor の設定バインド
 * 何を: タスクスケジューラの起動/スレッド数/停止待ち/劣化判定の設定を保持する
 * なぜ: テストでは自動起動を止め、本番では停止時のドレイン時間を調整できるようにするため
 */
package com.example.backupmonitor.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "backup-monitor.scheduler")
@Validated
public record SchedulerProperties(
    boolean enabled,
    @Positive int runnerPoolSize,
    @NotNull Duration shutdownTimeout,
    @Positive int degradedAfterFailures) {}
