/*
 * どこで: Backup monitor ドメインモデル
 * 何を: ジョブ単位の監視設定(有効/期待間隔/許容幅/通知チャネル)
 * なぜ: 管理 UI が更新した設定を毎 tick 読み直して判定に使うため
 */
package com.example.backupmonitor.model;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-job monitoring configuration. {@code null} durations fall back to the global defaults and
 * {@code null} channels mean "every configured channel".
 */
public record ScheduleConfig(
    BackupJobId jobId,
    boolean enabled,
    Duration expectedInterval,
    Duration tolerance,
    Set<ChannelKind> channels) {

  public ScheduleConfig {
    channels = channels == null ? null : Set.copyOf(channels);
  }

  public static ScheduleConfig defaults(BackupJobId jobId) {
    return new ScheduleConfig(jobId, true, null, null, null);
  }

  public Set<ChannelKind> channelsOrAll() {
    return channels == null ? EnumSet.allOf(ChannelKind.class) : channels;
  }
}
