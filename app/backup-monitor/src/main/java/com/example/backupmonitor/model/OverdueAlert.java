/*
 * どこで: Backup monitor ドメインモデル
 * 何を: チャネルへ渡す通知内容
 * なぜ: チャネル実装が DB レコードに依存せず文面を組み立てられるようにするため
 */
package com.example.backupmonitor.model;

import java.time.Instant;

public record OverdueAlert(
    Kind kind,
    BackupJobId jobId,
    String jobName,
    Instant lastSeenAt,
    Instant expectedAt,
    Instant episodeStartedAt,
    Instant occurredAt) {

  public enum Kind {
    OVERDUE,
    ESCALATION,
    RECOVERED
  }
}
