/*
 * どこで: Backup monitor ドメインモデル
 * 何を: notification_records テーブルのスナップショット
 * なぜ: エピソード単位で通知済みかどうかを再起動後も判定できるようにするため
 */
package com.example.backupmonitor.model;

import java.time.Instant;

/**
 * Persisted notification state of one job. An episode is open while {@code episodeStartedAt} is
 * set; {@code notifiedAt} is only set while the episode is open and an alert was delivered.
 *
 * @param lastSeenAt last successful run known when the episode opened; a newer run ends it
 */
public record NotificationRecord(
    BackupJobId jobId,
    Instant episodeStartedAt,
    Instant notifiedAt,
    Instant lastSeenAt,
    Instant expectedAt,
    DeliveryStatus deliveryStatus,
    int deliveryAttempts,
    String lastDeliveryError,
    Instant updatedAt) {

  public boolean open() {
    return episodeStartedAt != null;
  }
}
