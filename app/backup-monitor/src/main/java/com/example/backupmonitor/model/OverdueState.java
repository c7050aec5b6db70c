/*
 * どこで: Backup monitor ドメインモデル
 * 何を: 1 回の検知パスで算出した遅延判定結果
 * なぜ: 永続化せず毎 tick 再計算する値を不変オブジェクトで受け渡すため
 */
package com.example.backupmonitor.model;

import java.time.Duration;
import java.time.Instant;

public record OverdueState(
    BackupJobId jobId,
    Classification classification,
    Instant expectedAt,
    Instant lastSeenAt,
    Duration interval) {

  public enum Classification {
    ON_TIME,
    OVERDUE,
    DISABLED,
    NO_HISTORY,
    INSUFFICIENT_HISTORY
  }

  public boolean overdue() {
    return classification == Classification.OVERDUE;
  }

  public boolean lacksHistory() {
    return classification == Classification.NO_HISTORY
        || classification == Classification.INSUFFICIENT_HISTORY;
  }
}
