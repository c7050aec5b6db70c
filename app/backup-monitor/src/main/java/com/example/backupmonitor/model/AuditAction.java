/*
 * どこで: Backup monitor ドメインモデル
 * 何を: 監査ログに書き出すアクション種別
 * なぜ: 外部の監査ビューが読む文字列を 1 箇所で固定するため
 */
package com.example.backupmonitor.model;

import java.util.Locale;

public enum AuditAction {
  OVERDUE_DETECTED,
  OVERDUE_NOTIFICATION_SENT,
  OVERDUE_NOTIFICATION_FAILED,
  OVERDUE_RECOVERED,
  TASK_SKIPPED_BUSY,
  TASK_RUN_COMPLETED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
