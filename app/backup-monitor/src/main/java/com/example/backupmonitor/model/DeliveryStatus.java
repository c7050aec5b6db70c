/*
 * どこで: Backup monitor ドメインモデル
 * 何を: エピソードに紐づく通知配信の状態
 * なぜ: 「配信済み」「次 tick で再送」「送信先なし」を区別するため
 */
package com.example.backupmonitor.model;

public enum DeliveryStatus {
  SENT,
  FAILED,
  SKIPPED
}
