/*
 * どこで: Backup monitor ドメインモデル
 * 何を: タスク実行結果の状態を表す列挙
 * なぜ: DB と Control API の表現を一致させるため
 */
package com.example.backupmonitor.model;

public enum TaskRunStatus {
  SUCCEEDED,
  FAILED
}
