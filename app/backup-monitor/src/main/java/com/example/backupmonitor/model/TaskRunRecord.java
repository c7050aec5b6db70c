/*
 * どこで: Backup monitor ドメインモデル
 * 何を: task_runs テーブルのスナップショット
 * なぜ: 再起動直後の重複実行を避け、Control API で状態を返すため
 */
package com.example.backupmonitor.model;

import java.time.Instant;

public record TaskRunRecord(
    String taskName, Instant lastRunAt, TaskRunStatus lastRunStatus, long lastRunDurationMs) {}
