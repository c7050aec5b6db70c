/*
 * どこで: Backup monitor ドメインモデル
 * 何を: 取り込み側が保存したバックアップ履歴のスナップショット
 * なぜ: 検知処理が読み取り専用で扱う入力を 1 つにまとめるため
 */
package com.example.backupmonitor.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a backup job as recorded by the ingestion side.
 *
 * @param successfulRuns successful run timestamps, most recent first
 */
public record BackupJob(
    BackupJobId jobId,
    String serverName,
    Instant lastRunAt,
    String lastRunStatus,
    List<Instant> successfulRuns) {

  public BackupJob {
    successfulRuns = successfulRuns == null ? List.of() : List.copyOf(successfulRuns);
  }

  public Instant lastSuccessAt() {
    return successfulRuns.isEmpty() ? null : successfulRuns.get(0);
  }

  public String displayName() {
    final String server = serverName == null || serverName.isBlank() ? jobId.serverId() : serverName;
    return server + " : " + jobId.backupName();
  }
}
