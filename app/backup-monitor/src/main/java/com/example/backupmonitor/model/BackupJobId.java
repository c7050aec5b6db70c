/*
 * どこで: Backup monitor ドメインモデル
 * 何を: (server, backup-name) の組でバックアップジョブを識別する
 * なぜ: 監査ログや状態行で同じキー表現を使うため
 */
package com.example.backupmonitor.model;

import java.util.Objects;

public record BackupJobId(String serverId, String backupName) {

  public BackupJobId {
    Objects.requireNonNull(serverId, "serverId");
    Objects.requireNonNull(backupName, "backupName");
  }

  public String key() {
    return serverId + ":" + backupName;
  }

  @Override
  public String toString() {
    return key();
  }
}
