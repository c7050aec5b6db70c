/*
 * どこで: Backup monitor ドメインモデル
 * 何を: 通知チャネルの種別
 * なぜ: 設定・監査・メトリクスで同じ識別子を使うため
 */
package com.example.backupmonitor.model;

import java.util.Locale;

public enum ChannelKind {
  PUSH,
  EMAIL;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ChannelKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("channel kind is required");
    }
    return ChannelKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
