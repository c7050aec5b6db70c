/*
 * どこで: Backup monitor Control API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.backupmonitor.api;

public enum ApiErrorCode {
  STORE_UNAVAILABLE,
  INTERNAL_ERROR
}
