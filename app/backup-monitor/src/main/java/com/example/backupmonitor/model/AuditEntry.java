/*
 * どこで: Backup monitor ドメインモデル
 * 何を: audit_log テーブル相当の追記専用レコード
 * なぜ: 検知遷移と通知結果を後から追跡できるようにするため
 */
package com.example.backupmonitor.model;

import java.time.Instant;
import java.util.UUID;

public record AuditEntry(
    UUID id,
    Instant createdAt,
    AuditAction action,
    String jobId,
    String outcome,
    String detailJson) {}
