/*
 * どこで: Backup monitor データアクセス
 * 何を: audit_log への追記と保持期間切れの削除を担う
 * なぜ: 検知遷移と通知結果の追跡を外部の監査ビューへ提供するため
 */
package com.example.backupmonitor.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.backupmonitor.model.AuditEntry;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditEntry entry) {
    final String sql =
        """
        INSERT INTO audit_log (id, created_at, action, job_id, outcome, detail_json)
        VALUES (:id, :createdAt, :action, :jobId, :outcome, CAST(:detailJson AS jsonb))
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", entry.id())
            .addValue("createdAt", toTimestamp(entry.createdAt()))
            .addValue("action", entry.action().value())
            .addValue("jobId", entry.jobId())
            .addValue("outcome", entry.outcome())
            .addValue("detailJson", entry.detailJson());
    jdbcTemplate.update(sql, params);
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql = "DELETE FROM audit_log WHERE created_at < :threshold";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
