/*
 * どこで: Backup monitor データアクセス
 * 何を: 取り込み側が保存した backups/servers からジョブ履歴を読み取る
 * なぜ: 検知処理に直近の成功実行時刻の列をまとめて渡すため
 */
package com.example.backupmonitor.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;

import com.example.backupmonitor.model.BackupJob;
import com.example.backupmonitor.model.BackupJobId;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class BackupJobRepository {

  // Warning 付きで完了した実行も「成功」として扱う
  static final List<String> SUCCESSFUL_STATUSES = List.of("Success", "Warning");

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Loads every known job with its latest run and up to {@code historyLimit} successful run
   * timestamps, most recent first.
   */
  public List<BackupJob> findAllWithHistory(int historyLimit) {
    final Map<BackupJobId, List<Instant>> history = findSuccessfulRuns(historyLimit);
    final String sql =
        """
        SELECT DISTINCT ON (b.server_id, b.backup_name)
               b.server_id, b.backup_name, COALESCE(NULLIF(s.alias, ''), s.name) AS server_name,
               b.date AS last_run_at, b.status AS last_run_status
        FROM backups b
        LEFT JOIN servers s ON s.id = b.server_id
        ORDER BY b.server_id, b.backup_name, b.date DESC
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) -> {
          final BackupJobId jobId =
              new BackupJobId(rs.getString("server_id"), rs.getString("backup_name"));
          return new BackupJob(
              jobId,
              rs.getString("server_name"),
              toInstant(rs.getTimestamp("last_run_at")),
              rs.getString("last_run_status"),
              history.getOrDefault(jobId, List.of()));
        });
  }

  private Map<BackupJobId, List<Instant>> findSuccessfulRuns(int historyLimit) {
    final String sql =
        """
        SELECT server_id, backup_name, date
        FROM (
          SELECT server_id, backup_name, date,
                 ROW_NUMBER() OVER (PARTITION BY server_id, backup_name ORDER BY date DESC) AS rn
          FROM backups
          WHERE status IN (:statuses)
        ) ranked
        WHERE rn <= :limit
        ORDER BY server_id, backup_name, date DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("statuses", SUCCESSFUL_STATUSES)
            .addValue("limit", historyLimit);
    final Map<BackupJobId, List<Instant>> result = new HashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          final BackupJobId jobId =
              new BackupJobId(rs.getString("server_id"), rs.getString("backup_name"));
          result.computeIfAbsent(jobId, ignored -> new ArrayList<>())
              .add(toInstant(rs.getTimestamp("date")));
        });
    return result;
  }
}
