/*
 * どこで: Backup monitor データアクセス
 * 何を: task_runs の取得/upsert を担う
 * なぜ: 再起動後に前回実行時刻から初回 tick を調整し、Control API に状態を返すため
 */
package com.example.backupmonitor.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.backupmonitor.model.TaskRunRecord;
import com.example.backupmonitor.model.TaskRunStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TaskRunRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<TaskRunRecord> findAll() {
    final String sql =
        """
        SELECT task_name, last_run_at, last_run_status, last_run_duration_ms
        FROM task_runs
        ORDER BY task_name
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<TaskRunRecord> findByTaskName(String taskName) {
    final String sql =
        """
        SELECT task_name, last_run_at, last_run_status, last_run_duration_ms
        FROM task_runs
        WHERE task_name = :taskName
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("taskName", taskName);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void upsert(TaskRunRecord record, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO task_runs (task_name, last_run_at, last_run_status, last_run_duration_ms, updated_at)
        VALUES (:taskName, :lastRunAt, :lastRunStatus, :lastRunDurationMs, :updatedAt)
        ON CONFLICT (task_name) DO UPDATE
        SET last_run_at = EXCLUDED.last_run_at,
            last_run_status = EXCLUDED.last_run_status,
            last_run_duration_ms = EXCLUDED.last_run_duration_ms,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("taskName", record.taskName())
            .addValue("lastRunAt", toTimestamp(record.lastRunAt()))
            .addValue("lastRunStatus", record.lastRunStatus().name())
            .addValue("lastRunDurationMs", record.lastRunDurationMs())
            .addValue("updatedAt", toTimestamp(updatedAt));
    jdbcTemplate.update(sql, params);
  }

  private TaskRunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TaskRunRecord(
        rs.getString("task_name"),
        toInstant(rs.getTimestamp("last_run_at")),
        TaskRunStatus.valueOf(rs.getString("last_run_status")),
        rs.getLong("last_run_duration_ms"));
  }
}
