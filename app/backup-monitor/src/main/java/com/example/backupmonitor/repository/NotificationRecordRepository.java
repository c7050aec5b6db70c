/*
 * どこで: Backup monitor データアクセス
 * 何を: notification_records の取得/エピソード開始/配信結果更新/解除を担う
 * なぜ: エピソード単位の通知済み状態を別プロセスと共有しつつ安全に遷移させるため
 */
package com.example.backupmonitor.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.backupmonitor.model.BackupJobId;
import com.example.backupmonitor.model.DeliveryStatus;
import com.example.backupmonitor.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRecordRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT server_id, backup_name, episode_started_at, notified_at, last_seen_at, expected_at,
             delivery_status, delivery_attempts, last_delivery_error, updated_at
      FROM notification_records
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<NotificationRecord> findAll() {
    return jdbcTemplate.query(SELECT_COLUMNS, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<NotificationRecord> findByJobId(BackupJobId jobId) {
    final String sql = SELECT_COLUMNS + " WHERE server_id = :serverId AND backup_name = :backupName";
    return jdbcTemplate.query(sql, jobParams(jobId), this::mapRow).stream().findFirst();
  }

  /**
   * Opens an episode for the job. Only succeeds when no episode is currently open, so a
   * concurrent opener loses the race and gets {@code 0}.
   */
  public int openEpisode(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notification_records (
          server_id, backup_name, episode_started_at, notified_at, last_seen_at, expected_at,
          delivery_status, delivery_attempts, last_delivery_error, updated_at
        ) VALUES (
          :serverId, :backupName, :episodeStartedAt, :notifiedAt, :lastSeenAt, :expectedAt,
          :deliveryStatus, :deliveryAttempts, :lastDeliveryError, :updatedAt
        )
        ON CONFLICT (server_id, backup_name) DO UPDATE
        SET episode_started_at = EXCLUDED.episode_started_at,
            notified_at = EXCLUDED.notified_at,
            last_seen_at = EXCLUDED.last_seen_at,
            expected_at = EXCLUDED.expected_at,
            delivery_status = EXCLUDED.delivery_status,
            delivery_attempts = EXCLUDED.delivery_attempts,
            last_delivery_error = EXCLUDED.last_delivery_error,
            updated_at = EXCLUDED.updated_at
        WHERE notification_records.episode_started_at IS NULL
        """;
    return jdbcTemplate.update(sql, recordParams(record));
  }

  /** Records a delivery outcome for the episode that started at {@code episodeStartedAt}. */
  public int recordDelivery(
      BackupJobId jobId,
      Instant episodeStartedAt,
      Instant notifiedAt,
      DeliveryStatus deliveryStatus,
      String lastDeliveryError,
      Instant updatedAt) {
    final String sql =
        """
        UPDATE notification_records
        SET notified_at = COALESCE(:notifiedAt, notified_at),
            delivery_status = :deliveryStatus,
            delivery_attempts = delivery_attempts + 1,
            last_delivery_error = :lastDeliveryError,
            updated_at = :updatedAt
        WHERE server_id = :serverId
          AND backup_name = :backupName
          AND episode_started_at = :episodeStartedAt
        """;
    final MapSqlParameterSource params =
        jobParams(jobId)
            .addValue("episodeStartedAt", toTimestamp(episodeStartedAt))
            .addValue("notifiedAt", toTimestamp(notifiedAt), Types.TIMESTAMP)
            .addValue("deliveryStatus", deliveryStatus.name())
            .addValue("lastDeliveryError", lastDeliveryError)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Closes the episode; the row stays so each known job keeps exactly one record. */
  public int clearEpisode(BackupJobId jobId, Instant episodeStartedAt, Instant updatedAt) {
    final String sql =
        """
        UPDATE notification_records
        SET episode_started_at = NULL,
            notified_at = NULL,
            last_seen_at = NULL,
            expected_at = NULL,
            delivery_status = NULL,
            delivery_attempts = 0,
            last_delivery_error = NULL,
            updated_at = :updatedAt
        WHERE server_id = :serverId
          AND backup_name = :backupName
          AND episode_started_at = :episodeStartedAt
        """;
    final MapSqlParameterSource params =
        jobParams(jobId)
            .addValue("episodeStartedAt", toTimestamp(episodeStartedAt))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteByJobIds(Collection<BackupJobId> jobIds) {
    if (jobIds.isEmpty()) {
      return 0;
    }
    final String sql =
        "DELETE FROM notification_records WHERE server_id = :serverId AND backup_name = :backupName";
    final SqlParameterSource[] batch =
        jobIds.stream().map(this::jobParams).toArray(SqlParameterSource[]::new);
    int deleted = 0;
    for (int count : jdbcTemplate.batchUpdate(sql, batch)) {
      deleted += Math.max(count, 0);
    }
    return deleted;
  }

  private MapSqlParameterSource jobParams(BackupJobId jobId) {
    return new MapSqlParameterSource()
        .addValue("serverId", jobId.serverId())
        .addValue("backupName", jobId.backupName());
  }

  private MapSqlParameterSource recordParams(NotificationRecord record) {
    return jobParams(record.jobId())
        .addValue("episodeStartedAt", toTimestamp(record.episodeStartedAt()))
        .addValue("notifiedAt", toTimestamp(record.notifiedAt()))
        .addValue("lastSeenAt", toTimestamp(record.lastSeenAt()))
        .addValue("expectedAt", toTimestamp(record.expectedAt()))
        .addValue(
            "deliveryStatus",
            record.deliveryStatus() == null ? null : record.deliveryStatus().name())
        .addValue("deliveryAttempts", record.deliveryAttempts())
        .addValue("lastDeliveryError", record.lastDeliveryError())
        .addValue("updatedAt", toTimestamp(record.updatedAt()));
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String deliveryStatus = rs.getString("delivery_status");
    return new NotificationRecord(
        new BackupJobId(rs.getString("server_id"), rs.getString("backup_name")),
        toInstant(rs.getTimestamp("episode_started_at")),
        toInstant(rs.getTimestamp("notified_at")),
        toInstant(rs.getTimestamp("last_seen_at")),
        toInstant(rs.getTimestamp("expected_at")),
        deliveryStatus == null ? null : DeliveryStatus.valueOf(deliveryStatus),
        rs.getInt("delivery_attempts"),
        rs.getString("last_delivery_error"),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
