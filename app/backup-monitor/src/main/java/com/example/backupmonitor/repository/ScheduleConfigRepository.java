/*
 * どこで: Backup monitor データアクセス
 * 何を: backup_settings からジョブ単位の監視設定を読み取る
 * なぜ: 管理 UI の変更を次の tick から反映するため
 */
package com.example.backupmonitor.repository;

import static com.example.common.JdbcTimestampUtils.minutesToDuration;

import com.example.backupmonitor.model.BackupJobId;
import com.example.backupmonitor.model.ChannelKind;
import com.example.backupmonitor.model.ScheduleConfig;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduleConfigRepository {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleConfigRepository.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Map<BackupJobId, ScheduleConfig> findAll() {
    final String sql =
        """
        SELECT server_id, backup_name, overdue_enabled, expected_interval_minutes,
               tolerance_minutes, notification_channels
        FROM backup_settings
        """;
    final Map<BackupJobId, ScheduleConfig> result = new HashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          final BackupJobId jobId =
              new BackupJobId(rs.getString("server_id"), rs.getString("backup_name"));
          result.put(
              jobId,
              new ScheduleConfig(
                  jobId,
                  rs.getBoolean("overdue_enabled"),
                  minutesToDuration((Number) rs.getObject("expected_interval_minutes")),
                  minutesToDuration((Number) rs.getObject("tolerance_minutes")),
                  parseChannels(jobId, rs.getString("notification_channels"))));
        });
    return result;
  }

  // NULL は「設定済みの全チャネル」、空文字は「通知しない」を表す
  Set<ChannelKind> parseChannels(BackupJobId jobId, String raw) {
    if (raw == null) {
      return null;
    }
    final Set<ChannelKind> channels = EnumSet.noneOf(ChannelKind.class);
    Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .forEach(
            value -> {
              try {
                channels.add(ChannelKind.fromValue(value));
              } catch (IllegalArgumentException ex) {
                logger.warn("unknown notification channel ignored jobId={} value={}", jobId, value);
              }
            });
    return channels;
  }
}
