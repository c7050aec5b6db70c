/*
 * どこで: 共通ユーティリティのテスト
 * 何を: Instant/Timestamp/分単位設定の変換を検証する
 * なぜ: NULL を未設定として扱う前提が崩れないことを保証するため
 */
package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void convertsBothDirectionsAndKeepsNull() {
    final Instant instant = Instant.parse("2026-01-17T00:00:00Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }

  @Test
  void minutesToDurationTreatsNullAsUnset() {
    assertThat(JdbcTimestampUtils.minutesToDuration(90)).isEqualTo(Duration.ofMinutes(90));
    assertThat(JdbcTimestampUtils.minutesToDuration(null)).isNull();
  }
}
