/*
 * どこで: Backup monitor 遅延判定のユニットテスト
 * 何を: 期待時刻の算出・許容幅・履歴不足・無効化・間隔推定を検証する
 * なぜ: 誤検知と見逃しのどちらも通知の信頼性を直接損なうため
 */
package com.example.backupmonitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.backupmonitor.config.OverdueCheckProperties;
import com.example.backupmonitor.config.OverdueCheckProperties.IntervalInference;
import com.example.backupmonitor.model.BackupJob;
import com.example.backupmonitor.model.BackupJobId;
import com.example.backupmonitor.model.OverdueState;
import com.example.backupmonitor.model.OverdueState.Classification;
import com.example.backupmonitor.model.ScheduleConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class OverdueDetectorTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  private static final BackupJobId JOB_ID = new BackupJobId("srv-1", "daily");

  private final OverdueDetector detector = new OverdueDetector(properties(IntervalInference.MEDIAN));

  @Test
  void jobLastSeen26HoursAgoWithOneHourToleranceIsOverdue() {
    final Instant lastSeen = NOW.minus(Duration.ofHours(26));

    final OverdueState state =
        detector.evaluate(job(lastSeen), config(Duration.ofHours(24), Duration.ofHours(1)), NOW);

    assertThat(state.overdue()).isTrue();
    assertThat(state.expectedAt()).isEqualTo(lastSeen.plus(Duration.ofHours(25)));
    assertThat(state.lastSeenAt()).isEqualTo(lastSeen);
  }

  @Test
  void sameJobWithThreeHourToleranceIsNotYetOverdue() {
    final Instant lastSeen = NOW.minus(Duration.ofHours(26));

    final OverdueState state =
        detector.evaluate(job(lastSeen), config(Duration.ofHours(24), Duration.ofHours(3)), NOW);

    assertThat(state.overdue()).isFalse();
    assertThat(state.classification()).isEqualTo(Classification.ON_TIME);
    assertThat(state.expectedAt()).isEqualTo(lastSeen.plus(Duration.ofHours(27)));
  }

  @Test
  void jobWithoutSuccessfulRunIsNeverOverdue() {
    final BackupJob job = new BackupJob(JOB_ID, "server", NOW.minus(Duration.ofDays(30)), "Failed", List.of());

    final OverdueState state =
        detector.evaluate(job, config(Duration.ofHours(1), Duration.ZERO), NOW);

    assertThat(state.overdue()).isFalse();
    assertThat(state.classification()).isEqualTo(Classification.NO_HISTORY);
    assertThat(state.lacksHistory()).isTrue();
  }

  @Test
  void disabledConfigIsNeverOverdueRegardlessOfTiming() {
    final ScheduleConfig disabled =
        new ScheduleConfig(JOB_ID, false, Duration.ofHours(1), Duration.ZERO, null);

    final OverdueState state =
        detector.evaluate(job(NOW.minus(Duration.ofDays(10))), disabled, NOW);

    assertThat(state.overdue()).isFalse();
    assertThat(state.classification()).isEqualTo(Classification.DISABLED);
  }

  @Test
  void boundaryIsExclusiveAtSecondGranularity() {
    final Instant lastSeen = NOW.minus(Duration.ofHours(25));
    // 秒未満は切り捨てるので expectedAt と同一秒はまだ遅延ではない
    final Instant almost = NOW.plusMillis(900);

    final OverdueState atBoundary =
        detector.evaluate(job(lastSeen), config(Duration.ofHours(24), Duration.ofHours(1)), almost);
    final OverdueState oneSecondLater =
        detector.evaluate(
            job(lastSeen), config(Duration.ofHours(24), Duration.ofHours(1)), NOW.plusSeconds(1));

    assertThat(atBoundary.overdue()).isFalse();
    assertThat(oneSecondLater.overdue()).isTrue();
  }

  @Test
  void intervalIsInferredFromMedianGapWhenNotConfigured() {
    final BackupJob job =
        job(
            NOW.minus(Duration.ofHours(26)),
            NOW.minus(Duration.ofHours(50)),
            NOW.minus(Duration.ofHours(62)),
            NOW.minus(Duration.ofHours(86)));

    final OverdueState state = detector.evaluate(job, ScheduleConfig.defaults(JOB_ID), NOW);

    // gaps: 24h, 12h, 24h -> median 24h, default tolerance 1h
    assertThat(state.interval()).isEqualTo(Duration.ofHours(24));
    assertThat(state.overdue()).isTrue();
  }

  @Test
  void intervalIsInferredFromMostRecentGapWhenConfigured() {
    final OverdueDetector mostRecent =
        new OverdueDetector(properties(IntervalInference.MOST_RECENT));
    final BackupJob job =
        job(
            NOW.minus(Duration.ofHours(10)),
            NOW.minus(Duration.ofHours(22)),
            NOW.minus(Duration.ofHours(46)));

    final OverdueState state = mostRecent.evaluate(job, ScheduleConfig.defaults(JOB_ID), NOW);

    assertThat(state.interval()).isEqualTo(Duration.ofHours(12));
    assertThat(state.overdue()).isFalse();
  }

  @Test
  void evenNumberOfGapsUsesAverageOfMiddleValues() {
    assertThat(
            detector.inferInterval(
                List.of(
                    NOW,
                    NOW.minus(Duration.ofHours(10)),
                    NOW.minus(Duration.ofHours(30)))))
        .contains(Duration.ofHours(15));
  }

  @Test
  void singleSuccessfulRunWithoutConfiguredIntervalHasInsufficientHistory() {
    final OverdueState state =
        detector.evaluate(job(NOW.minus(Duration.ofDays(3))), ScheduleConfig.defaults(JOB_ID), NOW);

    assertThat(state.overdue()).isFalse();
    assertThat(state.classification()).isEqualTo(Classification.INSUFFICIENT_HISTORY);
  }

  @Test
  void globalDefaultIntervalIsUsedBeforeInference() {
    final OverdueCheckProperties withDefault =
        new OverdueCheckProperties(
            true,
            Duration.ofMinutes(5),
            Duration.ZERO,
            Duration.ofHours(6),
            IntervalInference.MEDIAN,
            10,
            Duration.ZERO,
            true);

    final OverdueState state =
        new OverdueDetector(withDefault)
            .evaluate(job(NOW.minus(Duration.ofHours(7))), ScheduleConfig.defaults(JOB_ID), NOW);

    assertThat(state.interval()).isEqualTo(Duration.ofHours(6));
    assertThat(state.overdue()).isTrue();
  }

  @Test
  void evaluationIsIdempotentForIdenticalInput() {
    final BackupJob job = job(NOW.minus(Duration.ofHours(26)));
    final ScheduleConfig config = config(Duration.ofHours(24), Duration.ofHours(1));

    assertThat(detector.evaluate(job, config, NOW)).isEqualTo(detector.evaluate(job, config, NOW));
  }

  private static OverdueCheckProperties properties(IntervalInference inference) {
    return new OverdueCheckProperties(
        true,
        Duration.ofMinutes(5),
        Duration.ofHours(1),
        null,
        inference,
        10,
        Duration.ZERO,
        true);
  }

  private static BackupJob job(Instant... successfulRuns) {
    return new BackupJob(JOB_ID, "server", successfulRuns[0], "Success", List.of(successfulRuns));
  }

  private static ScheduleConfig config(Duration interval, Duration tolerance) {
    return new ScheduleConfig(JOB_ID, true, interval, tolerance, null);
  }
}
