/*
 * どこで: Backup monitor サービス層
 * 何を: ジョブの成功履歴と設定から期待時刻を算出し、遅延かどうかを分類する
 * なぜ: 判定を副作用のない純粋関数にして、tick ごとに再計算できるようにするため
 */
package com.example.backupmonitor.service;

import com.example.backupmonitor.config.OverdueCheckProperties;
import com.example.backupmonitor.model.BackupJob;
import com.example.backupmonitor.model.BackupJobId;
import com.example.backupmonitor.model.OverdueState;
import com.example.backupmonitor.model.OverdueState.Classification;
import com.example.backupmonitor.model.ScheduleConfig;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifies a backup job against its schedule.
 *
 * <p>The expected interval comes from the job's own configuration, then the global default, and
 * finally from the gaps between its most recent successful runs. A job is overdue when {@code now}
 * is strictly after {@code lastSeenAt + interval + tolerance}. All instants are compared at second
 * granularity.
 */
@Component
@RequiredArgsConstructor
public class OverdueDetector {

  private final OverdueCheckProperties properties;

  public OverdueState evaluate(BackupJob job, ScheduleConfig config, Instant now) {
    final BackupJobId jobId = job.jobId();
    final ScheduleConfig effective = config == null ? ScheduleConfig.defaults(jobId) : config;
    final Instant current = now.truncatedTo(ChronoUnit.SECONDS);
    final Instant lastSeenAt =
        job.lastSuccessAt() == null ? null : job.lastSuccessAt().truncatedTo(ChronoUnit.SECONDS);

    if (lastSeenAt == null) {
      final Classification classification =
          effective.enabled() ? Classification.NO_HISTORY : Classification.DISABLED;
      return new OverdueState(jobId, classification, null, null, null);
    }

    final Optional<Duration> interval = resolveInterval(job, effective);
    if (interval.isEmpty()) {
      final Classification classification =
          effective.enabled() ? Classification.INSUFFICIENT_HISTORY : Classification.DISABLED;
      return new OverdueState(jobId, classification, null, lastSeenAt, null);
    }

    final Duration tolerance =
        effective.tolerance() == null ? properties.defaultTolerance() : effective.tolerance();
    final Instant expectedAt = lastSeenAt.plus(interval.get()).plus(tolerance);
    final Classification classification;
    if (!effective.enabled()) {
      classification = Classification.DISABLED;
    } else if (current.isAfter(expectedAt)) {
      classification = Classification.OVERDUE;
    } else {
      classification = Classification.ON_TIME;
    }
    return new OverdueState(jobId, classification, expectedAt, lastSeenAt, interval.get());
  }

  private Optional<Duration> resolveInterval(BackupJob job, ScheduleConfig config) {
    if (config.expectedInterval() != null) {
      return Optional.of(config.expectedInterval());
    }
    if (properties.defaultExpectedInterval() != null) {
      return Optional.of(properties.defaultExpectedInterval());
    }
    return inferInterval(job.successfulRuns());
  }

  /**
   * Infers the run interval from successful runs ordered most recent first. Gaps of zero are
   * ignored; fewer than two distinct runs yields empty.
   */
  @VisibleForTesting
  Optional<Duration> inferInterval(List<Instant> successfulRuns) {
    final List<Instant> sample =
        successfulRuns.stream()
            .limit(properties.historySampleSize())
            .map(run -> run.truncatedTo(ChronoUnit.SECONDS))
            .toList();
    final List<Duration> gaps = new ArrayList<>();
    for (int i = 0; i + 1 < sample.size(); i++) {
      final Duration gap = Duration.between(sample.get(i + 1), sample.get(i));
      if (!gap.isZero() && !gap.isNegative()) {
        gaps.add(gap);
      }
    }
    if (gaps.isEmpty()) {
      return Optional.empty();
    }
    return switch (properties.intervalInference()) {
      case MOST_RECENT -> Optional.of(gaps.get(0));
      case MEDIAN -> Optional.of(median(gaps));
    };
  }

  private Duration median(List<Duration> gaps) {
    final List<Duration> sorted = new ArrayList<>(gaps);
    Collections.sort(sorted);
    final int middle = sorted.size() / 2;
    if (sorted.size() % 2 == 1) {
      return sorted.get(middle);
    }
    // 偶数個は中央 2 値の平均(秒未満切り捨て)
    final long seconds = (sorted.get(middle - 1).getSeconds() + sorted.get(middle).getSeconds()) / 2;
    return Duration.ofSeconds(seconds);
  }
}
