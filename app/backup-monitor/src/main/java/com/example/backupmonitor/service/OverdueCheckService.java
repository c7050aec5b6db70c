/*
 * どこで: Backup monitor サービス層
 * 何を: 全ジョブを評価し、状態遷移ごとに通知送信と記録を行う 1 回分の検知パス
 * なぜ: 読み取りはスナップショットで一括、書き込みはジョブ単位のトランザクションに分け、
 *       1 ジョブの失敗が他ジョブの判定を巻き込まないようにするため
 */
package com.example.backupmonitor.service;

import com.example.backupmonitor.config.OverdueCheckProperties;
import com.example.backupmonitor.model.BackupJob;
import com.example.backupmonitor.model.BackupJobId;
import com.example.backupmonitor.model.ChannelKind;
import com.example.backupmonitor.model.NotificationRecord;
import com.example.backupmonitor.model.OverdueAlert;
import com.example.backupmonitor.model.OverdueState;
import com.example.backupmonitor.model.ScheduleConfig;
import com.example.backupmonitor.repository.BackupJobRepository;
import com.example.backupmonitor.repository.NotificationRecordRepository;
import com.example.backupmonitor.repository.ScheduleConfigRepository;
import com.example.backupmonitor.service.NotificationStateTracker.Transition;
import com.example.backupmonitor.service.channel.DispatchResult;
import com.example.backupmonitor.service.channel.NotificationDispatcher;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class OverdueCheckService {

  private static final Logger logger = LoggerFactory.getLogger(OverdueCheckService.class);

  private final BackupJobRepository backupJobRepository;
  private final ScheduleConfigRepository scheduleConfigRepository;
  private final NotificationRecordRepository recordRepository;
  private final OverdueDetector detector;
  private final NotificationStateTracker stateTracker;
  private final NotificationDispatcher dispatcher;
  private final OverdueCheckProperties properties;
  private final BackupMonitorMetrics metrics;
  private final Clock clock;
  private final TransactionTemplate snapshotTemplate;

  public OverdueCheckService(
      BackupJobRepository backupJobRepository,
      ScheduleConfigRepository scheduleConfigRepository,
      NotificationRecordRepository recordRepository,
      OverdueDetector detector,
      NotificationStateTracker stateTracker,
      NotificationDispatcher dispatcher,
      OverdueCheckProperties properties,
      BackupMonitorMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.backupJobRepository = backupJobRepository;
    this.scheduleConfigRepository = scheduleConfigRepository;
    this.recordRepository = recordRepository;
    this.detector = detector;
    this.stateTracker = stateTracker;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.snapshotTemplate = new TransactionTemplate(transactionManager);
    // ジョブ/設定/通知状態を同じ時点で読む
    this.snapshotTemplate.setReadOnly(true);
    this.snapshotTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
  }

  /**
   * Runs one detection pass. A store failure (data access or transaction begin/commit) aborts the
   * pass and propagates; a failure confined to one job is logged and the pass continues with the
   * next job.
   */
  public OverdueCheckSummary runCheck() {
    final Instant now = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
    final Snapshot snapshot = snapshotTemplate.execute(status -> readSnapshot());
    final Counters counters = new Counters();
    final Set<BackupJobId> knownJobs = new HashSet<>();

    for (BackupJob job : snapshot.jobs()) {
      knownJobs.add(job.jobId());
      counters.evaluated++;
      try {
        evaluateJob(job, snapshot, now, counters);
      } catch (DataAccessException | TransactionException ex) {
        // ストア障害はパス全体を中断する
        throw ex;
      } catch (RuntimeException ex) {
        counters.failedJobs++;
        logger.error("overdue check failed for job jobId={}", job.jobId(), ex);
      }
    }

    final List<BackupJobId> orphans =
        snapshot.records().keySet().stream().filter(jobId -> !knownJobs.contains(jobId)).toList();
    if (!orphans.isEmpty()) {
      counters.orphansRemoved = recordRepository.deleteByJobIds(orphans);
      logger.info("removed notification records of deleted jobs count={}", counters.orphansRemoved);
    }

    metrics.updateOverdueCurrent(counters.overdue);
    final OverdueCheckSummary summary = counters.toSummary();
    logger.info(
        "overdue check finished evaluated={} overdue={} opened={} recovered={} failedJobs={}",
        summary.evaluated(),
        summary.overdue(),
        summary.opened(),
        summary.recovered(),
        summary.failedJobs());
    return summary;
  }

  private Snapshot readSnapshot() {
    final List<BackupJob> jobs = backupJobRepository.findAllWithHistory(properties.historySampleSize());
    final Map<BackupJobId, ScheduleConfig> configs = scheduleConfigRepository.findAll();
    final Map<BackupJobId, NotificationRecord> records = new HashMap<>();
    for (NotificationRecord record : recordRepository.findAll()) {
      records.put(record.jobId(), record);
    }
    return new Snapshot(jobs, configs, records);
  }

  private void evaluateJob(BackupJob job, Snapshot snapshot, Instant now, Counters counters) {
    final ScheduleConfig config =
        snapshot.configs().getOrDefault(job.jobId(), ScheduleConfig.defaults(job.jobId()));
    final OverdueState state = detector.evaluate(job, config, now);
    if (state.lacksHistory()) {
      counters.withoutHistory++;
      logger.debug(
          "job skipped without enough history jobId={} classification={}",
          job.jobId(),
          state.classification());
    }
    if (state.overdue()) {
      counters.overdue++;
    }

    final NotificationRecord record = snapshot.records().get(job.jobId());
    final Set<ChannelKind> selection = config.channelsOrAll();
    final boolean deliverable = dispatcher.canDeliver(selection);
    final Transition transition = stateTracker.decide(record, state, job, now, deliverable);

    switch (transition) {
      case NONE -> {
        // 遅延なし
      }
      case STILL_OPEN ->
          logger.debug("job still overdue, already handled jobId={}", job.jobId());
      case OPEN -> {
        final DispatchResult result =
            dispatcher.dispatch(alert(OverdueAlert.Kind.OVERDUE, job, state, now, now), selection);
        if (stateTracker.applyOpen(job, state, result, now)) {
          counters.opened++;
        }
      }
      case RETRY_DELIVERY -> {
        final DispatchResult result =
            dispatcher.dispatch(
                alert(OverdueAlert.Kind.OVERDUE, job, state, record.episodeStartedAt(), now),
                selection);
        if (stateTracker.applyDelivery(record, OverdueAlert.Kind.OVERDUE, result, now)) {
          counters.retried++;
        }
      }
      case ESCALATE -> {
        final DispatchResult result =
            dispatcher.dispatch(
                alert(OverdueAlert.Kind.ESCALATION, job, state, record.episodeStartedAt(), now),
                selection);
        if (stateTracker.applyDelivery(record, OverdueAlert.Kind.ESCALATION, result, now)) {
          counters.escalated++;
        }
      }
      case RECOVER -> {
        // 最初の通知が届いていない場合は回復通知も送らない
        final DispatchResult recovery =
            properties.notifyOnRecovery() && record.notifiedAt() != null && deliverable
                ? dispatcher.dispatch(
                    alert(OverdueAlert.Kind.RECOVERED, job, state, record.episodeStartedAt(), now),
                    selection)
                : null;
        if (stateTracker.applyRecover(record, job, recovery, now)) {
          counters.recovered++;
        }
      }
      case CLOSE -> {
        if (stateTracker.applyClose(record, state, now)) {
          counters.closed++;
        }
      }
    }
  }

  private OverdueAlert alert(
      OverdueAlert.Kind kind,
      BackupJob job,
      OverdueState state,
      Instant episodeStartedAt,
      Instant now) {
    return new OverdueAlert(
        kind,
        job.jobId(),
        job.displayName(),
        kind == OverdueAlert.Kind.RECOVERED ? job.lastSuccessAt() : state.lastSeenAt(),
        state.expectedAt(),
        episodeStartedAt,
        now);
  }

  private record Snapshot(
      List<BackupJob> jobs,
      Map<BackupJobId, ScheduleConfig> configs,
      Map<BackupJobId, NotificationRecord> records) {}

  private static final class Counters {
    private int evaluated;
    private int overdue;
    private int opened;
    private int retried;
    private int escalated;
    private int recovered;
    private int closed;
    private int withoutHistory;
    private int failedJobs;
    private int orphansRemoved;

    private OverdueCheckSummary toSummary() {
      return new OverdueCheckSummary(
          evaluated,
          overdue,
          opened,
          retried,
          escalated,
          recovered,
          closed,
          withoutHistory,
          failedJobs,
          orphansRemoved);
    }
  }
}
