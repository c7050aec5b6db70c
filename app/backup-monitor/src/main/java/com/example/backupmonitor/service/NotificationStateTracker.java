/*
 * どこで: Backup monitor サービス層
 * 何を: ジョブごとの遅延エピソードを開始/再送/エスカレーション/回復の状態機械で管理する
 * なぜ: 1 エピソードにつき通知を 1 回に抑え、配信失敗は次 tick で確実に再送するため
 */
package com.example.backupmonitor.service;

import com.example.backupmonitor.config.OverdueCheckProperties;
import com.example.backupmonitor.model.AuditAction;
import com.example.backupmonitor.model.BackupJob;
import com.example.backupmonitor.model.NotificationRecord;
import com.example.backupmonitor.model.OverdueAlert;
import com.example.backupmonitor.model.OverdueState;
import com.example.backupmonitor.repository.NotificationRecordRepository;
import com.example.backupmonitor.service.channel.DispatchResult;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Per-job notification state machine.
 *
 * <pre>
 * closed --overdue--&gt; open(notify) --delivery failed--&gt; open(retry next tick)
 * open --renotify interval elapsed--&gt; open(escalate)
 * open --newer successful run--&gt; closed(recovered)
 * open --no longer overdue without a new run--&gt; closed(resolved by config)
 * </pre>
 *
 * <p>{@link #decide} is pure. The {@code apply*} methods write the record and its audit entries in
 * one transaction; channel I/O happens before they are called, never inside the transaction.
 */
@Service
public class NotificationStateTracker {

  private static final Logger logger = LoggerFactory.getLogger(NotificationStateTracker.class);

  public enum Transition {
    /** No episode and not overdue. */
    NONE,
    OPEN,
    RETRY_DELIVERY,
    ESCALATE,
    /** Episode open and already handled; no write. */
    STILL_OPEN,
    RECOVER,
    CLOSE;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final NotificationRecordRepository recordRepository;
  private final AuditService auditService;
  private final OverdueCheckProperties properties;
  private final BackupMonitorMetrics metrics;
  private final TransactionTemplate transactionTemplate;

  public NotificationStateTracker(
      NotificationRecordRepository recordRepository,
      AuditService auditService,
      OverdueCheckProperties properties,
      BackupMonitorMetrics metrics,
      PlatformTransactionManager transactionManager) {
    this.recordRepository = recordRepository;
    this.auditService = auditService;
    this.properties = properties;
    this.metrics = metrics;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Decides the next transition for a job.
   *
   * @param record the persisted record, or {@code null} when the job has none yet
   * @param deliverable whether any of the job's selected channels is configured
   */
  public Transition decide(
      NotificationRecord record,
      OverdueState state,
      BackupJob job,
      Instant now,
      boolean deliverable) {
    if (record == null || !record.open()) {
      return state.overdue() ? Transition.OPEN : Transition.NONE;
    }
    if (hasNewerSuccessfulRun(record, job)) {
      return Transition.RECOVER;
    }
    if (!state.overdue()) {
      return Transition.CLOSE;
    }
    if (record.notifiedAt() == null) {
      // FAILED は再送、SKIPPED はチャネルが設定されたら送る
      return deliverable ? Transition.RETRY_DELIVERY : Transition.STILL_OPEN;
    }
    if (deliverable
        && properties.escalationEnabled()
        && now.isAfter(record.notifiedAt().plus(properties.renotifyInterval()))) {
      return Transition.ESCALATE;
    }
    return Transition.STILL_OPEN;
  }

  private boolean hasNewerSuccessfulRun(NotificationRecord record, BackupJob job) {
    final Instant lastSuccessAt = job.lastSuccessAt();
    if (lastSuccessAt == null) {
      return false;
    }
    final Instant latest = lastSuccessAt.truncatedTo(ChronoUnit.SECONDS);
    final Instant baseline =
        record.lastSeenAt() == null ? record.episodeStartedAt() : record.lastSeenAt();
    return latest.isAfter(baseline);
  }

  /**
   * Opens a new episode after the first dispatch attempt.
   *
   * @return {@code false} when another process opened the episode first
   */
  public boolean applyOpen(
      BackupJob job, OverdueState state, DispatchResult result, Instant now) {
    final NotificationRecord record =
        new NotificationRecord(
            job.jobId(),
            now,
            result.delivered() ? now : null,
            state.lastSeenAt(),
            state.expectedAt(),
            result.deliveryStatus(),
            result.nothingAttempted() ? 0 : 1,
            result.errorSummary(),
            now);
    final Boolean opened =
        transactionTemplate.execute(
            status -> {
              final int updated = recordRepository.openEpisode(record);
              if (updated == 0) {
                status.setRollbackOnly();
                return false;
              }
              final Map<String, Object> detail = new LinkedHashMap<>();
              detail.put("jobName", job.displayName());
              detail.put("lastSeenAt", String.valueOf(state.lastSeenAt()));
              detail.put("expectedAt", String.valueOf(state.expectedAt()));
              if (state.interval() != null) {
                detail.put("intervalSeconds", state.interval().getSeconds());
              }
              auditService.append(AuditAction.OVERDUE_DETECTED, job.jobId(), "open", detail);
              appendDeliveryAudit(record, OverdueAlert.Kind.OVERDUE, result);
              return true;
            });
    if (!Boolean.TRUE.equals(opened)) {
      logger.info("overdue episode already opened elsewhere jobId={}", job.jobId());
      return false;
    }
    metrics.recordTransition(Transition.OPEN.value());
    logger.warn(
        "backup overdue jobId={} expectedAt={} delivery={}",
        job.jobId(),
        state.expectedAt(),
        result.outcome());
    return true;
  }

  /** Records a retry or escalation dispatch for the open episode. */
  public boolean applyDelivery(
      NotificationRecord record, OverdueAlert.Kind kind, DispatchResult result, Instant now) {
    final Boolean applied =
        transactionTemplate.execute(
            status -> {
              final int updated =
                  recordRepository.recordDelivery(
                      record.jobId(),
                      record.episodeStartedAt(),
                      result.delivered() ? now : null,
                      result.deliveryStatus(),
                      result.errorSummary(),
                      now);
              if (updated == 0) {
                status.setRollbackOnly();
                return false;
              }
              appendDeliveryAudit(record, kind, result);
              return true;
            });
    if (!Boolean.TRUE.equals(applied)) {
      logger.info("overdue episode changed elsewhere jobId={}", record.jobId());
      return false;
    }
    final Transition transition =
        kind == OverdueAlert.Kind.ESCALATION ? Transition.ESCALATE : Transition.RETRY_DELIVERY;
    metrics.recordTransition(transition.value());
    return true;
  }

  /**
   * Closes the episode because a newer successful run arrived.
   *
   * @param recoveryResult result of the recovered notice, or {@code null} when none was sent
   */
  public boolean applyRecover(
      NotificationRecord record, BackupJob job, DispatchResult recoveryResult, Instant now) {
    final Boolean applied =
        transactionTemplate.execute(
            status -> {
              final int updated =
                  recordRepository.clearEpisode(record.jobId(), record.episodeStartedAt(), now);
              if (updated == 0) {
                status.setRollbackOnly();
                return false;
              }
              final Map<String, Object> detail = new LinkedHashMap<>();
              detail.put("episodeStartedAt", String.valueOf(record.episodeStartedAt()));
              detail.put("lastSuccessAt", String.valueOf(job.lastSuccessAt()));
              auditService.append(AuditAction.OVERDUE_RECOVERED, record.jobId(), "recovered", detail);
              if (recoveryResult != null) {
                appendDeliveryAudit(record, OverdueAlert.Kind.RECOVERED, recoveryResult);
              }
              return true;
            });
    if (!Boolean.TRUE.equals(applied)) {
      return false;
    }
    metrics.recordTransition(Transition.RECOVER.value());
    logger.info("backup recovered jobId={} lastSuccessAt={}", record.jobId(), job.lastSuccessAt());
    return true;
  }

  /** Closes the episode because the job is no longer overdue although no new run arrived. */
  public boolean applyClose(NotificationRecord record, OverdueState state, Instant now) {
    final Boolean applied =
        transactionTemplate.execute(
            status -> {
              final int updated =
                  recordRepository.clearEpisode(record.jobId(), record.episodeStartedAt(), now);
              if (updated == 0) {
                status.setRollbackOnly();
                return false;
              }
              final Map<String, Object> detail = new LinkedHashMap<>();
              detail.put("episodeStartedAt", String.valueOf(record.episodeStartedAt()));
              detail.put("classification", state.classification().name());
              auditService.append(
                  AuditAction.OVERDUE_RECOVERED, record.jobId(), "resolved_by_config", detail);
              return true;
            });
    if (!Boolean.TRUE.equals(applied)) {
      return false;
    }
    metrics.recordTransition(Transition.CLOSE.value());
    logger.info(
        "overdue episode closed without new run jobId={} classification={}",
        record.jobId(),
        state.classification());
    return true;
  }

  private void appendDeliveryAudit(
      NotificationRecord record, OverdueAlert.Kind kind, DispatchResult result) {
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("kind", kind.name().toLowerCase(Locale.ROOT));
    detail.put("episodeStartedAt", String.valueOf(record.episodeStartedAt()));
    detail.put("channels", result.toDetail());
    final AuditAction action =
        result.delivered()
            ? AuditAction.OVERDUE_NOTIFICATION_SENT
            : AuditAction.OVERDUE_NOTIFICATION_FAILED;
    auditService.append(action, record.jobId(), result.outcome(), detail);
  }
}
