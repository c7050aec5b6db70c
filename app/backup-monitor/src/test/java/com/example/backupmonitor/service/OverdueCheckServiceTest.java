package com.example.backupmonitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.backupmonitor.config.OverdueCheckProperties;
import com.example.backupmonitor.model.BackupJob;
import com.example.backupmonitor.model.BackupJobId;
import com.example.backupmonitor.model.NotificationRecord;
import com.example.backupmonitor.model.OverdueState;
import com.example.backupmonitor.model.OverdueState.Classification;
import com.example.backupmonitor.repository.BackupJobRepository;
import com.example.backupmonitor.repository.NotificationRecordRepository;
import com.example.backupmonitor.repository.ScheduleConfigRepository;
import com.example.backupmonitor.service.NotificationStateTracker.Transition;
import com.example.backupmonitor.service.channel.DispatchResult;
import com.example.backupmonitor.service.channel.NotificationDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class OverdueCheckServiceTest {

  // ミリ秒は tick 開始時に切り捨てられる
  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00.750Z");
  private static final Instant NOW_SECONDS = Instant.parse("2026-03-10T12:00:00Z");
  private static final BackupJobId FIRST = new BackupJobId("srv-1", "nightly");
  private static final BackupJobId SECOND = new BackupJobId("srv-2", "weekly");

  @Mock private BackupJobRepository backupJobRepository;
  @Mock private ScheduleConfigRepository scheduleConfigRepository;
  @Mock private NotificationRecordRepository recordRepository;
  @Mock private OverdueDetector detector;
  @Mock private NotificationStateTracker stateTracker;
  @Mock private NotificationDispatcher dispatcher;

  private SimpleMeterRegistry registry;
  private OverdueCheckService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new OverdueCheckService(
            backupJobRepository,
            scheduleConfigRepository,
            recordRepository,
            detector,
            stateTracker,
            dispatcher,
            properties(),
            new BackupMonitorMetrics(registry),
            Clock.fixed(NOW, ZoneOffset.UTC),
            new NoOpTransactionManager());
    // スナップショット取得前に失敗するケースでは使われない
    lenient().when(scheduleConfigRepository.findAll()).thenReturn(Map.of());
  }

  @Test
  void failureOfOneJobDoesNotStopThePass() {
    when(backupJobRepository.findAllWithHistory(10))
        .thenReturn(List.of(job(FIRST), job(SECOND)));
    when(recordRepository.findAll()).thenReturn(List.of());
    when(detector.evaluate(eq(job(FIRST)), any(), eq(NOW_SECONDS)))
        .thenThrow(new IllegalStateException("corrupt history"));
    when(detector.evaluate(eq(job(SECOND)), any(), eq(NOW_SECONDS))).thenReturn(onTime(SECOND));
    when(dispatcher.canDeliver(any())).thenReturn(true);
    when(stateTracker.decide(
            isNull(), eq(onTime(SECOND)), eq(job(SECOND)), eq(NOW_SECONDS), eq(true)))
        .thenReturn(Transition.NONE);

    final OverdueCheckSummary summary = service.runCheck();

    assertThat(summary.evaluated()).isEqualTo(2);
    assertThat(summary.failedJobs()).isEqualTo(1);
    assertThat(summary.overdue()).isZero();
  }

  @Test
  void storeFailureAbortsThePass() {
    when(backupJobRepository.findAllWithHistory(10))
        .thenReturn(List.of(job(FIRST), job(SECOND)));
    when(recordRepository.findAll()).thenReturn(List.of());
    when(detector.evaluate(eq(job(FIRST)), any(), eq(NOW_SECONDS))).thenReturn(overdue(FIRST));
    when(dispatcher.canDeliver(any())).thenReturn(true);
    when(stateTracker.decide(isNull(), any(), any(), any(), anyBoolean()))
        .thenReturn(Transition.OPEN);
    when(dispatcher.dispatch(any(), any())).thenReturn(new DispatchResult(List.of()));
    when(stateTracker.applyOpen(any(), any(), any(), any()))
        .thenThrow(new DataAccessResourceFailureException("connection reset"));

    assertThatThrownBy(() -> service.runCheck())
        .isInstanceOf(DataAccessResourceFailureException.class);
    verify(detector, never()).evaluate(eq(job(SECOND)), any(), any());
    verify(recordRepository, never()).deleteByJobIds(any());
  }

  @Test
  void transactionBeginFailureAfterDispatchAbortsThePass() {
    when(backupJobRepository.findAllWithHistory(10))
        .thenReturn(List.of(job(FIRST), job(SECOND)));
    when(recordRepository.findAll()).thenReturn(List.of());
    when(detector.evaluate(eq(job(FIRST)), any(), eq(NOW_SECONDS))).thenReturn(overdue(FIRST));
    when(dispatcher.canDeliver(any())).thenReturn(true);
    when(stateTracker.decide(isNull(), any(), any(), any(), anyBoolean()))
        .thenReturn(Transition.OPEN);
    when(dispatcher.dispatch(any(), any())).thenReturn(new DispatchResult(List.of()));
    when(stateTracker.applyOpen(any(), any(), any(), any()))
        .thenThrow(new CannotCreateTransactionException("could not open JDBC connection"));

    assertThatThrownBy(() -> service.runCheck())
        .isInstanceOf(CannotCreateTransactionException.class);
    verify(detector, never()).evaluate(eq(job(SECOND)), any(), any());
    verify(recordRepository, never()).deleteByJobIds(any());
  }

  @Test
  void snapshotFailsWhenTransactionCannotBegin() {
    final OverdueCheckService unreachable =
        new OverdueCheckService(
            backupJobRepository,
            scheduleConfigRepository,
            recordRepository,
            detector,
            stateTracker,
            dispatcher,
            properties(),
            new BackupMonitorMetrics(registry),
            Clock.fixed(NOW, ZoneOffset.UTC),
            new UnreachableTransactionManager());

    assertThatThrownBy(unreachable::runCheck)
        .isInstanceOf(CannotCreateTransactionException.class);
    verify(backupJobRepository, never()).findAllWithHistory(anyInt());
  }

  @Test
  void lostOpenRaceIsNotCountedAsOpened() {
    when(backupJobRepository.findAllWithHistory(10)).thenReturn(List.of(job(FIRST)));
    when(recordRepository.findAll()).thenReturn(List.of());
    when(detector.evaluate(eq(job(FIRST)), any(), eq(NOW_SECONDS))).thenReturn(overdue(FIRST));
    when(dispatcher.canDeliver(any())).thenReturn(true);
    when(stateTracker.decide(isNull(), any(), any(), any(), anyBoolean()))
        .thenReturn(Transition.OPEN);
    final DispatchResult sent = new DispatchResult(List.of());
    when(dispatcher.dispatch(any(), any())).thenReturn(sent);
    when(stateTracker.applyOpen(job(FIRST), overdue(FIRST), sent, NOW_SECONDS)).thenReturn(false);

    final OverdueCheckSummary summary = service.runCheck();

    assertThat(summary.opened()).isZero();
    assertThat(summary.overdue()).isEqualTo(1);
    assertThat(summary.failedJobs()).isZero();
  }

  @Test
  void recordsOfUnknownJobsAreDeletedAndGaugeUpdated() {
    final BackupJobId removed = new BackupJobId("srv-9", "gone");
    when(backupJobRepository.findAllWithHistory(10)).thenReturn(List.of(job(FIRST)));
    when(recordRepository.findAll())
        .thenReturn(
            List.of(
                new NotificationRecord(
                    removed, NOW_SECONDS, null, null, null, null, 0, null, NOW_SECONDS)));
    when(detector.evaluate(eq(job(FIRST)), any(), eq(NOW_SECONDS))).thenReturn(overdue(FIRST));
    when(dispatcher.canDeliver(any())).thenReturn(true);
    when(stateTracker.decide(isNull(), any(), any(), any(), anyBoolean()))
        .thenReturn(Transition.STILL_OPEN);
    when(recordRepository.deleteByJobIds(List.of(removed))).thenReturn(1);

    final OverdueCheckSummary summary = service.runCheck();

    assertThat(summary.orphansRemoved()).isEqualTo(1);
    assertThat(summary.overdue()).isEqualTo(1);
    assertThat(registry.get("backup_monitor.overdue.jobs.current").gauge().value())
        .isEqualTo(1.0d);
  }

  private static OverdueCheckProperties properties() {
    return new OverdueCheckProperties(
        true,
        Duration.ofMinutes(5),
        Duration.ofHours(1),
        null,
        OverdueCheckProperties.IntervalInference.MEDIAN,
        10,
        Duration.ZERO,
        true);
  }

  private static BackupJob job(BackupJobId jobId) {
    return new BackupJob(
        jobId,
        "host",
        NOW_SECONDS.minus(Duration.ofHours(26)),
        "Success",
        List.of(
            NOW_SECONDS.minus(Duration.ofHours(26)), NOW_SECONDS.minus(Duration.ofHours(50))));
  }

  private static OverdueState onTime(BackupJobId jobId) {
    return new OverdueState(
        jobId,
        Classification.ON_TIME,
        NOW_SECONDS.plus(Duration.ofHours(1)),
        NOW_SECONDS.minus(Duration.ofHours(1)),
        Duration.ofHours(1));
  }

  private static OverdueState overdue(BackupJobId jobId) {
    return new OverdueState(
        jobId,
        Classification.OVERDUE,
        NOW_SECONDS.minus(Duration.ofHours(1)),
        NOW_SECONDS.minus(Duration.ofHours(26)),
        Duration.ofHours(24));
  }

  private static class NoOpTransactionManager implements PlatformTransactionManager {

    @Override
    public TransactionStatus getTransaction(TransactionDefinition definition) {
      return new SimpleTransactionStatus();
    }

    @Override
    public void commit(TransactionStatus status) {}

    @Override
    public void rollback(TransactionStatus status) {}
  }

  private static class UnreachableTransactionManager extends NoOpTransactionManager {

    @Override
    public TransactionStatus getTransaction(TransactionDefinition definition) {
      throw new CannotCreateTransactionException("could not open JDBC connection");
    }
  }
}
