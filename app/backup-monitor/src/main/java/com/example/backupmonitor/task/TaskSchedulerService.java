/*
 * どこで: Backup monitor タスク層
 * 何を: 名前付きタスクを周期実行し、実行中の重複起動を抑止し、手動トリガーと停止時ドレインを扱う
 * なぜ: 同じタスクの同時実行を防ぎつつ、再起動直後の重複実行も前回実行時刻から避けるため
 */
package com.example.backupmonitor.task;

import com.example.backupmonitor.config.SchedulerProperties;
import com.example.backupmonitor.model.AuditAction;
import com.example.backupmonitor.model.TaskRunRecord;
import com.example.backupmonitor.model.TaskRunStatus;
import com.example.backupmonitor.repository.TaskRunRepository;
import com.example.backupmonitor.service.AuditService;
import com.example.backupmonitor.service.BackupMonitorMetrics;
import com.example.backupmonitor.service.StoreHealthTracker;
import com.example.common.TraceIds;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs {@link ScheduledTask}s on fixed intervals.
 *
 * <p>Ticks fire on a single ticker thread and hand the run to the runner pool, so a slow task
 * never delays another task's tick. A tick that fires while the same task is still running is
 * skipped and audited. On startup each task's first run is delayed until {@code lastRunAt +
 * interval}, so a restart does not run a task that just completed. On shutdown ticks stop at once
 * and in-flight runs drain.
 */
@Service
public class TaskSchedulerService {

  private static final Logger logger = LoggerFactory.getLogger(TaskSchedulerService.class);
  static final String MDC_TASK_NAME = "task_name";
  static final String MDC_TRIGGER = "trigger";

  private final Map<String, TaskSlot> slots;
  private final TaskRunRepository taskRunRepository;
  private final AuditService auditService;
  private final StoreHealthTracker storeHealth;
  private final BackupMonitorMetrics metrics;
  private final ThreadPoolTaskScheduler taskTicker;
  private final ThreadPoolTaskExecutor taskRunner;
  private final SchedulerProperties properties;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;
  private final Instant startedAt;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopping = new AtomicBoolean(false);
  private final List<ScheduledFuture<?>> tickers = new CopyOnWriteArrayList<>();

  public TaskSchedulerService(
      List<ScheduledTask> tasks,
      TaskRunRepository taskRunRepository,
      AuditService auditService,
      StoreHealthTracker storeHealth,
      BackupMonitorMetrics metrics,
      @Qualifier("taskTicker") ThreadPoolTaskScheduler taskTicker,
      @Qualifier("taskRunner") ThreadPoolTaskExecutor taskRunner,
      SchedulerProperties properties,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    final Map<String, TaskSlot> byName = new LinkedHashMap<>();
    for (ScheduledTask task : tasks) {
      if (byName.put(task.name(), new TaskSlot(task)) != null) {
        throw new IllegalStateException("duplicate scheduled task name=" + task.name());
      }
    }
    this.slots = Collections.unmodifiableMap(byName);
    this.taskRunRepository = taskRunRepository;
    this.auditService = auditService;
    this.storeHealth = storeHealth;
    this.metrics = metrics;
    this.taskTicker = taskTicker;
    this.taskRunner = taskRunner;
    this.properties = properties;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.startedAt = Instant.now(clock);
  }

  @PostConstruct
  public void start() {
    if (!properties.enabled()) {
      logger.info("task scheduler auto start disabled tasks={}", slots.keySet());
      return;
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    final Map<String, TaskRunRecord> lastRuns = loadLastRuns();
    final Instant now = Instant.now(clock);
    for (TaskSlot slot : slots.values()) {
      final ScheduledTask task = slot.task();
      if (!task.enabled()) {
        logger.info("scheduled task disabled name={}", task.name());
        continue;
      }
      final Duration delay = computeInitialDelay(task.interval(), lastRuns.get(task.name()), now);
      // ticker 側の時計で初回時刻を決める
      final Instant firstRunAt = taskTicker.getClock().instant().plus(delay);
      tickers.add(
          taskTicker.scheduleAtFixedRate(
              () -> submit(slot, TaskTrigger.SCHEDULED), firstRunAt, task.interval()));
      logger.info(
          "scheduled task registered name={} interval={} initialDelay={}",
          task.name(),
          task.interval(),
          delay);
    }
  }

  private Map<String, TaskRunRecord> loadLastRuns() {
    try {
      final Map<String, TaskRunRecord> lastRuns =
          taskRunRepository.findAll().stream()
              .collect(Collectors.toMap(TaskRunRecord::taskName, Function.identity()));
      storeHealth.recordSuccess();
      return lastRuns;
    } catch (DataAccessException | TransactionException ex) {
      // 前回実行が分からない場合は即時実行に倒す
      storeHealth.recordFailure();
      logger.warn("task run history unavailable, starting tasks immediately", ex);
      return Map.of();
    }
  }

  /**
   * Delay before the first tick after startup: zero when the task never ran or is already due,
   * otherwise the time left until {@code lastRunAt + interval}, capped at one interval.
   */
  @VisibleForTesting
  static Duration computeInitialDelay(Duration interval, TaskRunRecord lastRun, Instant now) {
    if (lastRun == null || lastRun.lastRunAt() == null) {
      return Duration.ZERO;
    }
    final Instant nextDue = lastRun.lastRunAt().plus(interval);
    if (!nextDue.isAfter(now)) {
      return Duration.ZERO;
    }
    final Duration delay = Duration.between(now, nextDue);
    // 時計が巻き戻った場合でも 1 interval を超えて待たない
    return delay.compareTo(interval) > 0 ? interval : delay;
  }

  /** Requests an immediate run. Never waits for the run itself. */
  public TriggerResult trigger(String name) {
    final TaskSlot slot = slots.get(name);
    if (slot == null) {
      return TriggerResult.UNKNOWN_TASK;
    }
    if (!slot.task().enabled()) {
      return TriggerResult.DISABLED;
    }
    final TriggerResult result = submit(slot, TaskTrigger.MANUAL);
    logger.info("manual trigger requested name={} result={}", name, result);
    return result;
  }

  private TriggerResult submit(TaskSlot slot, TaskTrigger trigger) {
    if (stopping.get()) {
      return TriggerResult.SHUTTING_DOWN;
    }
    if (!slot.running().compareAndSet(false, true)) {
      onBusy(slot, trigger);
      return TriggerResult.BUSY;
    }
    try {
      taskRunner.execute(() -> runSlot(slot, trigger));
      return TriggerResult.ACCEPTED;
    } catch (TaskRejectedException ex) {
      slot.running().set(false);
      logger.warn("task run rejected by runner name={}", slot.task().name(), ex);
      return stopping.get() ? TriggerResult.SHUTTING_DOWN : TriggerResult.BUSY;
    }
  }

  private void onBusy(TaskSlot slot, TaskTrigger trigger) {
    final String name = slot.task().name();
    logger.info("task still running, tick skipped name={} trigger={}", name, trigger.value());
    metrics.recordTaskSkipped(name);
    try {
      transactionTemplate.executeWithoutResult(
          status ->
              auditService.append(
                  AuditAction.TASK_SKIPPED_BUSY,
                  null,
                  "skipped",
                  Map.of("task", name, "trigger", trigger.value())));
    } catch (DataAccessException | TransactionException ex) {
      storeHealth.recordFailure();
      logger.warn("failed to audit skipped tick name={}", name, ex);
    }
  }

  private void runSlot(TaskSlot slot, TaskTrigger trigger) {
    MDC.put(MDC_TASK_NAME, slot.task().name());
    MDC.put(MDC_TRIGGER, trigger.value());
    try {
      TraceIds.runWithNewTraceId(() -> execute(slot, trigger));
    } finally {
      MDC.remove(MDC_TRIGGER);
      MDC.remove(MDC_TASK_NAME);
      slot.running().set(false);
    }
  }

  private void execute(TaskSlot slot, TaskTrigger trigger) {
    final ScheduledTask task = slot.task();
    final Instant runStartedAt = Instant.now(clock);
    final long startNanos = System.nanoTime();
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("trigger", trigger.value());
    TaskRunStatus status;
    logger.info("task run started name={}", task.name());
    try {
      final Map<String, Object> summary = task.run();
      if (summary != null) {
        detail.putAll(summary);
      }
      status = TaskRunStatus.SUCCEEDED;
    } catch (DataAccessException | TransactionException ex) {
      status = TaskRunStatus.FAILED;
      detail.put("error", "store unavailable");
      logger.error("task run aborted, store unavailable name={}", task.name(), ex);
    } catch (RuntimeException ex) {
      status = TaskRunStatus.FAILED;
      detail.put("error", String.valueOf(ex.getMessage()));
      logger.error("task run failed name={}", task.name(), ex);
    }
    final Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
    detail.put("durationMs", duration.toMillis());
    recordCompletion(task.name(), runStartedAt, status, duration, detail);
    metrics.recordTaskRun(task.name(), status.name().toLowerCase(Locale.ROOT), duration);
    logger.info(
        "task run finished name={} status={} durationMs={}",
        task.name(),
        status,
        duration.toMillis());
  }

  private void recordCompletion(
      String name,
      Instant runStartedAt,
      TaskRunStatus status,
      Duration duration,
      Map<String, Object> detail) {
    try {
      transactionTemplate.executeWithoutResult(
          tx -> {
            taskRunRepository.upsert(
                new TaskRunRecord(name, runStartedAt, status, duration.toMillis()),
                Instant.now(clock));
            auditService.append(
                AuditAction.TASK_RUN_COMPLETED,
                null,
                status.name().toLowerCase(Locale.ROOT),
                detail);
          });
      storeHealth.recordSuccess();
    } catch (DataAccessException | TransactionException ex) {
      storeHealth.recordFailure();
      logger.error("failed to record task run name={} status={}", name, status, ex);
    } catch (RuntimeException ex) {
      // ランナースレッドへは漏らさない
      logger.error("unexpected failure recording task run name={} status={}", name, status, ex);
    }
  }

  /** Current state of every registered task, including ones that never ran. */
  public List<TaskStatus> status() {
    final Map<String, TaskRunRecord> lastRuns =
        taskRunRepository.findAll().stream()
            .collect(Collectors.toMap(TaskRunRecord::taskName, Function.identity()));
    final List<TaskStatus> statuses = new ArrayList<>();
    for (TaskSlot slot : slots.values()) {
      final ScheduledTask task = slot.task();
      final TaskRunRecord lastRun = lastRuns.get(task.name());
      statuses.add(
          new TaskStatus(
              task.name(),
              lastRun == null ? null : lastRun.lastRunAt(),
              lastRun == null ? null : lastRun.lastRunStatus(),
              lastRun == null ? null : lastRun.lastRunDurationMs(),
              task.enabled(),
              slot.running().get(),
              task.interval().getSeconds()));
    }
    return statuses;
  }

  public Duration uptime() {
    return Duration.between(startedAt, Instant.now(clock));
  }

  public boolean isRunning(String name) {
    final TaskSlot slot = slots.get(name);
    return slot != null && slot.running().get();
  }

  @PreDestroy
  public void stop() {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }
    tickers.forEach(future -> future.cancel(false));
    tickers.clear();
    logger.info(
        "task scheduler stopping, draining in-flight runs timeout={}",
        properties.shutdownTimeout());
    // DataSource より先に実行中タスクを流し切る
    taskRunner.shutdown();
    logger.info("task scheduler stopped");
  }

  private record TaskSlot(ScheduledTask task, AtomicBoolean running) {
    private TaskSlot(ScheduledTask task) {
      this(task, new AtomicBoolean(false));
    }
  }
}
