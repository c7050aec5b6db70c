/*
 * どこで: Backup monitor タスク層
 * 何を: スケジューラが周期実行する名前付きタスクの契約
 * なぜ: 検知や保持期間削除を同じ実行/記録/トリガーの仕組みに載せるため
 */
package com.example.backupmonitor.task;

import java.time.Duration;
import java.util.Map;

public interface ScheduledTask {

  /** Unique name used in the task_runs table and the control API. */
  String name();

  Duration interval();

  boolean enabled();

  /**
   * Runs one tick.
   *
   * @return summary fields written into the task_run_completed audit entry
   */
  Map<String, Object> run();
}
