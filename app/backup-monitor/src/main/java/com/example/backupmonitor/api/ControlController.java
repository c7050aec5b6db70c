/*
 * どこで: Backup monitor Control API
 * 何を: タスク状態の参照・手動トリガー・ヘルスを公開する
 * なぜ: 本体アプリがバックグラウンド処理の状態確認と即時実行を行えるようにするため
 */
package com.example.backupmonitor.api;

import com.example.backupmonitor.api.response.HealthResponse;
import com.example.backupmonitor.api.response.SchedulerStatusResponse;
import com.example.backupmonitor.api.response.TaskStatusResponse;
import com.example.backupmonitor.api.response.TriggerResponse;
import com.example.backupmonitor.service.StoreHealthTracker;
import com.example.backupmonitor.task.TaskSchedulerService;
import com.example.backupmonitor.task.TriggerResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Process-internal control surface. Callers are authorized at the boundary, not here. */
@RestController
@RequiredArgsConstructor
public class ControlController {

  private final TaskSchedulerService schedulerService;
  private final StoreHealthTracker storeHealth;

  @GetMapping("/status")
  public ResponseEntity<SchedulerStatusResponse> status() {
    final SchedulerStatusResponse response =
        new SchedulerStatusResponse(
            schedulerService.status().stream().map(TaskStatusResponse::from).toList(),
            schedulerService.uptime().getSeconds());
    return ResponseEntity.ok(response);
  }

  @PostMapping("/tasks/{name}/trigger")
  public ResponseEntity<TriggerResponse> trigger(@PathVariable("name") String name) {
    final TriggerResult result = schedulerService.trigger(name);
    return ResponseEntity.status(httpStatusFor(result)).body(TriggerResponse.from(result));
  }

  // ストアには触れない
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    final String status = storeHealth.degraded() ? HealthResponse.DEGRADED : HealthResponse.UP;
    return ResponseEntity.ok(new HealthResponse(status, storeHealth.consecutiveFailures()));
  }

  private HttpStatus httpStatusFor(TriggerResult result) {
    return switch (result) {
      case ACCEPTED -> HttpStatus.ACCEPTED;
      case UNKNOWN_TASK -> HttpStatus.NOT_FOUND;
      case BUSY, DISABLED -> HttpStatus.CONFLICT;
      case SHUTTING_DOWN -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }
}
