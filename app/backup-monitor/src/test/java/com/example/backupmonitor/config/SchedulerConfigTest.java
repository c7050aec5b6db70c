package com.example.backupmonitor.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

class SchedulerConfigTest {

  private final SchedulerConfig config = new SchedulerConfig();

  @Test
  void dispatchExecutorDrainsForUpToDispatchTimeout() {
    final NotificationDeliveryProperties delivery =
        new NotificationDeliveryProperties(
            3,
            Duration.ofSeconds(1),
            Duration.ofSeconds(10),
            2.0d,
            0.8d,
            1.2d,
            Duration.ofMillis(500),
            Duration.ofSeconds(5),
            Duration.ofSeconds(60),
            500);

    final ThreadPoolTaskExecutor executor = config.dispatchExecutor(delivery);

    assertThat(ReflectionTestUtils.getField(executor, "awaitTerminationMillis"))
        .isEqualTo(60_000L);
    assertThat(ReflectionTestUtils.getField(executor, "waitForTasksToCompleteOnShutdown"))
        .isEqualTo(true);
  }

  @Test
  void taskRunnerDrainsForUpToShutdownTimeout() {
    final ThreadPoolTaskExecutor executor =
        config.taskRunner(new SchedulerProperties(true, 4, Duration.ofSeconds(90), 3));

    assertThat(ReflectionTestUtils.getField(executor, "awaitTerminationMillis"))
        .isEqualTo(90_000L);
  }
}
