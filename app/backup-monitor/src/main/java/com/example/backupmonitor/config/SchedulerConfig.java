/*
 * どこで: Backup monitor のスケジューラ設定
 * 何を: Clock・tick 発火用スケジューラ・タスク実行/通知送信用のスレッドプールを定義する
 * なぜ: tick の発火と実行を分離し、停止時は発火だけ即座に止めて実行中タスクを流し切るため
 */
package com.example.backupmonitor.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ThreadPoolTaskScheduler taskTicker() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("task-ticker-");
    // 停止要求時は次の tick を受け付けない
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  @Bean
  public ThreadPoolTaskExecutor taskRunner(SchedulerProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.runnerPoolSize());
    executor.setMaxPoolSize(properties.runnerPoolSize());
    // 同名タスクの多重起動はスケジューラ側で弾くので、キューは溜めない
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("task-runner-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.shutdownTimeout().toMillis());
    return executor;
  }

  @Bean
  public ThreadPoolTaskExecutor dispatchExecutor(NotificationDeliveryProperties delivery) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(16);
    executor.setThreadNamePrefix("notify-dispatch-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(delivery.dispatchTimeout().toMillis());
    return executor;
  }
}
