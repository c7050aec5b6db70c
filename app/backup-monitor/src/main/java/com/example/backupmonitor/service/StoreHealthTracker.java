/*
 * どこで: Backup monitor サービス層
 * 何を: ストア書き込みの連続失敗回数を数える
 * なぜ: /health がストアに触れずに劣化状態を返せるようにするため
 */
package com.example.backupmonitor.service;

import com.example.backupmonitor.config.SchedulerProperties;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StoreHealthTracker {

  private static final Logger logger = LoggerFactory.getLogger(StoreHealthTracker.class);

  private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
  private final int degradedAfterFailures;

  public StoreHealthTracker(SchedulerProperties properties) {
    this.degradedAfterFailures = properties.degradedAfterFailures();
  }

  public void recordSuccess() {
    final int previous = consecutiveFailures.getAndSet(0);
    if (previous >= degradedAfterFailures) {
      logger.info("store recovered after consecutiveFailures={}", previous);
    }
  }

  public void recordFailure() {
    final int failures = consecutiveFailures.incrementAndGet();
    if (failures == degradedAfterFailures) {
      logger.error("store marked degraded consecutiveFailures={}", failures);
    }
  }

  public boolean degraded() {
    return consecutiveFailures.get() >= degradedAfterFailures;
  }

  public int consecutiveFailures() {
    return consecutiveFailures.get();
  }
}
