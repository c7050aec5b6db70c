/*
 * Where: Backup monitor task layer
 * What: Runs audit log retention on the shared scheduler
 * Why: Automate deletion without manual intervention
 */
package com.example.backupmonitor.task;

import com.example.backupmonitor.config.AuditRetentionProperties;
import com.example.backupmonitor.service.AuditRetentionService;
import java.time.Duration;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditRetentionTask implements ScheduledTask {

  public static final String NAME = "audit-retention";

  private final AuditRetentionService retentionService;
  private final AuditRetentionProperties properties;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Duration interval() {
    return properties.cleanupInterval();
  }

  @Override
  public boolean enabled() {
    return properties.enabled();
  }

  @Override
  public Map<String, Object> run() {
    return Map.of("deleted", retentionService.cleanup());
  }
}
