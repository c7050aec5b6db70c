/*
 * Where: Backup monitor service layer
 * What: Applies the retention policy to audit_log
 * Why: Keep the append-only audit table from growing without bound
 */
package com.example.backupmonitor.service;

import com.example.backupmonitor.config.AuditRetentionProperties;
import com.example.backupmonitor.repository.AuditLogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(AuditRetentionService.class);

  private final AuditLogRepository auditLogRepository;
  private final AuditRetentionProperties properties;
  private final Clock clock;

  /** Deletes entries older than the retention window and returns how many were removed. */
  public int cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = auditLogRepository.deleteOlderThan(threshold);
    logger.info("audit retention cleanup deleted entries={} threshold={}", deleted, threshold);
    return deleted;
  }
}
