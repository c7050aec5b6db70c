/*
 * Where: Backup monitor configuration binding
 * What: Holds audit log retention settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.backupmonitor.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "backup-monitor.audit")
@Validated
public record AuditRetentionProperties(
    boolean enabled,
    @Positive int retentionDays,
    @NotNull Duration cleanupInterval) {
}
