/*
 * どこで: Backup monitor サービス層
 * 何を: 監査エントリを組み立てて audit_log に追記する
 * なぜ: 呼び出し側のトランザクション内で状態更新と同時に記録するため
 */
package com.example.backupmonitor.service;

import com.example.backupmonitor.model.AuditAction;
import com.example.backupmonitor.model.AuditEntry;
import com.example.backupmonitor.model.BackupJobId;
import com.example.backupmonitor.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditService {

  private final AuditLogRepository auditLogRepository;
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Appends one audit entry. Runs in the caller's transaction so the entry commits or rolls back
   * together with the state change it describes.
   *
   * @param jobId the job concerned, or {@code null} for task-level entries
   */
  public AuditEntry append(
      AuditAction action, BackupJobId jobId, String outcome, Map<String, Object> detail) {
    final AuditEntry entry =
        new AuditEntry(
            UUID.randomUUID(),
            Instant.now(clock),
            action,
            jobId == null ? null : jobId.key(),
            outcome,
            toJson(detail));
    auditLogRepository.insert(entry);
    return entry;
  }

  private String toJson(Map<String, Object> detail) {
    try {
      return objectMapper.writeValueAsString(detail == null ? Map.of() : detail);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("audit detail is not serializable", ex);
    }
  }
}
