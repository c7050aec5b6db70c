/*
 * どこで: Backup monitor 通知チャネル
 * 何を: 1 回のファンアウト送信の集約結果
 * なぜ: 「1 チャネルでも届けば配信済み」の判定を呼び出し側で重複させないため
 */
package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.model.DeliveryStatus;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record DispatchResult(List<ChannelResult> results) {

  public DispatchResult {
    results = List.copyOf(results);
  }

  /** True when at least one channel accepted the alert. */
  public boolean delivered() {
    return results.stream().anyMatch(ChannelResult::sent);
  }

  /** True when no selected channel was configured, so nothing was attempted. */
  public boolean nothingAttempted() {
    return results.stream()
        .allMatch(result -> result.outcome() == ChannelResult.Outcome.NOT_CONFIGURED);
  }

  /** True when delivery failed and every attempted channel failed permanently. */
  public boolean permanentlyFailed() {
    return !delivered()
        && !nothingAttempted()
        && results.stream()
            .filter(result -> result.outcome() != ChannelResult.Outcome.NOT_CONFIGURED)
            .allMatch(result -> result.outcome() == ChannelResult.Outcome.PERMANENT_FAILURE);
  }

  public DeliveryStatus deliveryStatus() {
    if (delivered()) {
      return DeliveryStatus.SENT;
    }
    return nothingAttempted() ? DeliveryStatus.SKIPPED : DeliveryStatus.FAILED;
  }

  /** Short outcome label written to the audit log. */
  public String outcome() {
    if (delivered()) {
      return "sent";
    }
    if (nothingAttempted()) {
      return "not_configured";
    }
    return permanentlyFailed() ? "permanent" : "transient";
  }

  /** Joined error messages of failed channels, or {@code null} when delivered. */
  public String errorSummary() {
    if (delivered()) {
      return null;
    }
    if (nothingAttempted()) {
      return "no notification channel configured";
    }
    return results.stream()
        .filter(result -> result.error() != null)
        .map(result -> result.channel().value() + ": " + result.error())
        .collect(Collectors.joining("; "));
  }

  public List<Map<String, Object>> toDetail() {
    return results.stream().map(ChannelResult::toDetail).toList();
  }
}
