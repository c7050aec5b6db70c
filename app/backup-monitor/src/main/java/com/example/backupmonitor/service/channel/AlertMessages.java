/*
 * どこで: Backup monitor 通知チャネル
 * 何を: 通知種別ごとの件名と本文を組み立てる
 * なぜ: push と email で同じ文面を使い、チャネル間で表現がずれないようにするため
 */
package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.model.OverdueAlert;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

final class AlertMessages {

  private AlertMessages() {}

  static String title(OverdueAlert alert) {
    return switch (alert.kind()) {
      case OVERDUE -> "Backup overdue: " + alert.jobName();
      case ESCALATION -> "Backup still overdue: " + alert.jobName();
      case RECOVERED -> "Backup recovered: " + alert.jobName();
    };
  }

  static String body(OverdueAlert alert) {
    final StringBuilder body = new StringBuilder();
    body.append("Backup job ").append(alert.jobName());
    switch (alert.kind()) {
      case OVERDUE -> body.append(" has not reported a successful run on time.");
      case ESCALATION ->
          body.append(" is still overdue (since ")
              .append(format(alert.episodeStartedAt()))
              .append(").");
      case RECOVERED -> body.append(" reported a new successful run.");
    }
    body.append('\n').append("Last successful run: ").append(format(alert.lastSeenAt()));
    if (alert.kind() != OverdueAlert.Kind.RECOVERED && alert.expectedAt() != null) {
      body.append('\n').append("Expected by: ").append(format(alert.expectedAt()));
      final Duration late = Duration.between(alert.expectedAt(), alert.occurredAt());
      if (!late.isNegative()) {
        body.append('\n').append("Overdue by: ").append(humanize(late));
      }
    }
    return body.toString();
  }

  private static String format(Instant instant) {
    return instant == null ? "never" : DateTimeFormatter.ISO_INSTANT.format(instant);
  }

  static String humanize(Duration duration) {
    final long days = duration.toDays();
    final long hours = duration.toHoursPart();
    final long minutes = duration.toMinutesPart();
    if (days > 0) {
      return days + "d " + hours + "h";
    }
    if (hours > 0) {
      return hours + "h " + minutes + "m";
    }
    return minutes + "m";
  }
}
