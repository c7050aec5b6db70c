/*
 * どこで: Backup monitor 通知チャネル
 * 何を: チャネル単位の送信結果
 * なぜ: 監査ログとメトリクスにチャネルごとの成否と試行回数を残すため
 */
package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.model.ChannelKind;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public record ChannelResult(ChannelKind channel, Outcome outcome, int attempts, String error) {

  public enum Outcome {
    SENT,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE,
    NOT_CONFIGURED;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public static ChannelResult sent(ChannelKind channel, int attempts) {
    return new ChannelResult(channel, Outcome.SENT, attempts, null);
  }

  public static ChannelResult transientFailure(ChannelKind channel, int attempts, String error) {
    return new ChannelResult(channel, Outcome.TRANSIENT_FAILURE, attempts, error);
  }

  public static ChannelResult permanentFailure(ChannelKind channel, int attempts, String error) {
    return new ChannelResult(channel, Outcome.PERMANENT_FAILURE, attempts, error);
  }

  public static ChannelResult notConfigured(ChannelKind channel) {
    return new ChannelResult(channel, Outcome.NOT_CONFIGURED, 0, null);
  }

  public boolean sent() {
    return outcome == Outcome.SENT;
  }

  public Map<String, Object> toDetail() {
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("channel", channel.value());
    detail.put("outcome", outcome.value());
    detail.put("attempts", attempts);
    if (error != null) {
      detail.put("error", error);
    }
    return detail;
  }
}
