/*
 * どこで: Backup monitor 通知チャネル
 * 何を: 通知送信の抽象化インターフェース
 * なぜ: push/email の実送信とテスト差し替えを同じ契約で扱うため
 */
package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.model.ChannelKind;
import com.example.backupmonitor.model.OverdueAlert;

public interface NotificationChannel {

  ChannelKind kind();

  /** Whether the channel has the settings it needs; unconfigured channels are never called. */
  boolean isConfigured();

  /**
   * Performs one delivery attempt.
   *
   * @throws ChannelDeliveryException when the attempt fails, classified as transient or permanent
   */
  void send(OverdueAlert alert);
}
