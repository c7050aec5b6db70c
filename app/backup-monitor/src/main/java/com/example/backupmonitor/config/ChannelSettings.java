/*
 * どこで: Backup monitor の通知チャネル設定
 * 何を: チャネル種別ごとに必須項目を持つタグ付きバリアント
 * なぜ: 送信時ではなく設定読み込み時に不足・不正を検出するため
 */
package com.example.backupmonitor.config;

import com.example.backupmonitor.model.ChannelKind;
import java.net.URI;
import java.util.List;

public sealed interface ChannelSettings
    permits ChannelSettings.PushSettings, ChannelSettings.EmailSettings {

  ChannelKind kind();

  record PushSettings(
      URI serverUrl, String topic, String accessToken, int priority, List<String> tags)
      implements ChannelSettings {

    public PushSettings {
      tags = tags == null ? List.of() : List.copyOf(tags);
    }

    @Override
    public ChannelKind kind() {
      return ChannelKind.PUSH;
    }

    public boolean hasAccessToken() {
      return accessToken != null && !accessToken.isBlank();
    }
  }

  record EmailSettings(String from, List<String> to, String subjectPrefix)
      implements ChannelSettings {

    public EmailSettings {
      to = List.copyOf(to);
    }

    @Override
    public ChannelKind kind() {
      return ChannelKind.EMAIL;
    }
  }
}
