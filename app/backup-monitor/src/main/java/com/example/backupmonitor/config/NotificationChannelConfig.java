/*
 * どこで: Backup monitor の通知チャネル設定
 * 何を: push 通知用 RestClient を送信タイムアウト付きで生成し、再試行待ちの sleeper を定義する。
 *       起動完了時に有効なチャネルを出力する
 * なぜ: 1 回の送信が tick 全体を塞がないよう接続/読み取り時間を制限するため
 */
package com.example.backupmonitor.config;

import com.example.backupmonitor.service.channel.BackoffSleeper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class NotificationChannelConfig {

  private static final Logger logger = LoggerFactory.getLogger(NotificationChannelConfig.class);

  private final NotificationChannelProperties channelProperties;

  public NotificationChannelConfig(NotificationChannelProperties channelProperties) {
    this.channelProperties = channelProperties;
  }

  @Bean
  RestClient pushRestClient(
      RestClient.Builder builder, NotificationDeliveryProperties deliveryProperties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(deliveryProperties.sendTimeout());
    requestFactory.setReadTimeout(deliveryProperties.sendTimeout());
    // baseUrl はトピック単位の設定に依存するため、ここでは持たせない
    return builder.requestFactory(requestFactory).build();
  }

  @Bean
  BackoffSleeper backoffSleeper() {
    return duration -> Thread.sleep(duration.toMillis());
  }

  @EventListener(ApplicationReadyEvent.class)
  void logEnabledChannels() {
    final List<String> enabled =
        channelProperties.enabledSettings().stream()
            .map(settings -> settings.kind().value())
            .toList();
    if (enabled.isEmpty()) {
      // エピソードは記録されるが通知は SKIPPED になる
      logger.warn("no notification channel enabled, overdue episodes will not be delivered");
      return;
    }
    logger.info("notification channels enabled channels={}", enabled);
  }
}
