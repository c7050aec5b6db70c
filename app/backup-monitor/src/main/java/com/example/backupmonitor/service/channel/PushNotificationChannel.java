/*
 * どこで: Backup monitor 通知チャネル
 * 何を: ntfy 互換の push サーバへトピック宛てに通知を POST する
 * なぜ: 運用者の端末へ即時に遅延を知らせるため
 */
package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.config.ChannelSettings;
import com.example.backupmonitor.config.NotificationChannelProperties;
import com.example.backupmonitor.model.ChannelKind;
import com.example.backupmonitor.model.OverdueAlert;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class PushNotificationChannel implements NotificationChannel {

  private static final Logger logger = LoggerFactory.getLogger(PushNotificationChannel.class);
  private static final int TOO_MANY_REQUESTS = 429;

  private final RestClient pushRestClient;
  private final Optional<ChannelSettings.PushSettings> settings;

  public PushNotificationChannel(
      RestClient pushRestClient, NotificationChannelProperties channelProperties) {
    this.pushRestClient = pushRestClient;
    this.settings = channelProperties.pushSettings();
  }

  @Override
  public ChannelKind kind() {
    return ChannelKind.PUSH;
  }

  @Override
  public boolean isConfigured() {
    return settings.isPresent();
  }

  @Override
  public void send(OverdueAlert alert) {
    final ChannelSettings.PushSettings push =
        settings.orElseThrow(() -> new IllegalStateException("push channel is not configured"));
    final URI target =
        UriComponentsBuilder.fromUri(push.serverUrl()).pathSegment(push.topic()).build().toUri();
    try {
      final RestClient.RequestBodySpec spec =
          pushRestClient
              .post()
              .uri(target)
              .contentType(MediaType.TEXT_PLAIN)
              .header("Title", AlertMessages.title(alert))
              .header("Priority", String.valueOf(priorityFor(alert, push)))
              .header("Tags", String.join(",", tagsFor(alert, push)));
      if (push.hasAccessToken()) {
        spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + push.accessToken());
      }
      spec.body(AlertMessages.body(alert)).retrieve().toBodilessEntity();
      logger.info("push notification sent jobId={} kind={} topic={}", alert.jobId(), alert.kind(),
          push.topic());
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      final String reason = isTimeout(ex) ? "push request timeout" : "push connection failed";
      throw new ChannelDeliveryException(
          ChannelKind.PUSH, ChannelDeliveryException.Kind.TRANSIENT, reason, ex);
    }
  }

  private int priorityFor(OverdueAlert alert, ChannelSettings.PushSettings push) {
    // 回復通知は既定優先度まで下げる
    return alert.kind() == OverdueAlert.Kind.RECOVERED ? 3 : push.priority();
  }

  private List<String> tagsFor(OverdueAlert alert, ChannelSettings.PushSettings push) {
    final List<String> tags = new ArrayList<>();
    tags.add(
        switch (alert.kind()) {
          case OVERDUE -> "warning";
          case ESCALATION -> "rotating_light";
          case RECOVERED -> "white_check_mark";
        });
    tags.addAll(push.tags());
    return tags;
  }

  private ChannelDeliveryException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (ex.getStatusCode().is5xxServerError() || status == TOO_MANY_REQUESTS) {
      return new ChannelDeliveryException(
          ChannelKind.PUSH,
          ChannelDeliveryException.Kind.TRANSIENT,
          "push server unavailable status=" + status,
          ex);
    }
    if (status == 401 || status == 403) {
      return new ChannelDeliveryException(
          ChannelKind.PUSH,
          ChannelDeliveryException.Kind.PERMANENT,
          "push server rejected credentials status=" + status,
          ex);
    }
    return new ChannelDeliveryException(
        ChannelKind.PUSH,
        ChannelDeliveryException.Kind.PERMANENT,
        "push server rejected topic or message status=" + status,
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
