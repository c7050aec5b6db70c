/*
 * どこで: Backup monitor の設定バインド
 * 何を: push(ntfy 互換)/email 通知チャネルの接続設定を保持する
 * なぜ: 有効化されたチャネルの必須項目を起動時に検証し、型付き設定へ変換するため
 */
package com.example.backupmonitor.config;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "backup-monitor.channels")
@Validated
public record NotificationChannelProperties(@Valid Push push, @Valid Email email) {

  private static final Pattern TOPIC_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");
  private static final int DEFAULT_PRIORITY = 4;

  public NotificationChannelProperties {
    push = push == null ? new Push(false, null, null, null, null, null) : push;
    email = email == null ? new Email(false, null, null, null) : email;
  }

  public record Push(
      boolean enabled,
      String serverUrl,
      String topic,
      String accessToken,
      Integer priority,
      List<String> tags) {

    @AssertTrue(message = "backup-monitor.channels.push.server-url must be an absolute http(s) URL")
    public boolean isServerUrlValid() {
      return !enabled || parseServerUrl(serverUrl).isPresent();
    }

    @AssertTrue(message = "backup-monitor.channels.push.topic must match [A-Za-z0-9_-]{1,64}")
    public boolean isTopicValid() {
      return !enabled || (topic != null && TOPIC_PATTERN.matcher(topic).matches());
    }

    @AssertTrue(message = "backup-monitor.channels.push.priority must be between 1 and 5")
    public boolean isPriorityValid() {
      return priority == null || (priority >= 1 && priority <= 5);
    }
  }

  public record Email(boolean enabled, String from, List<String> to, String subjectPrefix) {

    @AssertTrue(message = "backup-monitor.channels.email.from must be a valid address")
    public boolean isFromValid() {
      return !enabled || isValidAddress(from);
    }

    @AssertTrue(message = "backup-monitor.channels.email.to must contain valid addresses")
    public boolean isRecipientsValid() {
      if (!enabled) {
        return true;
      }
      return to != null
          && !to.isEmpty()
          && to.stream().allMatch(NotificationChannelProperties::isValidAddress);
    }
  }

  /** Typed settings of every enabled channel, in declaration order. */
  public List<ChannelSettings> enabledSettings() {
    final List<ChannelSettings> settings = new ArrayList<>();
    pushSettings().ifPresent(settings::add);
    emailSettings().ifPresent(settings::add);
    return settings;
  }

  public Optional<ChannelSettings.PushSettings> pushSettings() {
    if (!push.enabled()) {
      return Optional.empty();
    }
    final URI serverUrl =
        parseServerUrl(push.serverUrl())
            .orElseThrow(() -> new IllegalStateException("push server-url is invalid"));
    return Optional.of(
        new ChannelSettings.PushSettings(
            serverUrl,
            push.topic(),
            push.accessToken(),
            push.priority() == null ? DEFAULT_PRIORITY : push.priority(),
            push.tags()));
  }

  public Optional<ChannelSettings.EmailSettings> emailSettings() {
    if (!email.enabled()) {
      return Optional.empty();
    }
    final String prefix =
        email.subjectPrefix() == null ? "[backup-monitor]" : email.subjectPrefix();
    return Optional.of(new ChannelSettings.EmailSettings(email.from(), email.to(), prefix));
  }

  private static Optional<URI> parseServerUrl(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      final URI uri = URI.create(value.trim());
      final String scheme = uri.getScheme();
      if (uri.getHost() == null
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        return Optional.empty();
      }
      return Optional.of(uri);
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }

  private static boolean isValidAddress(String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    try {
      new InternetAddress(value, true).validate();
      return true;
    } catch (AddressException ex) {
      return false;
    }
  }
}
