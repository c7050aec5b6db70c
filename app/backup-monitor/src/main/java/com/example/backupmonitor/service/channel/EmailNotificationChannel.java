/*
 * どこで: Backup monitor 通知チャネル
 * 何を: SMTP(JavaMailSender) で遅延/回復通知メールを送る
 * なぜ: push を使わない運用者にも同じ通知を届けるため
 */
package com.example.backupmonitor.service.channel;

import com.example.backupmonitor.config.ChannelSettings;
import com.example.backupmonitor.config.NotificationChannelProperties;
import com.example.backupmonitor.model.ChannelKind;
import com.example.backupmonitor.model.OverdueAlert;
import jakarta.mail.SendFailedException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Email channel. Only configured when the email settings are enabled and a {@link JavaMailSender}
 * exists, which Spring Boot creates once {@code spring.mail.host} is set.
 */
@Component
public class EmailNotificationChannel implements NotificationChannel {

  private static final Logger logger = LoggerFactory.getLogger(EmailNotificationChannel.class);

  private final ObjectProvider<JavaMailSender> mailSenderProvider;
  private final Optional<ChannelSettings.EmailSettings> settings;

  public EmailNotificationChannel(
      ObjectProvider<JavaMailSender> mailSenderProvider,
      NotificationChannelProperties channelProperties) {
    this.mailSenderProvider = mailSenderProvider;
    this.settings = channelProperties.emailSettings();
  }

  @Override
  public ChannelKind kind() {
    return ChannelKind.EMAIL;
  }

  @Override
  public boolean isConfigured() {
    return settings.isPresent() && mailSenderProvider.getIfAvailable() != null;
  }

  @Override
  public void send(OverdueAlert alert) {
    final ChannelSettings.EmailSettings email =
        settings.orElseThrow(() -> new IllegalStateException("email channel is not configured"));
    final JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
    if (mailSender == null) {
      throw new IllegalStateException("email channel has no mail sender");
    }
    final SimpleMailMessage message = new SimpleMailMessage();
    message.setFrom(email.from());
    message.setTo(email.to().toArray(String[]::new));
    message.setSubject(email.subjectPrefix() + " " + AlertMessages.title(alert));
    message.setText(AlertMessages.body(alert));
    try {
      mailSender.send(message);
      logger.info("email notification sent jobId={} kind={} recipients={}", alert.jobId(),
          alert.kind(), email.to().size());
    } catch (MailAuthenticationException | MailParseException | MailPreparationException ex) {
      throw new ChannelDeliveryException(
          ChannelKind.EMAIL,
          ChannelDeliveryException.Kind.PERMANENT,
          "email rejected before delivery: " + ex.getMessage(),
          ex);
    } catch (MailSendException ex) {
      throw mapSendException(ex);
    } catch (MailException ex) {
      throw new ChannelDeliveryException(
          ChannelKind.EMAIL, ChannelDeliveryException.Kind.TRANSIENT, ex.getMessage(), ex);
    }
  }

  private ChannelDeliveryException mapSendException(MailSendException ex) {
    // 宛先不正は再送しても成功しないため恒久失敗として扱う
    final boolean invalidAddress =
        ex.getFailedMessages().values().stream()
            .anyMatch(
                failure ->
                    failure instanceof SendFailedException sendFailed
                        && sendFailed.getInvalidAddresses() != null
                        && sendFailed.getInvalidAddresses().length > 0);
    if (invalidAddress) {
      return new ChannelDeliveryException(
          ChannelKind.EMAIL,
          ChannelDeliveryException.Kind.PERMANENT,
          "email recipient address rejected",
          ex);
    }
    return new ChannelDeliveryException(
        ChannelKind.EMAIL, ChannelDeliveryException.Kind.TRANSIENT, "email send failed", ex);
  }
}
