/*
 * Where: pipeline channel layer
 * What: email sender over Spring's JavaMailSender
 * Why: used when pipeline.channels.email.mode=smtp
 */
package com.example.matrimony.pipeline.channel;

import com.example.matrimony.pipeline.config.EmailChannelProperties;
import com.example.matrimony.pipeline.model.NotificationChannel;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

public class SmtpEmailChannelSender implements ChannelSender {

  private static final Logger logger = LoggerFactory.getLogger(SmtpEmailChannelSender.class);

  private final JavaMailSender mailSender;
  private final String fromAddress;

  public SmtpEmailChannelSender(JavaMailSender mailSender, EmailChannelProperties properties) {
    this.mailSender = mailSender;
    this.fromAddress = properties.fromAddress();
  }

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.EMAIL;
  }

  @Override
  public SendResult send(String address, String subject, String body) {
    try {
      final MimeMessage message = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
      helper.setFrom(fromAddress);
      helper.setTo(address);
      helper.setSubject(subject == null ? "" : subject);
      helper.setText(body, false);
      mailSender.send(message);
      final String messageId = message.getMessageID();
      logger.info("email sent address={} messageId={}", address, messageId);
      return SendResult.sent(messageId);
    } catch (MessagingException | MailException ex) {
      logger.warn("email send failed address={} error={}", address, ex.getMessage());
      return SendResult.failed(ex.getMessage());
    }
  }
}
