/*
 * Where: pipeline channel configuration
 * What: registers one ChannelSender per channel
 * Why: email switches between logging and SMTP; SMS and push only log
 */
package com.example.matrimony.pipeline.channel;

import com.example.matrimony.pipeline.config.EmailChannelProperties;
import com.example.matrimony.pipeline.model.NotificationChannel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
public class ChannelSenderConfig {

  @Bean
  @ConditionalOnProperty(
      name = "pipeline.channels.email.mode",
      havingValue = "log",
      matchIfMissing = true)
  public ChannelSender loggingEmailSender() {
    return new LoggingChannelSender(NotificationChannel.EMAIL);
  }

  @Bean
  @ConditionalOnProperty(name = "pipeline.channels.email.mode", havingValue = "smtp")
  public ChannelSender smtpEmailSender(
      JavaMailSender mailSender, EmailChannelProperties properties) {
    return new SmtpEmailChannelSender(mailSender, properties);
  }

  @Bean
  public ChannelSender loggingSmsSender() {
    return new LoggingChannelSender(NotificationChannel.SMS);
  }

  @Bean
  public ChannelSender loggingPushSender() {
    return new LoggingChannelSender(NotificationChannel.PUSH);
  }
}
