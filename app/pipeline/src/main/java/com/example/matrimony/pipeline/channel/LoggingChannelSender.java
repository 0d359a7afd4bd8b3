/*
 * Where: pipeline channel layer
 * What: sender that only logs the message it would deliver
 * Why: lets the whole pipeline run without external providers
 */
package com.example.matrimony.pipeline.channel;

import com.example.matrimony.pipeline.model.NotificationChannel;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingChannelSender implements ChannelSender {

    private static final Logger logger = LoggerFactory.getLogger(LoggingChannelSender.class);

    private final NotificationChannel channel;

    public LoggingChannelSender(NotificationChannel channel) {
        this.channel = channel;
    }

    @Override
    public NotificationChannel channel() {
        return channel;
    }

    @Override
    public SendResult send(String address, String subject, String body) {
        // no real send; only the body length is logged since bodies may carry personal details
        String messageId = "local-" + UUID.randomUUID();
        logger.info("notification simulated send channel={} address={} subject={} bodyLength={} messageId={}",
                channel.value(),
                address,
                subject,
                body == null ? 0 : body.length(),
                messageId);
        return SendResult.sent(messageId);
    }
}
