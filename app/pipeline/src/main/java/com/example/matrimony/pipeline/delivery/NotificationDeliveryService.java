/*
 * Where: pipeline delivery
 * What: drains pending notifications of one channel: render, send, record the outcome
 * Why: owns retry limits, failure classification and the opt-out sync
 */
package com.example.matrimony.pipeline.delivery;

import com.example.matrimony.pipeline.channel.ChannelSender;
import com.example.matrimony.pipeline.channel.ChannelSenderRegistry;
import com.example.matrimony.pipeline.channel.ProviderErrorClassifier;
import com.example.matrimony.pipeline.channel.ProviderErrorClassifier.FailureKind;
import com.example.matrimony.pipeline.channel.SendResult;
import com.example.matrimony.pipeline.config.DeliveryProperties;
import com.example.matrimony.pipeline.config.ExecutorConfig;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationRecord;
import com.example.matrimony.pipeline.model.NotificationStatus;
import com.example.matrimony.pipeline.model.NotificationTemplate;
import com.example.matrimony.pipeline.model.UserProfile;
import com.example.matrimony.pipeline.repository.NotificationLogRepository;
import com.example.matrimony.pipeline.repository.NotificationQueueRepository;
import com.example.matrimony.pipeline.repository.NotificationTemplateRepository;
import com.example.matrimony.pipeline.template.RenderedMessage;
import com.example.matrimony.pipeline.template.TemplateRenderer;
import com.example.matrimony.pipeline.user.UserProfileLookup;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class NotificationDeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
    private static final TypeReference<Map<String, Object>> TEMPLATE_DATA_TYPE = new TypeReference<>() {};

    enum Outcome {
        SENT,
        FAILED,
        RETRIED,
        SKIPPED
    }

    private final NotificationQueueService queueService;
    private final NotificationQueueRepository queueRepository;
    private final NotificationLogRepository logRepository;
    private final NotificationTemplateRepository templateRepository;
    private final UserProfileLookup userProfileLookup;
    private final TemplateRenderer renderer;
    private final ChannelSenderRegistry senderRegistry;
    private final ProviderErrorClassifier errorClassifier;
    private final OptOutSynchronizer optOutSynchronizer;
    private final PipelineMetrics metrics;
    private final DeliveryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PlatformTransactionManager transactionManager;
    private final ExecutorService sendExecutor;

    public NotificationDeliveryService(
            NotificationQueueService queueService,
            NotificationQueueRepository queueRepository,
            NotificationLogRepository logRepository,
            NotificationTemplateRepository templateRepository,
            UserProfileLookup userProfileLookup,
            TemplateRenderer renderer,
            ChannelSenderRegistry senderRegistry,
            ProviderErrorClassifier errorClassifier,
            OptOutSynchronizer optOutSynchronizer,
            PipelineMetrics metrics,
            DeliveryProperties properties,
            ObjectMapper objectMapper,
            Clock clock,
            PlatformTransactionManager transactionManager,
            @Qualifier(ExecutorConfig.CHANNEL_SEND_EXECUTOR) ExecutorService sendExecutor) {
        this.queueService = queueService;
        this.queueRepository = queueRepository;
        this.logRepository = logRepository;
        this.templateRepository = templateRepository;
        this.userProfileLookup = userProfileLookup;
        this.renderer = renderer;
        this.senderRegistry = senderRegistry;
        this.errorClassifier = errorClassifier;
        this.optOutSynchronizer = optOutSynchronizer;
        this.metrics = metrics;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.transactionManager = transactionManager;
        this.sendExecutor = sendExecutor;
    }

    /**
     * Sends up to {@code batchSize} pending notifications of the channel, oldest first.
     *
     * @param testAddress when non-null every message goes to this address instead of the member's
     */
    public DrainSummary drain(NotificationChannel channel, int batchSize, String testAddress) {
        List<NotificationRecord> batch = queueService.claimBatch(channel, batchSize);
        int sent = 0;
        int failed = 0;
        int retried = 0;
        for (NotificationRecord record : batch) {
            if (Thread.currentThread().isInterrupted()) {
                // interrupted by the job timeout; the rest waits for the next drain
                logger.warn("drain interrupted channel={} remaining={}", channel.value(),
                        batch.size() - (sent + failed + retried));
                break;
            }
            Outcome outcome = deliver(record, testAddress);
            switch (outcome) {
                case SENT -> sent++;
                case FAILED -> failed++;
                case RETRIED -> retried++;
                case SKIPPED -> {
                }
            }
        }
        metrics.updateBacklog(channel, queueRepository.countPending(channel));
        DrainSummary summary = new DrainSummary(sent, failed, retried);
        logger.info("drain finished channel={} sent={} failed={} retried={}",
                channel.value(), sent, failed, retried);
        return summary;
    }

    @VisibleForTesting
    Outcome deliver(NotificationRecord record, String testAddress) {
        try {
            Map<String, Object> templateData = parseTemplateData(record);
            NotificationTemplate template = templateRepository.findEnabled(record.trigger(), record.channel())
                    .orElseThrow(() -> new NotificationPermanentException(
                            "no enabled template for trigger=" + record.trigger()
                                    + " channel=" + record.channel().value()));
            String address = testAddress != null ? testAddress : resolveAddress(record);
            RenderedMessage message = renderer.render(template, templateData);
            SendResult result = sendWithTimeout(senderRegistry.forChannel(record.channel()), address, message);
            if (result.success()) {
                return markSent(record);
            }
            return handleProviderFailure(record, result.errorDetail(), testAddress != null);
        } catch (NotificationPermanentException ex) {
            logger.warn("notification failed permanently id={} trigger={} reason={}",
                    record.notificationId(), record.trigger(), ex.getMessage());
            return markFailed(record, ex.getMessage(), "failed");
        } catch (RuntimeException ex) {
            logger.warn("notification delivery error id={} trigger={}", record.notificationId(), record.trigger(), ex);
            return handleTransientFailure(record, ex.getMessage());
        }
    }

    private Outcome markSent(NotificationRecord record) {
        Instant now = Instant.now(clock);
        Boolean updated = inTransaction(() -> {
            if (queueRepository.markSent(record.notificationId(), now) == 0) {
                return false;
            }
            logRepository.append(record, NotificationStatus.SENT,
                    Math.min(record.attempts() + 1, record.maxAttempts()), null, now);
            return true;
        });
        if (!Boolean.TRUE.equals(updated)) {
            logger.warn("notification sent but row was no longer pending id={}", record.notificationId());
            return Outcome.SKIPPED;
        }
        metrics.recordDelivery(record.channel(), "sent");
        metrics.recordDeliveryLatency(record.createdAt(), now);
        return Outcome.SENT;
    }

    private Outcome handleProviderFailure(NotificationRecord record, String errorDetail, boolean testMode) {
        FailureKind kind = errorClassifier.classify(errorDetail);
        switch (kind) {
            case OPTED_OUT -> {
                Outcome outcome = markFailed(record, errorDetail, "opted_out");
                // a test-address rejection says nothing about the member's own preference
                if (!testMode) {
                    optOutSynchronizer.synchronize(record.recipient(), record.channel());
                }
                return outcome;
            }
            case INVALID_RECIPIENT -> {
                return markFailed(record, errorDetail, "invalid_recipient");
            }
            default -> {
                return handleTransientFailure(record, errorDetail);
            }
        }
    }

    @VisibleForTesting
    Outcome handleTransientFailure(NotificationRecord record, String errorDetail) {
        Instant now = Instant.now(clock);
        String error = truncateError(errorDetail);
        NotificationRecord updated = inTransaction(() -> {
            NotificationRecord row = queueRepository.markAttemptFailed(record.notificationId(), error, now);
            if (row != null && row.status() == NotificationStatus.FAILED) {
                logRepository.append(row, NotificationStatus.FAILED, row.attempts(), error, now);
            }
            return row;
        });
        if (updated == null) {
            logger.warn("notification retry skipped because row was no longer pending id={}",
                    record.notificationId());
            return Outcome.SKIPPED;
        }
        if (updated.status() == NotificationStatus.FAILED) {
            metrics.recordDelivery(record.channel(), "exhausted");
            logger.warn("notification attempts exhausted id={} attempts={} error={}",
                    record.notificationId(), updated.attempts(), error);
            return Outcome.FAILED;
        }
        metrics.recordDelivery(record.channel(), "retried");
        logger.info("notification will be retried id={} attempt={} maxAttempts={}",
                record.notificationId(), updated.attempts(), updated.maxAttempts());
        return Outcome.RETRIED;
    }

    private Outcome markFailed(NotificationRecord record, String reason, String metricResult) {
        Instant now = Instant.now(clock);
        String error = truncateError(reason);
        Boolean updated = inTransaction(() -> {
            if (queueRepository.markFailed(record.notificationId(), error, now) == 0) {
                return false;
            }
            logRepository.append(record, NotificationStatus.FAILED,
                    Math.min(record.attempts() + 1, record.maxAttempts()), error, now);
            return true;
        });
        if (!Boolean.TRUE.equals(updated)) {
            logger.warn("notification failure skipped because row was no longer pending id={}",
                    record.notificationId());
            return Outcome.SKIPPED;
        }
        metrics.recordDelivery(record.channel(), metricResult);
        return Outcome.FAILED;
    }

    private Map<String, Object> parseTemplateData(NotificationRecord record) {
        String json = record.templateDataJson();
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> data = objectMapper.readValue(json, TEMPLATE_DATA_TYPE);
            return data == null ? Map.of() : data;
        } catch (JsonProcessingException ex) {
            throw new NotificationPermanentException("malformed template data", ex);
        }
    }

    private String resolveAddress(NotificationRecord record) {
        UserProfile profile = userProfileLookup.resolve(record.recipient())
                .orElseThrow(() -> new NotificationPermanentException(
                        "unknown recipient " + record.recipient()));
        String address = profile.addressFor(record.channel());
        if (address == null) {
            throw new NotificationPermanentException(
                    "recipient has no " + record.channel().value() + " address");
        }
        return address;
    }

    @VisibleForTesting
    SendResult sendWithTimeout(ChannelSender sender, String address, RenderedMessage message) {
        Duration timeout = properties.sendTimeout();
        Future<SendResult> future;
        try {
            future = sendExecutor.submit(() -> sender.send(address, message.subject(), message.body()));
        } catch (RejectedExecutionException ex) {
            return SendResult.failed("sender pool saturated");
        }
        try {
            SendResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result == null ? SendResult.failed("sender returned no result") : result;
        } catch (TimeoutException ex) {
            future.cancel(true);
            return SendResult.failed("send timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return SendResult.failed(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return SendResult.failed("send interrupted");
        }
    }

    private <T> T inTransaction(Supplier<T> work) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        return transactionTemplate.execute(status -> work.get());
    }

    private String truncateError(String message) {
        if (message == null) {
            return "unknown error";
        }
        int maxLength = properties.errorMessageMaxLength();
        if (message.length() <= maxLength) {
            return message;
        }
        return message.substring(0, maxLength);
    }
}
