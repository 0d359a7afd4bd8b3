/*
 * Where: pipeline integration test
 * What: a published domain event is queued, rendered, sent and logged exactly once
 * Why: covers the path from EventDispatcher through the queue to the channel sender
 */
package com.example.matrimony.pipeline.delivery;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.matrimony.pipeline.AbstractPostgresContainerTest;
import com.example.matrimony.pipeline.event.FavoriteAddedEvent;
import com.example.matrimony.pipeline.event.NotificationTriggers;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.NotificationRecord;
import com.example.matrimony.pipeline.model.NotificationStatus;
import com.example.matrimony.pipeline.repository.NotificationLogRepository;
import com.example.matrimony.pipeline.repository.NotificationPreferenceRepository;
import com.example.matrimony.pipeline.repository.NotificationQueueRepository;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class EventToDeliveryIntegrationTest extends AbstractPostgresContainerTest {

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    @Autowired
    private NotificationDeliveryService deliveryService;

    @Autowired
    private NotificationQueueRepository queueRepository;

    @Autowired
    private NotificationLogRepository logRepository;

    @Autowired
    private NotificationPreferenceRepository preferenceRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void seed() {
        MapSqlParameterSource none = new MapSqlParameterSource();
        jdbcTemplate.update("DELETE FROM notification_queue", none);
        jdbcTemplate.update("DELETE FROM notification_log", none);
        jdbcTemplate.update("DELETE FROM user_profiles", none);
        jdbcTemplate.update("DELETE FROM notification_channel_preferences", none);
        jdbcTemplate.update(
                """
                INSERT INTO user_profiles (identifier, first_name, last_name, email, push_opt_in)
                VALUES ('u_target', 'Asha', 'Rao', 'asha@example.com', FALSE),
                       ('u_actor', 'Ravi', 'Kumar', 'ravi@example.com', TRUE)
                """,
                none);
    }

    @Test
    void favoriteAddedIsDeliveredByEmailOnce() {
        eventPublisher.publishEvent(new FavoriteAddedEvent("u_actor", "u_target"));

        List<NotificationRecord> queued = queueRepository.findByRecipient("u_target");
        assertThat(queued).singleElement().satisfies(record -> {
            assertThat(record.channel()).isEqualTo(NotificationChannel.EMAIL);
            assertThat(record.status()).isEqualTo(NotificationStatus.PENDING);
            assertThat(record.templateDataJson()).contains("Ravi");
        });

        DrainSummary first = deliveryService.drain(NotificationChannel.EMAIL, 10, null);
        DrainSummary second = deliveryService.drain(NotificationChannel.EMAIL, 10, null);

        assertThat(first.sent()).isEqualTo(1);
        assertThat(second.sent()).isZero();
        NotificationRecord delivered = queueRepository.findByRecipient("u_target").get(0);
        assertThat(delivered.status()).isEqualTo(NotificationStatus.SENT);
        assertThat(delivered.attempts()).isEqualTo(1);
        assertThat(delivered.sentAt()).isNotNull();
        assertThat(logRepository.countByNotificationId(delivered.notificationId())).isEqualTo(1);
    }

    @Test
    void channelSwitchedOffByTheRecipientIsNeverQueued() {
        preferenceRepository.setChannelEnabled(
                "u_target", NotificationTriggers.FAVORITE_ADDED, NotificationChannel.EMAIL, false, Instant.now());

        eventPublisher.publishEvent(new FavoriteAddedEvent("u_actor", "u_target"));

        assertThat(queueRepository.findByRecipient("u_target")).isEmpty();
    }
}
