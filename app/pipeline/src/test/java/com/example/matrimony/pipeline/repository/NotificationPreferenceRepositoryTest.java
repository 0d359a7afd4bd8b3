/*
 * Where: pipeline integration test
 * What: quiet hours and channel switch upserts on Postgres
 * Why: missing rows must read as defaults, not as errors
 */
package com.example.matrimony.pipeline.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.matrimony.pipeline.AbstractPostgresContainerTest;
import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.QuietHoursWindow;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationPreferenceRepositoryTest extends AbstractPostgresContainerTest {

    @Autowired
    private NotificationPreferenceRepository preferenceRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanup() {
        jdbcTemplate.update("DELETE FROM notification_preferences", new MapSqlParameterSource());
        jdbcTemplate.update("DELETE FROM notification_channel_preferences", new MapSqlParameterSource());
    }

    @Test
    void recipientWithoutPreferencesKeepsDefaults() {
        assertThat(preferenceRepository.findQuietHours("u_none")).isEmpty();
        assertThat(preferenceRepository.isChannelEnabled("u_none", "favorite_added", NotificationChannel.SMS))
                .isTrue();
    }

    @Test
    void quietHoursAreUpsertedPerRecipient() {
        Instant now = Instant.now();
        preferenceRepository.saveQuietHours(
                "u_1", new QuietHoursWindow(true, LocalTime.of(23, 0), LocalTime.of(7, 0), ZoneId.of("UTC")), now);
        preferenceRepository.saveQuietHours(
                "u_1",
                new QuietHoursWindow(true, LocalTime.of(21, 30), LocalTime.of(6, 0), ZoneId.of("Asia/Kolkata")),
                now);

        QuietHoursWindow stored = preferenceRepository.findQuietHours("u_1").orElseThrow();
        assertThat(stored.start()).isEqualTo(LocalTime.of(21, 30));
        assertThat(stored.end()).isEqualTo(LocalTime.of(6, 0));
        assertThat(stored.zone()).isEqualTo(ZoneId.of("Asia/Kolkata"));
    }

    @Test
    void channelSwitchIsScopedToTriggerAndChannel() {
        Instant now = Instant.now();
        preferenceRepository.setChannelEnabled("u_2", "profile_viewed", NotificationChannel.PUSH, false, now);

        assertThat(preferenceRepository.isChannelEnabled("u_2", "profile_viewed", NotificationChannel.PUSH))
                .isFalse();
        assertThat(preferenceRepository.isChannelEnabled("u_2", "profile_viewed", NotificationChannel.EMAIL))
                .isTrue();
        assertThat(preferenceRepository.isChannelEnabled("u_2", "favorite_added", NotificationChannel.PUSH))
                .isTrue();

        preferenceRepository.setChannelEnabled("u_2", "profile_viewed", NotificationChannel.PUSH, true, now);
        assertThat(preferenceRepository.isChannelEnabled("u_2", "profile_viewed", NotificationChannel.PUSH))
                .isTrue();
    }
}
