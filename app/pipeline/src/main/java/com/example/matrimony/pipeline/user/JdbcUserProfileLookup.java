/*
 * Where: user data collaborator
 * What: UserProfileLookup over the user_profiles table
 */
package com.example.matrimony.pipeline.user;

import com.example.matrimony.pipeline.model.NotificationChannel;
import com.example.matrimony.pipeline.model.RecipientScope;
import com.example.matrimony.pipeline.model.UserProfile;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

@Component
@RequiredArgsConstructor
public class JdbcUserProfileLookup implements UserProfileLookup {

  private static final String SELECT_COLUMNS =
      """
      SELECT identifier, first_name, last_name, email, phone, push_token, preferred_channel,
             email_opt_in, sms_opt_in, push_opt_in, active
      FROM user_profiles
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public Optional<UserProfile> resolve(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      return Optional.empty();
    }
    final String sql = SELECT_COLUMNS + "WHERE identifier = :identifier";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("identifier", identifier);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public boolean disableChannel(String identifier, NotificationChannel channel) {
    final String column = optInColumn(channel);
    // rows already opted out are left untouched, so replays write nothing
    final String sql =
        "UPDATE user_profiles SET "
            + column
            + " = FALSE, updated_at = :now WHERE identifier = :identifier AND "
            + column
            + " = TRUE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(Instant.now(clock)))
            .addValue("identifier", identifier);
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public List<UserProfile> findRecipients(RecipientScope scope, int limit) {
    final String where =
        switch (scope) {
          case ACTIVE_USERS -> "WHERE active = TRUE ";
          case ALL_USERS -> "";
          case OWNER -> throw new IllegalArgumentException("OWNER scope is resolved by identifier");
        };
    final String sql = SELECT_COLUMNS + where + "ORDER BY identifier LIMIT :limit";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private String optInColumn(NotificationChannel channel) {
    return switch (channel) {
      case EMAIL -> "email_opt_in";
      case SMS -> "sms_opt_in";
      case PUSH -> "push_opt_in";
    };
  }

  private UserProfile mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String preferred = rs.getString("preferred_channel");
    return new UserProfile(
        rs.getString("identifier"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("push_token"),
        preferred == null ? null : NotificationChannel.fromValue(preferred),
        rs.getBoolean("email_opt_in"),
        rs.getBoolean("sms_opt_in"),
        rs.getBoolean("push_opt_in"),
        rs.getBoolean("active"));
  }
}
