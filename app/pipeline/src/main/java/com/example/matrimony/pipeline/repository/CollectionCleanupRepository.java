/*
 * Where: pipeline data access
 * What: age-based delete/count over an allowlisted table and timestamp column
 * Why: identifiers cannot be bound as parameters, so they are checked before being spliced into SQL
 */
package com.example.matrimony.pipeline.repository;

import static com.example.matrimony.common.JdbcTimestampUtils.toTimestamp;

import com.example.matrimony.pipeline.config.CleanupProperties;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CollectionCleanupRepository {

  private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");
  // pipeline tables whose live rows must survive age-based cleanup
  private static final Map<String, String> ACTIVE_ROW_GUARDS =
      Map.of(
          "notification_queue", " AND status IN ('SENT', 'FAILED')",
          "job_executions", " AND status <> 'RUNNING'");

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Set<String> allowedCollections;

  public CollectionCleanupRepository(
      NamedParameterJdbcTemplate jdbcTemplate, CleanupProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.allowedCollections = Set.copyOf(properties.allowedCollections());
  }

  public boolean isAllowed(String collection) {
    return collection != null && allowedCollections.contains(collection);
  }

  public int deleteOlderThan(String collection, String timestampField, Instant threshold) {
    final String sql =
        "DELETE FROM "
            + checkCollection(collection)
            + " WHERE "
            + checkField(timestampField)
            + " < :threshold"
            + ACTIVE_ROW_GUARDS.getOrDefault(collection, "");
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countOlderThan(String collection, String timestampField, Instant threshold) {
    final String sql =
        "SELECT COUNT(*) FROM "
            + checkCollection(collection)
            + " WHERE "
            + checkField(timestampField)
            + " < :threshold"
            + ACTIVE_ROW_GUARDS.getOrDefault(collection, "");
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public static boolean isValidIdentifier(String identifier) {
    return identifier != null && IDENTIFIER.matcher(identifier).matches();
  }

  private String checkCollection(String collection) {
    if (!isAllowed(collection) || !isValidIdentifier(collection)) {
      throw new IllegalArgumentException("collection is not allowed for cleanup: " + collection);
    }
    return collection;
  }

  private String checkField(String field) {
    if (!isValidIdentifier(field)) {
      throw new IllegalArgumentException("invalid timestamp field: " + field);
    }
    return field;
  }
}
