/*
 * Where: shared JDBC helpers
 * What: converts Instant values to java.sql.Timestamp and back
 * Why: the PostgreSQL driver cannot infer a type for a bare Instant parameter
 */
package com.example.matrimony.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; Timestamp.from keeps them in UTC regardless of the DB session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
