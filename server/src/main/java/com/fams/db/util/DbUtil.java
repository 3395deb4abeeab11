package com.fams.db.util;

import com.fams.authz.AuthzFailure;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Utility methods for database operations. */
public final class DbUtil {

  /** SQLSTATE for unique constraint violations. */
  public static final String UNIQUE_VIOLATION = "23505";

  /** SQLSTATE for foreign key violations. */
  public static final String FOREIGN_KEY_VIOLATION = "23503";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static java.sql.Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return java.sql.Timestamp.from(instant);
  }

  /**
   * Maps a JDBC failure onto the authorization failure taxonomy. Integrity violations carry
   * meaning (a taken name, a position still referenced by users); everything else is an
   * infrastructure fault and is reported as retryable.
   */
  @Nonnull
  public static Status storageFailure(SQLException e) {
    String state = e.getSQLState();
    if (UNIQUE_VIOLATION.equals(state)) {
      return AuthzFailure.DUPLICATE_NAME.status("Unique constraint violated: " + e.getMessage(), e);
    }
    if (FOREIGN_KEY_VIOLATION.equals(state)) {
      return AuthzFailure.POSITION_IN_USE.status("Row is still referenced: " + e.getMessage(), e);
    }
    return AuthzFailure.STORAGE_UNAVAILABLE.status("Database error: " + e.getMessage(), e);
  }

  /** Gets a UUID from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<UUID> getUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(uuid);
    } catch (SQLException e) {
      return StatusOr.ofStatus(storageFailure(e));
    }
  }

  /**
   * Gets an optional UUID from a ResultSet column, returning Optional.empty() if the column is
   * null.
   */
  @Nonnull
  public static StatusOr<Optional<UUID>> getOptionalUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(uuid));
    } catch (SQLException e) {
      return StatusOr.ofStatus(storageFailure(e));
    }
  }

  /** Gets an Instant from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      java.sql.Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofStatus(storageFailure(e));
    }
  }

  /** Binds a UUID that may be null. */
  public static void setNullableUuid(PreparedStatement stmt, int parameterIndex, @Nullable UUID uuid)
      throws SQLException {
    if (uuid == null) {
      stmt.setNull(parameterIndex, Types.OTHER);
    } else {
      stmt.setObject(parameterIndex, uuid);
    }
  }

  /** Reads a {@code TEXT[]} column as a set; NULL yields an empty set. */
  @Nonnull
  public static StatusOr<ImmutableSet<String>> getTextSet(ResultSet rs, String columnName) {
    try {
      Array array = rs.getArray(columnName);
      if (rs.wasNull() || array == null) {
        return StatusOr.ofValue(ImmutableSet.of());
      }
      try {
        Object[] values = (Object[]) array.getArray();
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (Object value : values) {
          if (value != null) {
            builder.add(value.toString());
          }
        }
        return StatusOr.ofValue(builder.build());
      } finally {
        array.free();
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(storageFailure(e));
    }
  }

  /** Binds a collection of strings as a {@code TEXT[]} parameter. */
  public static void setTextArray(
      Connection conn, PreparedStatement stmt, int parameterIndex, Collection<String> values)
      throws SQLException {
    stmt.setArray(parameterIndex, conn.createArrayOf("text", values.toArray(new String[0])));
  }

  /**
   * Reads a JSONB column as a Gson object.
   *
   * @return the parsed object, empty for SQL NULL, or INTERNAL if the column is not a JSON object
   */
  @Nonnull
  public static StatusOr<Optional<JsonObject>> getJsonObject(ResultSet rs, String columnName) {
    try {
      String jsonbStr = rs.getString(columnName);
      if (rs.wasNull() || Strings.isNullOrEmpty(jsonbStr)) {
        return StatusOr.ofValue(Optional.empty());
      }
      try {
        return StatusOr.ofValue(Optional.of(JsonParser.parseString(jsonbStr).getAsJsonObject()));
      } catch (JsonParseException | IllegalStateException e) {
        return StatusOr.ofStatus(Status.internal("Failed to parse JSON: " + e.getMessage(), e));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(storageFailure(e));
    }
  }

  /** Sets a Gson object as a JSONB parameter; null is stored as SQL NULL. */
  public static void setJsonbParameter(
      PreparedStatement stmt, int parameterIndex, @Nullable JsonObject json) throws SQLException {
    if (json == null) {
      stmt.setNull(parameterIndex, Types.OTHER);
      return;
    }
    stmt.setObject(parameterIndex, json.toString(), Types.OTHER);
  }
}
