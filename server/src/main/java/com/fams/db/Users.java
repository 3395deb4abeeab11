package com.fams.db;

import com.fams.common.status.StatusOr;
import com.fams.db.util.DbUtil;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * DAO helper class for the 'user' table.
 */
public final class Users {

    private Users() {
        // Utility class
    }

    /**
     * Loads a single user by ID.
     *
     * @param conn an open JDBC connection
     * @param userId the UUID of the user to load
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadById(Connection conn, UUID userId) {
        String sql = """
                SELECT user_id, username, position_id, created_at, updated_at
                  FROM "user"
                 WHERE user_id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, userId);
            return loadSingle(stmt);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Loads a single user by username.
     *
     * @param conn an open JDBC connection
     * @param username the username of the user to load
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadByUsername(Connection conn, String username) {
        String sql = """
                SELECT user_id, username, position_id, created_at, updated_at
                  FROM "user"
                 WHERE username = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, username);
            return loadSingle(stmt);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Inserts or updates a user row (upsert).
     *
     * @param conn an open JDBC connection
     * @param user the User object to save
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> save(Connection conn, User user) {
        String sql = """
                INSERT INTO "user"
                       (user_id, username, position_id, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(user_id)
                DO UPDATE SET username    = excluded.username,
                              position_id = excluded.position_id,
                              updated_at  = excluded.updated_at
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, user.userId());
            stmt.setString(2, user.username());
            DbUtil.setNullableUuid(stmt, 3, user.positionId());
            stmt.setTimestamp(4, DbUtil.toSqlTimestamp(user.createdAt()));
            stmt.setTimestamp(5, DbUtil.toSqlTimestamp(user.updatedAt()));
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Points a user at a position, or clears the reference.
     *
     * @param conn an open JDBC connection
     * @param userId the user to update
     * @param positionId the new position, or null to clear
     * @param now the update timestamp
     * @return StatusOr containing the number of affected rows (0 if the user does not exist)
     */
    @Nonnull
    public static StatusOr<Integer> updatePosition(
            Connection conn, UUID userId, @Nullable UUID positionId, Instant now) {
        String sql = """
                UPDATE "user"
                   SET position_id = ?,
                       updated_at  = ?
                 WHERE user_id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            DbUtil.setNullableUuid(stmt, 1, positionId);
            stmt.setTimestamp(2, DbUtil.toSqlTimestamp(now));
            stmt.setObject(3, userId);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Counts the users bound to a position.
     *
     * @param conn an open JDBC connection
     * @param positionId the position to count
     * @return StatusOr containing the count or an error
     */
    @Nonnull
    public static StatusOr<Integer> countByPosition(Connection conn, UUID positionId) {
        String sql = """
                SELECT count(*) AS bound
                  FROM "user"
                 WHERE position_id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, positionId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return StatusOr.ofValue(rs.getInt("bound"));
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Deletes a user by ID.
     *
     * @param conn an open JDBC connection
     * @param userId the UUID of the user to delete
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> delete(Connection conn, UUID userId) {
        String sql = """
                DELETE FROM "user"
                 WHERE user_id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, userId);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    @Nonnull
    private static StatusOr<Optional<User>> loadSingle(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                StatusOr<User> userOr = extractUser(rs);
                if (userOr.isNotOk()) {
                    return StatusOr.ofStatus(userOr.getStatus());
                }
                return StatusOr.ofValue(Optional.of(userOr.getValue()));
            }
            return StatusOr.ofValue(Optional.empty());
        }
    }

    /**
     * Extracts a User from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<User> extractUser(ResultSet rs) throws SQLException {
        StatusOr<UUID> userIdOr = DbUtil.getUuid(rs, "user_id");
        if (userIdOr.isNotOk()) {
            return StatusOr.ofStatus(userIdOr.getStatus());
        }

        String username = rs.getString("username");

        StatusOr<Optional<UUID>> positionIdOr = DbUtil.getOptionalUuid(rs, "position_id");
        if (positionIdOr.isNotOk()) {
            return StatusOr.ofStatus(positionIdOr.getStatus());
        }

        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        StatusOr<Instant> updatedAtOr = DbUtil.getInstant(rs, "updated_at");
        if (updatedAtOr.isNotOk()) {
            return StatusOr.ofStatus(updatedAtOr.getStatus());
        }

        return StatusOr.ofValue(new User(
                userIdOr.getValue(),
                username,
                positionIdOr.getValue().orElse(null),
                createdAtOr.getValue(),
                updatedAtOr.getValue()
        ));
    }
}
