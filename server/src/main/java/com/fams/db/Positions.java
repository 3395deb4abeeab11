package com.fams.db;

import com.fams.common.status.StatusOr;
import com.fams.db.util.DbUtil;
import com.fams.security.Position;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * DAO helper class for the 'position' table and its 'position_permission' children.
 *
 * <p>A position row and its permission rows form one snapshot. {@link #insert} and
 * {@link #replace} write several statements; callers run them inside a transaction so readers
 * never observe a half-written permission set.
 */
public final class Positions {

    private static final String SELECT_POSITIONS = """
            SELECT p.position_id, p.name, p.localized_name, p.description, p.level,
                   p.active, p.full_catalog_grant, p.created_at, p.updated_at,
                   COALESCE(array_agg(pp.permission_code ORDER BY pp.permission_code)
                            FILTER (WHERE pp.permission_code IS NOT NULL),
                            '{}') AS permission_codes
              FROM position p
              LEFT JOIN position_permission pp ON pp.position_id = p.position_id
            """;

    private static final String GROUP_BY = """
             GROUP BY p.position_id
            """;

    private Positions() {
        // Utility class
    }

    /**
     * Loads all positions with their permission codes.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing a list of Position objects or an error
     */
    @Nonnull
    public static StatusOr<List<Position>> loadAll(Connection conn) {
        String sql = SELECT_POSITIONS + GROUP_BY;
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            List<Position> result = new ArrayList<>();
            while (rs.next()) {
                StatusOr<Position> positionOr = extractPosition(rs);
                if (positionOr.isNotOk()) {
                    return StatusOr.ofStatus(positionOr.getStatus());
                }
                result.add(positionOr.getValue());
            }
            return StatusOr.ofValue(ImmutableList.copyOf(result));
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Loads a single position by ID.
     *
     * @param conn an open JDBC connection
     * @param positionId the UUID of the position to load
     * @return StatusOr containing an Optional Position or an error
     */
    @Nonnull
    public static StatusOr<Optional<Position>> loadById(Connection conn, UUID positionId) {
        String sql = SELECT_POSITIONS + " WHERE p.position_id = ?\n" + GROUP_BY;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, positionId);
            return loadSingle(stmt);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Loads a single position by name, ignoring case and surrounding whitespace.
     *
     * @param conn an open JDBC connection
     * @param name the name to look for
     * @return StatusOr containing an Optional Position or an error
     */
    @Nonnull
    public static StatusOr<Optional<Position>> loadByName(Connection conn, String name) {
        String sql = SELECT_POSITIONS + " WHERE lower(p.name) = ?\n" + GROUP_BY;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, Position.normalizeName(name));
            return loadSingle(stmt);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Inserts a position and its permission codes.
     *
     * @param conn an open JDBC connection, inside a transaction
     * @param position the position to insert
     * @return StatusOr containing the number of position rows inserted or an error
     */
    @Nonnull
    public static StatusOr<Integer> insert(Connection conn, Position position) {
        String sql = """
                INSERT INTO position
                       (position_id, name, localized_name, description, level, active,
                        full_catalog_grant, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, position.id());
            stmt.setString(2, position.name());
            stmt.setString(3, position.localizedName());
            stmt.setString(4, position.description());
            stmt.setInt(5, position.level());
            stmt.setBoolean(6, position.active());
            stmt.setBoolean(7, position.fullCatalogGrant());
            stmt.setTimestamp(8, DbUtil.toSqlTimestamp(position.createdAt()));
            stmt.setTimestamp(9, DbUtil.toSqlTimestamp(position.updatedAt()));
            int rowsAffected = stmt.executeUpdate();
            insertPermissions(conn, position.id(), position.permissionCodes());
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Overwrites a position row and replaces its permission codes.
     *
     * @param conn an open JDBC connection, inside a transaction
     * @param position the new snapshot
     * @return StatusOr containing the number of position rows updated (0 if absent) or an error
     */
    @Nonnull
    public static StatusOr<Integer> replace(Connection conn, Position position) {
        String sql = """
                UPDATE position
                   SET name               = ?,
                       localized_name     = ?,
                       description        = ?,
                       level              = ?,
                       active             = ?,
                       full_catalog_grant = ?,
                       updated_at         = ?
                 WHERE position_id = ?
                """;
        String clear = """
                DELETE FROM position_permission
                 WHERE position_id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             PreparedStatement clearStmt = conn.prepareStatement(clear)) {
            stmt.setString(1, position.name());
            stmt.setString(2, position.localizedName());
            stmt.setString(3, position.description());
            stmt.setInt(4, position.level());
            stmt.setBoolean(5, position.active());
            stmt.setBoolean(6, position.fullCatalogGrant());
            stmt.setTimestamp(7, DbUtil.toSqlTimestamp(position.updatedAt()));
            stmt.setObject(8, position.id());
            int rowsAffected = stmt.executeUpdate();
            if (rowsAffected == 0) {
                return StatusOr.ofValue(0);
            }
            clearStmt.setObject(1, position.id());
            clearStmt.executeUpdate();
            insertPermissions(conn, position.id(), position.permissionCodes());
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Deletes a position by ID. Permission rows go with it; users still bound to it make the
     * statement fail with a foreign key violation.
     *
     * @param conn an open JDBC connection
     * @param positionId the UUID of the position to delete
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> delete(Connection conn, UUID positionId) {
        String sql = """
                DELETE FROM position
                 WHERE position_id = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, positionId);
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    private static void insertPermissions(Connection conn, UUID positionId, ImmutableSet<String> codes)
            throws SQLException {
        if (codes.isEmpty()) {
            return;
        }
        String sql = """
                INSERT INTO position_permission (position_id, permission_code)
                VALUES (?, ?)
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (String code : codes) {
                stmt.setObject(1, positionId);
                stmt.setString(2, code);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    @Nonnull
    private static StatusOr<Optional<Position>> loadSingle(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                StatusOr<Position> positionOr = extractPosition(rs);
                if (positionOr.isNotOk()) {
                    return StatusOr.ofStatus(positionOr.getStatus());
                }
                return StatusOr.ofValue(Optional.of(positionOr.getValue()));
            }
            return StatusOr.ofValue(Optional.empty());
        }
    }

    /**
     * Extracts a Position from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<Position> extractPosition(ResultSet rs) throws SQLException {
        StatusOr<UUID> positionIdOr = DbUtil.getUuid(rs, "position_id");
        if (positionIdOr.isNotOk()) {
            return StatusOr.ofStatus(positionIdOr.getStatus());
        }

        StatusOr<ImmutableSet<String>> codesOr = DbUtil.getTextSet(rs, "permission_codes");
        if (codesOr.isNotOk()) {
            return StatusOr.ofStatus(codesOr.getStatus());
        }

        StatusOr<Instant> createdAtOr = DbUtil.getInstant(rs, "created_at");
        if (createdAtOr.isNotOk()) {
            return StatusOr.ofStatus(createdAtOr.getStatus());
        }

        StatusOr<Instant> updatedAtOr = DbUtil.getInstant(rs, "updated_at");
        if (updatedAtOr.isNotOk()) {
            return StatusOr.ofStatus(updatedAtOr.getStatus());
        }

        return StatusOr.ofValue(new Position(
                positionIdOr.getValue(),
                rs.getString("name"),
                rs.getString("localized_name"),
                rs.getString("description"),
                rs.getInt("level"),
                rs.getBoolean("active"),
                rs.getBoolean("full_catalog_grant"),
                codesOr.getValue(),
                createdAtOr.getValue(),
                updatedAtOr.getValue()
        ));
    }
}
