package com.fams.db;

import com.fams.audit.AuditAction;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

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
 * DAO helper class for the append-only 'audit_log' table.
 */
public final class AuditLogs {

    private AuditLogs() {
        // Utility class
    }

    /**
     * Appends an administrative action.
     *
     * @param conn an open JDBC connection
     * @param action the action to record
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> insert(Connection conn, AuditAction action) {
        String sql = """
                INSERT INTO audit_log
                       (audit_log_id, actor_id, table_name, record_id, action,
                        old_values, new_values, occurred_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, action.actionId());
            stmt.setObject(2, action.actorId());
            stmt.setString(3, action.entityType());
            stmt.setObject(4, action.entityId());
            stmt.setString(5, action.action().name());
            DbUtil.setJsonbParameter(stmt, 6, action.oldValues());
            DbUtil.setJsonbParameter(stmt, 7, action.newValues());
            stmt.setTimestamp(8, DbUtil.toSqlTimestamp(action.occurredAt()));
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Loads the actions recorded against one entity, oldest first.
     *
     * @param conn an open JDBC connection
     * @param entityId the entity to look up
     * @return StatusOr containing the actions or an error
     */
    @Nonnull
    public static StatusOr<List<AuditAction>> loadByEntity(Connection conn, UUID entityId) {
        String sql = """
                SELECT audit_log_id, actor_id, table_name, record_id, action,
                       old_values, new_values, occurred_at
                  FROM audit_log
                 WHERE record_id = ?
                 ORDER BY occurred_at, audit_log_id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                List<AuditAction> result = new ArrayList<>();
                while (rs.next()) {
                    StatusOr<AuditAction> actionOr = extractAction(rs);
                    if (actionOr.isNotOk()) {
                        return StatusOr.ofStatus(actionOr.getStatus());
                    }
                    result.add(actionOr.getValue());
                }
                return StatusOr.ofValue(ImmutableList.copyOf(result));
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    @Nonnull
    private static StatusOr<AuditAction> extractAction(ResultSet rs) throws SQLException {
        StatusOr<UUID> idOr = DbUtil.getUuid(rs, "audit_log_id");
        if (idOr.isNotOk()) {
            return StatusOr.ofStatus(idOr.getStatus());
        }
        StatusOr<UUID> actorOr = DbUtil.getUuid(rs, "actor_id");
        if (actorOr.isNotOk()) {
            return StatusOr.ofStatus(actorOr.getStatus());
        }
        StatusOr<UUID> recordOr = DbUtil.getUuid(rs, "record_id");
        if (recordOr.isNotOk()) {
            return StatusOr.ofStatus(recordOr.getStatus());
        }
        StatusOr<Optional<JsonObject>> oldOr = DbUtil.getJsonObject(rs, "old_values");
        if (oldOr.isNotOk()) {
            return StatusOr.ofStatus(oldOr.getStatus());
        }
        StatusOr<Optional<JsonObject>> newOr = DbUtil.getJsonObject(rs, "new_values");
        if (newOr.isNotOk()) {
            return StatusOr.ofStatus(newOr.getStatus());
        }
        StatusOr<Instant> occurredAtOr = DbUtil.getInstant(rs, "occurred_at");
        if (occurredAtOr.isNotOk()) {
            return StatusOr.ofStatus(occurredAtOr.getStatus());
        }

        AuditAction.Type type;
        try {
            type = AuditAction.Type.valueOf(rs.getString("action"));
        } catch (IllegalArgumentException e) {
            return StatusOr.ofStatus(Status.internal("Unknown audit action: " + e.getMessage(), e));
        }

        return StatusOr.ofValue(new AuditAction(
                idOr.getValue(),
                actorOr.getValue(),
                rs.getString("table_name"),
                recordOr.getValue(),
                type,
                oldOr.getValue().orElse(null),
                newOr.getValue().orElse(null),
                occurredAtOr.getValue()
        ));
    }
}
