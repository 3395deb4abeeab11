package com.fams.db;

import com.fams.authz.AuthorizationDecision;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.db.util.DbUtil;
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
 * DAO helper class for the append-only 'authorization_decision' table.
 */
public final class DecisionLogs {

    private DecisionLogs() {
        // Utility class
    }

    /**
     * Appends a decision.
     *
     * @param conn an open JDBC connection
     * @param decision the decision to record
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> insert(Connection conn, AuthorizationDecision decision) {
        String sql = """
                INSERT INTO authorization_decision
                       (decision_id, user_id, mode, required_codes, position_id,
                        effective_codes, outcome, reason, decided_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, decision.decisionId());
            stmt.setObject(2, decision.userId());
            stmt.setString(3, decision.mode().name());
            DbUtil.setTextArray(conn, stmt, 4, decision.required());
            DbUtil.setNullableUuid(stmt, 5, decision.positionId());
            DbUtil.setTextArray(conn, stmt, 6, decision.effectivePermissions());
            stmt.setString(7, decision.outcome().name());
            stmt.setString(8, decision.reason().name());
            stmt.setTimestamp(9, DbUtil.toSqlTimestamp(decision.decidedAt()));
            return StatusOr.ofValue(stmt.executeUpdate());
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    /**
     * Loads the decisions made for a user, oldest first.
     *
     * @param conn an open JDBC connection
     * @param userId the user to look up
     * @return StatusOr containing the decisions or an error
     */
    @Nonnull
    public static StatusOr<List<AuthorizationDecision>> loadByUser(Connection conn, UUID userId) {
        String sql = """
                SELECT decision_id, user_id, mode, required_codes, position_id,
                       effective_codes, outcome, reason, decided_at
                  FROM authorization_decision
                 WHERE user_id = ?
                 ORDER BY decided_at, decision_id
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setObject(1, userId);
            try (ResultSet rs = stmt.executeQuery()) {
                List<AuthorizationDecision> result = new ArrayList<>();
                while (rs.next()) {
                    StatusOr<AuthorizationDecision> decisionOr = extractDecision(rs);
                    if (decisionOr.isNotOk()) {
                        return StatusOr.ofStatus(decisionOr.getStatus());
                    }
                    result.add(decisionOr.getValue());
                }
                return StatusOr.ofValue(ImmutableList.copyOf(result));
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.storageFailure(e));
        }
    }

    @Nonnull
    private static StatusOr<AuthorizationDecision> extractDecision(ResultSet rs) throws SQLException {
        StatusOr<UUID> idOr = DbUtil.getUuid(rs, "decision_id");
        if (idOr.isNotOk()) {
            return StatusOr.ofStatus(idOr.getStatus());
        }
        StatusOr<UUID> userIdOr = DbUtil.getUuid(rs, "user_id");
        if (userIdOr.isNotOk()) {
            return StatusOr.ofStatus(userIdOr.getStatus());
        }
        StatusOr<Optional<UUID>> positionIdOr = DbUtil.getOptionalUuid(rs, "position_id");
        if (positionIdOr.isNotOk()) {
            return StatusOr.ofStatus(positionIdOr.getStatus());
        }
        StatusOr<ImmutableSet<String>> requiredOr = DbUtil.getTextSet(rs, "required_codes");
        if (requiredOr.isNotOk()) {
            return StatusOr.ofStatus(requiredOr.getStatus());
        }
        StatusOr<ImmutableSet<String>> effectiveOr = DbUtil.getTextSet(rs, "effective_codes");
        if (effectiveOr.isNotOk()) {
            return StatusOr.ofStatus(effectiveOr.getStatus());
        }
        StatusOr<Instant> decidedAtOr = DbUtil.getInstant(rs, "decided_at");
        if (decidedAtOr.isNotOk()) {
            return StatusOr.ofStatus(decidedAtOr.getStatus());
        }

        try {
            return StatusOr.ofValue(new AuthorizationDecision(
                    idOr.getValue(),
                    userIdOr.getValue(),
                    requiredOr.getValue().asList(),
                    AuthorizationDecision.Mode.valueOf(rs.getString("mode")),
                    positionIdOr.getValue().orElse(null),
                    effectiveOr.getValue(),
                    AuthorizationDecision.Outcome.valueOf(rs.getString("outcome")),
                    AuthorizationDecision.Reason.valueOf(rs.getString("reason")),
                    decidedAtOr.getValue()
            ));
        } catch (IllegalArgumentException e) {
            return StatusOr.ofStatus(Status.internal("Malformed decision row: " + e.getMessage(), e));
        }
    }
}
