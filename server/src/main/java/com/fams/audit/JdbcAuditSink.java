package com.fams.audit;

import com.fams.authz.AuthorizationDecision;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.db.AuditLogs;
import com.fams.db.DecisionLogs;
import com.fams.db.util.DbUtil;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import org.tinylog.Logger;

/** Appends audit records to the {@code authorization_decision} and {@code audit_log} tables. */
public class JdbcAuditSink implements AuditSink {

  public record Config(HikariDataSource dataSource) {}

  private final Config config;

  public JdbcAuditSink(Config config) {
    this.config = config;
  }

  @Override
  public Status recordDecision(AuthorizationDecision decision) {
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<Integer> inserted = DecisionLogs.insert(conn, decision);
      if (inserted.isNotOk()) {
        Logger.error("Failed to record decision {}: {}", decision.decisionId(), inserted.getStatus());
        return inserted.getStatus();
      }
      return Status.ok();
    } catch (SQLException e) {
      Logger.error(e, "Failed to record decision {}", decision.decisionId());
      return DbUtil.storageFailure(e);
    }
  }

  @Override
  public Status recordAction(AuditAction action) {
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<Integer> inserted = AuditLogs.insert(conn, action);
      if (inserted.isNotOk()) {
        Logger.error("Failed to record action {}: {}", action.actionId(), inserted.getStatus());
        return inserted.getStatus();
      }
      return Status.ok();
    } catch (SQLException e) {
      Logger.error(e, "Failed to record action {}", action.actionId());
      return DbUtil.storageFailure(e);
    }
  }
}
