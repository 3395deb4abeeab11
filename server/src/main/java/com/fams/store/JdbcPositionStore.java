package com.fams.store;

import com.fams.authz.AuthzFailure;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.db.Positions;
import com.fams.db.util.DbUtil;
import com.fams.security.Position;
import com.google.common.collect.ImmutableList;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;
import org.tinylog.Logger;

/** A {@link PositionStore} backed by PostgreSQL through a HikariCP pool. */
public class JdbcPositionStore implements PositionStore {

  public record Config(HikariDataSource dataSource) {}

  private final Config config;

  public JdbcPositionStore(Config config) {
    this.config = config;
  }

  @Override
  public StatusOr<ImmutableList<Position>> loadAll() {
    try (Connection conn = config.dataSource().getConnection()) {
      return Positions.loadAll(conn).map(list -> ImmutableList.copyOf(list));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.storageFailure(e));
    }
  }

  @Override
  public StatusOr<Optional<Position>> loadById(UUID positionId) {
    try (Connection conn = config.dataSource().getConnection()) {
      return Positions.loadById(conn, positionId);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.storageFailure(e));
    }
  }

  @Override
  public StatusOr<Optional<Position>> loadByName(String name) {
    try (Connection conn = config.dataSource().getConnection()) {
      return Positions.loadByName(conn, name);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.storageFailure(e));
    }
  }

  @Override
  public Status insert(Position position) {
    return inTransaction(Positions::insert, position);
  }

  @Override
  public Status replace(Position position) {
    return inTransaction(Positions::replace, position);
  }

  @Override
  public Status delete(UUID positionId) {
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<Integer> deleted = Positions.delete(conn, positionId);
      if (deleted.isNotOk()) {
        return deleted.getStatus();
      }
      if (deleted.getValue() == 0) {
        return AuthzFailure.UNKNOWN_POSITION.status("Position " + positionId + " not found");
      }
      return Status.ok();
    } catch (SQLException e) {
      return DbUtil.storageFailure(e);
    }
  }

  /** Writes a snapshot atomically: the row and its permission set commit together or not at all. */
  private Status inTransaction(
      BiFunction<Connection, Position, StatusOr<Integer>> write, Position position) {
    try (Connection conn = config.dataSource().getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        StatusOr<Integer> written = write.apply(conn, position);
        if (written.isNotOk() || written.getValue() == 0) {
          conn.rollback();
          return written.isNotOk()
              ? written.getStatus()
              : AuthzFailure.UNKNOWN_POSITION.status("Position " + position.id() + " not found");
        }
        conn.commit();
        return Status.ok();
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      Logger.error(e, "Failed to write position {}", position.id());
      return DbUtil.storageFailure(e);
    }
  }
}
