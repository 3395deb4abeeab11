package com.fams.store;

import com.fams.authz.AuthzFailure;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.db.User;
import com.fams.db.Users;
import com.fams.db.util.DbUtil;
import com.fams.security.UserAccount;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/** A {@link UserDirectory} over the PostgreSQL {@code "user"} table. */
public class JdbcUserDirectory implements UserDirectory {

  public record Config(HikariDataSource dataSource, Clock clock) {}

  private final Config config;

  public JdbcUserDirectory(Config config) {
    this.config = config;
  }

  @Override
  public StatusOr<Optional<UserAccount>> loadUser(UUID userId) {
    try (Connection conn = config.dataSource().getConnection()) {
      return Users.loadById(conn, userId).map(user -> user.map(User::toAccount));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.storageFailure(e));
    }
  }

  @Override
  public StatusOr<Optional<UserAccount>> loadByUsername(String username) {
    try (Connection conn = config.dataSource().getConnection()) {
      return Users.loadByUsername(conn, username).map(user -> user.map(User::toAccount));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.storageFailure(e));
    }
  }

  @Override
  public Status save(UserAccount account) {
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<Optional<User>> existing = Users.loadById(conn, account.userId());
      if (existing.isNotOk()) {
        return existing.getStatus();
      }
      Instant now = config.clock().instant();
      Instant createdAt = existing.getValue().map(User::createdAt).orElse(now);
      User row = new User(account.userId(), account.username(), account.positionId(), createdAt, now);
      StatusOr<Integer> saved = Users.save(conn, row);
      return saved.isOk() ? Status.ok() : saved.getStatus();
    } catch (SQLException e) {
      return DbUtil.storageFailure(e);
    }
  }

  @Override
  public Status assignPosition(UUID userId, @Nullable UUID positionId) {
    try (Connection conn = config.dataSource().getConnection()) {
      StatusOr<Integer> updated =
          Users.updatePosition(conn, userId, positionId, config.clock().instant());
      if (updated.isNotOk()) {
        // a foreign key violation here means the position vanished
        return AuthzFailure.POSITION_IN_USE.matches(updated.getStatus())
            ? AuthzFailure.UNKNOWN_POSITION.status("Position " + positionId + " not found")
            : updated.getStatus();
      }
      if (updated.getValue() == 0) {
        return AuthzFailure.UNKNOWN_USER.status("User " + userId + " not found");
      }
      return Status.ok();
    } catch (SQLException e) {
      return DbUtil.storageFailure(e);
    }
  }

  @Override
  public StatusOr<Integer> countByPosition(UUID positionId) {
    try (Connection conn = config.dataSource().getConnection()) {
      return Users.countByPosition(conn, positionId);
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.storageFailure(e));
    }
  }
}
