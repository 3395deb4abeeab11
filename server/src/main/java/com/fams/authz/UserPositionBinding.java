package com.fams.authz;

import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.Position;
import com.fams.security.UserAccount;
import com.fams.store.PositionStore;
import com.fams.store.UserDirectory;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Binds each user to exactly one position. A user's effective permissions are the bound
 * position's permissions; there are no per-user grants.
 */
public class UserPositionBinding {

  private final UserDirectory users;
  private final PositionStore positions;
  private final PositionLocks locks;

  public UserPositionBinding(UserDirectory users, PositionStore positions, PositionLocks locks) {
    this.users = users;
    this.positions = positions;
    this.locks = locks;
  }

  /**
   * Binds a user to a position, replacing any previous binding.
   *
   * <p>Holds the position's lock for the whole operation, so the position cannot be deleted
   * between the existence check and the write.
   *
   * @return OK, UNKNOWN_POSITION or UNKNOWN_USER
   */
  @Nonnull
  public Status bind(UUID userId, UUID positionId) {
    Lock lock = locks.forPosition(positionId);
    lock.lock();
    try {
      StatusOr<Optional<Position>> positionOr = positions.loadById(positionId);
      if (positionOr.isNotOk()) {
        return positionOr.getStatus();
      }
      if (positionOr.getValue().isEmpty()) {
        return AuthzFailure.UNKNOWN_POSITION.status("Position " + positionId + " not found");
      }
      Status assigned = users.assignPosition(userId, positionId);
      if (assigned.isOk()) {
        Logger.info(
            "Bound user {} to position {} ({})",
            userId,
            positionOr.getValue().get().name(),
            positionId);
      }
      return assigned;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the position a user is bound to.
   *
   * @return the position, or UNKNOWN_USER, NO_POSITION, or UNKNOWN_POSITION when the stored
   *     reference no longer resolves
   */
  @Nonnull
  public StatusOr<Position> currentPosition(UUID userId) {
    StatusOr<UUID> positionIdOr = boundPositionId(userId);
    if (positionIdOr.isNotOk()) {
      return StatusOr.ofStatus(positionIdOr.getStatus());
    }
    UUID positionId = positionIdOr.getValue();
    StatusOr<Optional<Position>> positionOr = positions.loadById(positionId);
    if (positionOr.isNotOk()) {
      return StatusOr.ofStatus(positionOr.getStatus());
    }
    return StatusOr.fromOptional(
        positionOr.getValue(),
        AuthzFailure.UNKNOWN_POSITION.status(
            "User " + userId + " references missing position " + positionId));
  }

  /**
   * Returns the id of the position a user is bound to, without loading the position.
   *
   * @return the id, or UNKNOWN_USER, NO_POSITION, or the directory's storage failure
   */
  @Nonnull
  public StatusOr<UUID> boundPositionId(UUID userId) {
    StatusOr<Optional<UserAccount>> userOr = users.loadUser(userId);
    if (userOr.isNotOk()) {
      return StatusOr.ofStatus(userOr.getStatus());
    }
    if (userOr.getValue().isEmpty()) {
      return AuthzFailure.UNKNOWN_USER.error("User " + userId + " not found");
    }
    return StatusOr.fromOptional(
        userOr.getValue().get().position(),
        AuthzFailure.NO_POSITION.status("User " + userId + " has no position"));
  }

  /** Counts the users bound to a position. */
  @Nonnull
  public StatusOr<Integer> boundUserCount(UUID positionId) {
    return users.countByPosition(positionId);
  }
}
