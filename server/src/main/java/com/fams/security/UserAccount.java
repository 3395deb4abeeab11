package com.fams.security;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * The slice of a user account this engine cares about. Accounts are owned by user management;
 * the only field written here is the position reference.
 *
 * @param userId unique identifier
 * @param username login name
 * @param positionId the bound position, or null when none is assigned
 */
public record UserAccount(UUID userId, String username, @Nullable UUID positionId) {

  public UserAccount {
    Objects.requireNonNull(userId, "userId must not be null");
    Objects.requireNonNull(username, "username must not be null");
  }

  public Optional<UUID> position() {
    return Optional.ofNullable(positionId);
  }

  public UserAccount withPosition(@Nullable UUID newPositionId) {
    return new UserAccount(userId, username, newPositionId);
  }
}
