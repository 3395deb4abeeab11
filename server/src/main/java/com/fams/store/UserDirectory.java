package com.fams.store;

import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.UserAccount;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * The user-management collaborator. This core reads accounts and writes only the position
 * reference; creating accounts is limited to system initialization.
 */
public interface UserDirectory {

  StatusOr<Optional<UserAccount>> loadUser(UUID userId);

  StatusOr<Optional<UserAccount>> loadByUsername(String username);

  /** Inserts or updates an account. */
  Status save(UserAccount account);

  /**
   * Points an existing account at a position, or clears the reference when {@code positionId} is
   * null. Returns {@code UNKNOWN_USER} if the account does not exist.
   */
  Status assignPosition(UUID userId, @Nullable UUID positionId);

  /** Counts the accounts currently bound to the position. */
  StatusOr<Integer> countByPosition(UUID positionId);
}
