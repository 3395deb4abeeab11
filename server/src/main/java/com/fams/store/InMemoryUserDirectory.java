package com.fams.store;

import com.fams.authz.AuthzFailure;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.UserAccount;
import com.google.common.collect.Maps;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;

/** A {@link UserDirectory} backed by a concurrent map. */
public class InMemoryUserDirectory implements UserDirectory {

  private final ConcurrentMap<UUID, UserAccount> accounts = Maps.newConcurrentMap();

  @Override
  public StatusOr<Optional<UserAccount>> loadUser(UUID userId) {
    return StatusOr.ofValue(Optional.ofNullable(accounts.get(userId)));
  }

  @Override
  public StatusOr<Optional<UserAccount>> loadByUsername(String username) {
    return StatusOr.ofValue(
        accounts.values().stream().filter(a -> a.username().equals(username)).findFirst());
  }

  @Override
  public Status save(UserAccount account) {
    accounts.put(account.userId(), account);
    return Status.ok();
  }

  @Override
  public Status assignPosition(UUID userId, @Nullable UUID positionId) {
    UserAccount updated = accounts.computeIfPresent(userId, (id, a) -> a.withPosition(positionId));
    if (updated == null) {
      return AuthzFailure.UNKNOWN_USER.status("User " + userId + " not found");
    }
    return Status.ok();
  }

  @Override
  public StatusOr<Integer> countByPosition(UUID positionId) {
    long count =
        accounts.values().stream().filter(a -> positionId.equals(a.positionId())).count();
    return StatusOr.ofValue((int) count);
  }
}
