package com.fams.authz;

import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.PermissionCatalog;
import com.fams.security.Position;
import com.fams.security.PositionDraft;
import com.fams.security.SystemPositions;
import com.fams.store.PositionStore;
import com.fams.store.UserDirectory;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Owns the set of positions and their permission snapshots.
 *
 * <p>Every mutation validates its input against the {@link PermissionCatalog}, runs under the
 * position's striped lock, replaces the whole snapshot in the {@link PositionStore} and
 * invalidates the {@link EffectivePermissionCache} before returning. A failed mutation leaves the
 * stored snapshot untouched.
 *
 * <p>The single position with {@code fullCatalogGrant} is protected: it cannot be deleted,
 * deactivated or narrowed.
 */
public class PositionRegistry {

  private static final Comparator<Position> LISTING_ORDER =
      Comparator.comparingInt(Position::level)
          .reversed()
          .thenComparing(Position::name, String.CASE_INSENSITIVE_ORDER);

  private final PositionStore store;
  private final UserDirectory users;
  private final PermissionCatalog catalog;
  private final EffectivePermissionCache cache;
  private final PositionLocks locks;
  private final Clock clock;

  public PositionRegistry(
      PositionStore store,
      UserDirectory users,
      PermissionCatalog catalog,
      EffectivePermissionCache cache,
      PositionLocks locks,
      Clock clock) {
    this.store = store;
    this.users = users;
    this.catalog = catalog;
    this.cache = cache;
    this.locks = locks;
    this.clock = clock;
  }

  /**
   * Creates a position from a draft.
   *
   * @return the created position, or INVALID_ARGUMENT for a blank name, INVALID_PERMISSION_SET if
   *     a code is not in the catalog, DUPLICATE_NAME if the name is taken ignoring case
   */
  @Nonnull
  public StatusOr<Position> create(PositionDraft draft) {
    if (Strings.isNullOrEmpty(draft.name()) || draft.name().isBlank()) {
      return StatusOr.ofStatus(Status.invalidArgument("Position name must not be blank"));
    }
    Status codesOk = validateCodes(draft.permissionCodes());
    if (codesOk.isError()) {
      return StatusOr.ofStatus(codesOk);
    }

    Lock lock = locks.forName(draft.name());
    lock.lock();
    try {
      Status nameOk = checkNameAvailable(draft.name(), null);
      if (nameOk.isError()) {
        return StatusOr.ofStatus(nameOk);
      }
      Instant now = clock.instant();
      Position position =
          new Position(
              UUID.randomUUID(),
              draft.name().trim(),
              draft.localizedName(),
              draft.description(),
              draft.level(),
              true,
              false,
              draft.permissionCodes(),
              now,
              now);
      Status inserted = store.insert(position);
      if (inserted.isError()) {
        return StatusOr.ofStatus(inserted);
      }
      cache.invalidate(position.id());
      Logger.info(
          "Created position {} ({}) with {} permissions",
          position.name(),
          position.id(),
          position.permissionCodes().size());
      return StatusOr.ofValue(position);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Replaces a position's permission set. All-or-nothing: on any failure the previous set stays
   * in effect.
   *
   * <p>The protected position only accepts the complete catalog, which leaves it unchanged.
   */
  @Nonnull
  public StatusOr<Position> update(UUID positionId, Collection<String> permissionCodes) {
    ImmutableSet<String> codes = ImmutableSet.copyOf(permissionCodes);
    Status codesOk = validateCodes(codes);
    if (codesOk.isError()) {
      return StatusOr.ofStatus(codesOk);
    }

    Lock lock = locks.forPosition(positionId);
    lock.lock();
    try {
      StatusOr<Position> currentOr = get(positionId);
      if (currentOr.isNotOk()) {
        return currentOr;
      }
      Position current = currentOr.getValue();
      if (current.fullCatalogGrant() && !codes.equals(catalog.codes())) {
        return AuthzFailure.PROTECTED_POSITION.error(
            "The permissions of '" + current.name() + "' cannot be narrowed");
      }
      Position updated = current.withPermissions(codes, clock.instant());
      Status replaced = store.replace(updated);
      if (replaced.isError()) {
        return StatusOr.ofStatus(replaced);
      }
      cache.invalidate(positionId);
      Logger.info(
          "Updated permissions of position {} ({}): {} -> {} codes",
          updated.name(),
          positionId,
          current.permissionCodes().size(),
          codes.size());
      return StatusOr.ofValue(updated);
    } finally {
      lock.unlock();
    }
  }

  /** Changes the display details of a position. Permissions and flags are untouched. */
  @Nonnull
  public StatusOr<Position> updateDetails(
      UUID positionId,
      String name,
      @Nullable String localizedName,
      String description,
      int level) {
    if (Strings.isNullOrEmpty(name) || name.isBlank()) {
      return StatusOr.ofStatus(Status.invalidArgument("Position name must not be blank"));
    }
    Lock lock = locks.forPosition(positionId);
    lock.lock();
    try {
      StatusOr<Position> currentOr = get(positionId);
      if (currentOr.isNotOk()) {
        return currentOr;
      }
      Status nameOk = checkNameAvailable(name, positionId);
      if (nameOk.isError()) {
        return StatusOr.ofStatus(nameOk);
      }
      Position updated =
          currentOr.getValue()
              .withDetails(name.trim(), localizedName, description, level, clock.instant());
      Status replaced = store.replace(updated);
      if (replaced.isError()) {
        return StatusOr.ofStatus(replaced);
      }
      cache.invalidate(positionId);
      Logger.info("Updated details of position {} ({})", updated.name(), positionId);
      return StatusOr.ofValue(updated);
    } finally {
      lock.unlock();
    }
  }

  /** Activates or deactivates a position. Users of an inactive position are denied everything. */
  @Nonnull
  public StatusOr<Position> setActive(UUID positionId, boolean active) {
    Lock lock = locks.forPosition(positionId);
    lock.lock();
    try {
      StatusOr<Position> currentOr = get(positionId);
      if (currentOr.isNotOk()) {
        return currentOr;
      }
      Position current = currentOr.getValue();
      if (current.fullCatalogGrant() && !active) {
        return AuthzFailure.PROTECTED_POSITION.error(
            "'" + current.name() + "' cannot be deactivated");
      }
      if (current.active() == active) {
        return currentOr;
      }
      Position updated = current.withActive(active, clock.instant());
      Status replaced = store.replace(updated);
      if (replaced.isError()) {
        return StatusOr.ofStatus(replaced);
      }
      cache.invalidate(positionId);
      Logger.info("Position {} ({}) is now {}", updated.name(), positionId,
          active ? "active" : "inactive");
      return StatusOr.ofValue(updated);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Deletes a position.
   *
   * @return OK, UNKNOWN_POSITION, PROTECTED_POSITION, or POSITION_IN_USE while any user is bound
   */
  @Nonnull
  public Status delete(UUID positionId) {
    Lock lock = locks.forPosition(positionId);
    lock.lock();
    try {
      StatusOr<Position> currentOr = get(positionId);
      if (currentOr.isNotOk()) {
        return currentOr.getStatus();
      }
      Position current = currentOr.getValue();
      if (current.fullCatalogGrant()) {
        return AuthzFailure.PROTECTED_POSITION.status(
            "'" + current.name() + "' cannot be deleted");
      }
      StatusOr<Integer> boundOr = users.countByPosition(positionId);
      if (boundOr.isNotOk()) {
        return boundOr.getStatus();
      }
      if (boundOr.getValue() > 0) {
        return AuthzFailure.POSITION_IN_USE.status(
            "Position '" + current.name() + "' is assigned to " + boundOr.getValue() + " user(s)");
      }
      Status deleted = store.delete(positionId);
      if (deleted.isError()) {
        return deleted;
      }
      cache.invalidate(positionId);
      Logger.info("Deleted position {} ({})", current.name(), positionId);
      return Status.ok();
    } finally {
      lock.unlock();
    }
  }

  @Nonnull
  public StatusOr<Position> get(UUID positionId) {
    StatusOr<Optional<Position>> loaded = store.loadById(positionId);
    if (loaded.isNotOk()) {
      return StatusOr.ofStatus(loaded.getStatus());
    }
    return StatusOr.fromOptional(
        loaded.getValue(),
        AuthzFailure.UNKNOWN_POSITION.status("Position " + positionId + " not found"));
  }

  @Nonnull
  public StatusOr<Optional<Position>> findByName(String name) {
    return store.loadByName(name);
  }

  /** Lists every position, most senior first. */
  @Nonnull
  public StatusOr<ImmutableList<Position>> listAll() {
    return store.loadAll().map(all -> ImmutableList.sortedCopyOf(LISTING_ORDER, all));
  }

  /**
   * Installs the protected full-catalog position unless it already exists.
   *
   * @return the protected position
   */
  @Nonnull
  public StatusOr<Position> ensureSystemAdministrator() {
    SystemPositions admin = SystemPositions.SYSTEM_ADMINISTRATOR;
    Lock lock = locks.forName(admin.displayName());
    lock.lock();
    try {
      StatusOr<ImmutableList<Position>> allOr = store.loadAll();
      if (allOr.isNotOk()) {
        return StatusOr.ofStatus(allOr.getStatus());
      }
      Optional<Position> existing =
          allOr.getValue().stream().filter(Position::fullCatalogGrant).findFirst();
      if (existing.isPresent()) {
        return StatusOr.ofValue(existing.get());
      }
      Instant now = clock.instant();
      Position position =
          new Position(
              UUID.randomUUID(),
              admin.displayName(),
              admin.localizedName(),
              admin.description(),
              admin.level(),
              true,
              true,
              catalog.codes(),
              now,
              now);
      Status inserted = store.insert(position);
      if (inserted.isError()) {
        return StatusOr.ofStatus(inserted);
      }
      cache.invalidate(position.id());
      Logger.info("Installed protected position {} ({})", position.name(), position.id());
      return StatusOr.ofValue(position);
    } finally {
      lock.unlock();
    }
  }

  private Status validateCodes(Collection<String> codes) {
    ImmutableSet<String> unknown = catalog.unknownCodes(codes);
    if (!unknown.isEmpty()) {
      return AuthzFailure.INVALID_PERMISSION_SET.status("Unknown permission code(s): " + unknown);
    }
    return Status.ok();
  }

  private Status checkNameAvailable(String name, @Nullable UUID ownId) {
    StatusOr<Optional<Position>> existing = store.loadByName(name);
    if (existing.isNotOk()) {
      return existing.getStatus();
    }
    if (existing.getValue().isPresent() && !existing.getValue().get().id().equals(ownId)) {
      return AuthzFailure.DUPLICATE_NAME.status(
          "A position named '" + existing.getValue().get().name() + "' already exists");
    }
    return Status.ok();
  }
}
