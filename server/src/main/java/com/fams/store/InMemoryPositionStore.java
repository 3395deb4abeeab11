package com.fams.store;

import com.fams.authz.AuthzFailure;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.Position;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;

/** A {@link PositionStore} backed by concurrent maps. Used for tests and embedded setups. */
public class InMemoryPositionStore implements PositionStore {

  private final ConcurrentMap<UUID, Position> positionsById = Maps.newConcurrentMap();
  private final ConcurrentMap<String, UUID> idsByName = Maps.newConcurrentMap();

  @Override
  public StatusOr<ImmutableList<Position>> loadAll() {
    return StatusOr.ofValue(ImmutableList.copyOf(positionsById.values()));
  }

  @Override
  public StatusOr<Optional<Position>> loadById(UUID positionId) {
    return StatusOr.ofValue(Optional.ofNullable(positionsById.get(positionId)));
  }

  @Override
  public StatusOr<Optional<Position>> loadByName(String name) {
    UUID id = idsByName.get(Position.normalizeName(name));
    return StatusOr.ofValue(Optional.ofNullable(id == null ? null : positionsById.get(id)));
  }

  @Override
  public Status insert(Position position) {
    UUID existing = idsByName.putIfAbsent(position.normalizedName(), position.id());
    if (existing != null) {
      return AuthzFailure.DUPLICATE_NAME.status(
          "A position named '" + position.name() + "' already exists");
    }
    if (positionsById.putIfAbsent(position.id(), position) != null) {
      idsByName.remove(position.normalizedName(), position.id());
      return AuthzFailure.DUPLICATE_NAME.status("Position " + position.id() + " already exists");
    }
    return Status.ok();
  }

  @Override
  public Status replace(Position position) {
    Position previous = positionsById.get(position.id());
    if (previous == null) {
      return AuthzFailure.UNKNOWN_POSITION.status("Position " + position.id() + " not found");
    }
    String newName = position.normalizedName();
    String oldName = previous.normalizedName();
    if (!newName.equals(oldName)) {
      UUID holder = idsByName.putIfAbsent(newName, position.id());
      if (holder != null && !holder.equals(position.id())) {
        return AuthzFailure.DUPLICATE_NAME.status(
            "A position named '" + position.name() + "' already exists");
      }
    }
    if (!positionsById.replace(position.id(), previous, position)) {
      if (!newName.equals(oldName)) {
        idsByName.remove(newName, position.id());
      }
      return AuthzFailure.UNKNOWN_POSITION.status(
          "Position " + position.id() + " changed concurrently");
    }
    if (!newName.equals(oldName)) {
      idsByName.remove(oldName, position.id());
    }
    return Status.ok();
  }

  @Override
  public Status delete(UUID positionId) {
    Position removed = positionsById.remove(positionId);
    if (removed == null) {
      return AuthzFailure.UNKNOWN_POSITION.status("Position " + positionId + " not found");
    }
    idsByName.remove(removed.normalizedName(), positionId);
    return Status.ok();
  }
}
