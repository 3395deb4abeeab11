package com.fams.store;

import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.Position;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for {@link Position} snapshots.
 *
 * <p>Writes replace a whole snapshot atomically. Implementations report infrastructure faults as
 * {@code UNAVAILABLE}, a name collision as {@code DUPLICATE_NAME} and a missing row as
 * {@code UNKNOWN_POSITION}; they perform no other validation.
 */
public interface PositionStore {

  StatusOr<ImmutableList<Position>> loadAll();

  StatusOr<Optional<Position>> loadById(UUID positionId);

  /** Looks a position up by name, ignoring case and surrounding whitespace. */
  StatusOr<Optional<Position>> loadByName(String name);

  Status insert(Position position);

  Status replace(Position position);

  Status delete(UUID positionId);
}
