package com.fams.authz;

import com.fams.security.Position;
import com.google.common.util.concurrent.Striped;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * Striped locks that serialize mutations of the same position while letting different positions
 * change concurrently. Creation is keyed by normalized name because the id does not exist yet.
 *
 * <p>The registry and the user binding share one instance, so a bind and a delete of the same
 * position never interleave.
 */
public final class PositionLocks {

  private static final int DEFAULT_STRIPES = 64;

  private final Striped<Lock> byId;
  private final Striped<Lock> byName;

  public PositionLocks() {
    this(DEFAULT_STRIPES);
  }

  public PositionLocks(int stripes) {
    this.byId = Striped.lock(stripes);
    this.byName = Striped.lock(stripes);
  }

  public Lock forPosition(UUID positionId) {
    return byId.get(positionId);
  }

  public Lock forName(String name) {
    return byName.get(Position.normalizeName(name));
  }
}
