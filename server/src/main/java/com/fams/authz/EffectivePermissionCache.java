package com.fams.authz;

import com.fams.common.status.StatusOr;
import com.fams.security.EffectivePermissions;
import com.fams.security.PermissionCatalog;
import com.fams.security.Position;
import com.fams.store.PositionStore;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.Nonnull;

/**
 * Caches position snapshots and their effective permission sets, keyed by position id.
 *
 * <p>Each entry is tagged with the registry epoch it was loaded under and the catalog version its
 * effective set was computed from. {@link #invalidate(UUID)} bumps the epoch, so an entry loaded
 * concurrently with a mutation is never served afterwards, and a catalog registration only
 * forces the effective set to be recomputed from the cached snapshot.
 */
public class EffectivePermissionCache {

  /** A position together with the permissions it grants right now. */
  public record ResolvedPosition(Position position, EffectivePermissions permissions) {}

  private record Entry(long epoch, ResolvedPosition resolved) {}

  private final PositionStore store;
  private final PermissionCatalog catalog;
  private final Cache<UUID, Entry> cache;
  private final AtomicLong epoch = new AtomicLong();

  public EffectivePermissionCache(
      PositionStore store, PermissionCatalog catalog, long maximumSize, Duration expireAfterWrite) {
    this.store = store;
    this.catalog = catalog;
    this.cache =
        CacheBuilder.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(expireAfterWrite)
            .recordStats()
            .build();
  }

  /**
   * Returns the position and its effective permissions, loading the snapshot from the store when
   * no current entry exists. An absent position yields an empty optional and is not cached.
   */
  @Nonnull
  public StatusOr<Optional<ResolvedPosition>> resolve(UUID positionId) {
    long currentEpoch = epoch.get();
    Entry entry = cache.getIfPresent(positionId);
    if (entry != null && entry.epoch() == currentEpoch) {
      ResolvedPosition resolved = entry.resolved();
      if (resolved.permissions().catalogVersion() == catalog.version()) {
        return StatusOr.ofValue(Optional.of(resolved));
      }
      // catalog grew since this set was computed
      ResolvedPosition refreshed = remember(positionId, currentEpoch, resolved.position());
      return StatusOr.ofValue(Optional.of(refreshed));
    }

    StatusOr<Optional<Position>> loaded = store.loadById(positionId);
    if (loaded.isNotOk()) {
      return StatusOr.ofStatus(loaded.getStatus());
    }
    if (loaded.getValue().isEmpty()) {
      cache.invalidate(positionId);
      return StatusOr.ofValue(Optional.empty());
    }
    ResolvedPosition resolved = remember(positionId, currentEpoch, loaded.getValue().get());
    return StatusOr.ofValue(Optional.of(resolved));
  }

  private ResolvedPosition remember(UUID positionId, long loadedEpoch, Position position) {
    ResolvedPosition resolved =
        new ResolvedPosition(position, EffectivePermissions.resolve(position, catalog));
    cache.put(positionId, new Entry(loadedEpoch, resolved));
    return resolved;
  }

  /** Drops the entry for a position and retires every entry loaded before this call. */
  public void invalidate(UUID positionId) {
    epoch.incrementAndGet();
    cache.invalidate(positionId);
  }

  public long epoch() {
    return epoch.get();
  }

  public CacheStats stats() {
    return cache.stats();
  }
}
