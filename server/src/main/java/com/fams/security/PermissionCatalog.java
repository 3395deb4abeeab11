package com.fams.security;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * The closed, versioned set of permissions recognised by the system.
 *
 * <p>The catalog is additive only: {@link #register(Permission)} may add new codes (each addition
 * bumps {@link #version()}), but nothing can be removed or redefined. Readers always see a
 * consistent immutable snapshot and never block.
 */
public final class PermissionCatalog {

  private static final Comparator<Permission> DISPLAY_ORDER =
      Comparator.comparing(Permission::module).thenComparing(Permission::code);

  private record Snapshot(long version, ImmutableMap<String, Permission> byCode) {}

  private volatile Snapshot snapshot;

  private PermissionCatalog(ImmutableMap<String, Permission> byCode) {
    this.snapshot = new Snapshot(1L, byCode);
  }

  /** Creates a catalog holding the permissions shipped with the system. */
  public static PermissionCatalog builtIn() {
    return of(Permissions.builtIn());
  }

  /**
   * Creates a catalog from the given definitions.
   *
   * @throws IllegalArgumentException if two definitions share a code
   */
  public static PermissionCatalog of(Collection<Permission> permissions) {
    ImmutableMap.Builder<String, Permission> builder = ImmutableMap.builder();
    for (Permission p : permissions) {
      builder.put(p.code(), p);
    }
    return new PermissionCatalog(builder.buildOrThrow());
  }

  /** Returns every permission, ordered by module then code. */
  @Nonnull
  public ImmutableSet<Permission> listAll() {
    return ImmutableSortedSet.copyOf(DISPLAY_ORDER, snapshot.byCode().values());
  }

  /** Returns every permission code in the catalog. */
  @Nonnull
  public ImmutableSet<String> codes() {
    return snapshot.byCode().keySet();
  }

  public boolean exists(String code) {
    return code != null && snapshot.byCode().containsKey(code);
  }

  /**
   * Returns the definition for a code.
   *
   * @throws UnknownPermissionException if the code is not in the catalog
   */
  @Nonnull
  public Permission get(String code) {
    Permission permission = code == null ? null : snapshot.byCode().get(code);
    if (permission == null) {
      throw new UnknownPermissionException(ImmutableSet.of(String.valueOf(code)));
    }
    return permission;
  }

  /** Returns the subset of {@code codes} that is not in the catalog. Never throws. */
  @Nonnull
  public ImmutableSet<String> unknownCodes(Collection<String> codes) {
    ImmutableMap<String, Permission> byCode = snapshot.byCode();
    ImmutableSet.Builder<String> unknown = ImmutableSet.builder();
    for (String code : codes) {
      if (code == null || !byCode.containsKey(code)) {
        unknown.add(String.valueOf(code));
      }
    }
    return unknown.build();
  }

  /**
   * Verifies that every code is in the catalog.
   *
   * @throws UnknownPermissionException listing all unknown codes
   */
  public void requireAll(Collection<String> codes) {
    ImmutableSet<String> unknown = unknownCodes(codes);
    if (!unknown.isEmpty()) {
      throw new UnknownPermissionException(unknown);
    }
  }

  /**
   * Adds a permission to the catalog.
   *
   * @return true if the permission was new, false if an identical definition already existed
   * @throws IllegalArgumentException if the code exists with a different definition
   */
  public synchronized boolean register(Permission permission) {
    Objects.requireNonNull(permission, "permission must not be null");
    Snapshot current = snapshot;
    Permission existing = current.byCode().get(permission.code());
    if (existing != null) {
      if (existing.equals(permission)) {
        return false;
      }
      throw new IllegalArgumentException(
          "Permission '" + permission.code() + "' is already defined differently: " + existing);
    }
    ImmutableMap<String, Permission> next =
        ImmutableMap.<String, Permission>builder()
            .putAll(current.byCode())
            .put(permission.code(), permission)
            .buildOrThrow();
    snapshot = new Snapshot(current.version() + 1, next);
    Logger.info(
        "Registered permission {} (catalog version {})", permission.code(), current.version() + 1);
    return true;
  }

  /** Returns the catalog version; it increases by one with every registered permission. */
  public long version() {
    return snapshot.version();
  }

  public int size() {
    return snapshot.byCode().size();
  }
}
