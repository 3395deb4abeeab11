package com.fams.security;

import com.google.common.collect.ImmutableSet;
import java.util.UUID;

/**
 * The permission set a position actually grants at a point in time.
 *
 * <p>For a full-catalog position {@code codes} is the catalog contents when the set was resolved;
 * for every other position it is the explicit snapshot.
 */
public record EffectivePermissions(
    UUID positionId, boolean fullCatalogGrant, long catalogVersion, ImmutableSet<String> codes)
    implements PermissionChecker {

  public static EffectivePermissions resolve(Position position, PermissionCatalog catalog) {
    long version = catalog.version();
    ImmutableSet<String> codes =
        position.fullCatalogGrant() ? catalog.codes() : position.permissionCodes();
    return new EffectivePermissions(position.id(), position.fullCatalogGrant(), version, codes);
  }

  @Override
  public boolean hasPermission(String code) {
    return codes.contains(code);
  }
}
