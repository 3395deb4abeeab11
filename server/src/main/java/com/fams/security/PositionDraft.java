package com.fams.security;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import javax.annotation.Nullable;

/**
 * The caller-supplied part of a new {@link Position}. Identity, timestamps and flags are assigned
 * by the registry.
 */
public record PositionDraft(
    String name,
    @Nullable String localizedName,
    String description,
    int level,
    ImmutableSet<String> permissionCodes) {

  public PositionDraft {
    description = description == null ? "" : description;
    permissionCodes = permissionCodes == null ? ImmutableSet.of() : permissionCodes;
  }

  public static PositionDraft of(String name, Collection<String> permissionCodes) {
    return new PositionDraft(name, null, "", 1, ImmutableSet.copyOf(permissionCodes));
  }
}
