package com.fams.security;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * A named role in the organisation that carries a set of permissions.
 *
 * <p>Instances are immutable snapshots. The registry replaces a whole snapshot on every mutation,
 * so a reader holding a {@code Position} sees either the old or the new permission set, never a
 * mix of both.
 *
 * <p>When {@code fullCatalogGrant} is set the stored codes are informational only: the effective
 * set is whatever the {@link PermissionCatalog} contains at check time.
 *
 * @param id unique identifier
 * @param name English display name, unique ignoring case
 * @param localizedName Arabic display name, may be null
 * @param description free text
 * @param level hierarchy level, higher is more senior
 * @param active inactive positions deny every check
 * @param fullCatalogGrant whether the position implicitly holds every catalog permission
 * @param permissionCodes the explicitly granted codes
 * @param createdAt creation time
 * @param updatedAt time of the last mutation
 */
public record Position(
    UUID id,
    String name,
    @Nullable String localizedName,
    String description,
    int level,
    boolean active,
    boolean fullCatalogGrant,
    ImmutableSet<String> permissionCodes,
    Instant createdAt,
    Instant updatedAt) {

  public Position {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    description = description == null ? "" : description;
    permissionCodes = permissionCodes == null ? ImmutableSet.of() : permissionCodes;
  }

  /** Normalizes a position name for case-insensitive uniqueness checks. */
  public static String normalizeName(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }

  public String normalizedName() {
    return normalizeName(name);
  }

  /** Returns a copy carrying a new explicit permission set. */
  public Position withPermissions(Collection<String> codes, Instant now) {
    return new Position(
        id,
        name,
        localizedName,
        description,
        level,
        active,
        fullCatalogGrant,
        ImmutableSet.copyOf(codes),
        createdAt,
        now);
  }

  /** Returns a copy with new display details; permissions are untouched. */
  public Position withDetails(
      String newName,
      @Nullable String newLocalizedName,
      String newDescription,
      int newLevel,
      Instant now) {
    return new Position(
        id,
        newName,
        newLocalizedName,
        newDescription,
        newLevel,
        active,
        fullCatalogGrant,
        permissionCodes,
        createdAt,
        now);
  }

  public Position withActive(boolean newActive, Instant now) {
    return new Position(
        id,
        name,
        localizedName,
        description,
        level,
        newActive,
        fullCatalogGrant,
        permissionCodes,
        createdAt,
        now);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("name", name)
        .add("level", level)
        .add("active", active)
        .add("fullCatalogGrant", fullCatalogGrant)
        .add("permissionCodes", permissionCodes)
        .toString();
  }
}
