package com.fams.operations;

import com.fams.audit.AuditAction;
import com.fams.audit.AuditSink;
import com.fams.audit.AuditValues;
import com.fams.authz.AuthorizationDecision;
import com.fams.authz.AuthorizationEngine;
import com.fams.authz.PositionRegistry;
import com.fams.authz.UserPositionBinding;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.EffectivePermissions;
import com.fams.security.Permission;
import com.fams.security.PermissionCatalog;
import com.fams.security.Permissions;
import com.fams.security.Position;
import com.fams.security.PositionDraft;
import com.fams.security.UserAccount;
import com.fams.store.UserDirectory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import java.time.Clock;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * The administrative surface over positions and bindings.
 *
 * <p>Every call names the acting user and is authorized first: position changes need
 * {@code manage_positions}, binding users needs {@code manage_users}, listing needs the matching
 * {@code view_*} permission. A denial surfaces as PERMISSION_DENIED, an authorization that could
 * not be evaluated as UNAVAILABLE. Successful changes are recorded as {@link AuditAction}s.
 */
public class PositionAdministration {

  private static final String POSITION_ENTITY = "position";
  private static final String USER_ENTITY = "user";

  private final AuthorizationEngine engine;
  private final PositionRegistry registry;
  private final UserPositionBinding binding;
  private final UserDirectory users;
  private final PermissionCatalog catalog;
  private final AuditSink auditSink;
  private final Clock clock;

  public PositionAdministration(
      AuthorizationEngine engine,
      PositionRegistry registry,
      UserPositionBinding binding,
      UserDirectory users,
      PermissionCatalog catalog,
      AuditSink auditSink,
      Clock clock) {
    this.engine = engine;
    this.registry = registry;
    this.binding = binding;
    this.users = users;
    this.catalog = catalog;
    this.auditSink = auditSink;
    this.clock = clock;
  }

  public StatusOr<Position> createPosition(UUID actorId, PositionDraft draft) {
    Status allowed = authorize(actorId, Permissions.MANAGE_POSITIONS);
    if (allowed.isError()) {
      return StatusOr.ofStatus(allowed);
    }
    StatusOr<Position> created = registry.create(draft);
    if (created.isOk()) {
      Position position = created.getValue();
      record(actorId, position.id(), AuditAction.Type.CREATE, null, AuditValues.of(position));
    }
    return created;
  }

  public StatusOr<Position> updatePermissions(
      UUID actorId, UUID positionId, Collection<String> permissionCodes) {
    Status allowed = authorize(actorId, Permissions.MANAGE_POSITIONS);
    if (allowed.isError()) {
      return StatusOr.ofStatus(allowed);
    }
    Optional<Position> before = registry.get(positionId).asOptional();
    StatusOr<Position> updated = registry.update(positionId, permissionCodes);
    if (updated.isOk()) {
      recordUpdate(actorId, before, updated.getValue());
    }
    return updated;
  }

  public StatusOr<Position> updateDetails(
      UUID actorId,
      UUID positionId,
      String name,
      @Nullable String localizedName,
      String description,
      int level) {
    Status allowed = authorize(actorId, Permissions.MANAGE_POSITIONS);
    if (allowed.isError()) {
      return StatusOr.ofStatus(allowed);
    }
    Optional<Position> before = registry.get(positionId).asOptional();
    StatusOr<Position> updated =
        registry.updateDetails(positionId, name, localizedName, description, level);
    if (updated.isOk()) {
      recordUpdate(actorId, before, updated.getValue());
    }
    return updated;
  }

  public StatusOr<Position> setActive(UUID actorId, UUID positionId, boolean active) {
    Status allowed = authorize(actorId, Permissions.MANAGE_POSITIONS);
    if (allowed.isError()) {
      return StatusOr.ofStatus(allowed);
    }
    Optional<Position> before = registry.get(positionId).asOptional();
    StatusOr<Position> updated = registry.setActive(positionId, active);
    if (updated.isOk()) {
      recordUpdate(actorId, before, updated.getValue());
    }
    return updated;
  }

  public Status deletePosition(UUID actorId, UUID positionId) {
    Status allowed = authorize(actorId, Permissions.MANAGE_POSITIONS);
    if (allowed.isError()) {
      return allowed;
    }
    Optional<Position> before = registry.get(positionId).asOptional();
    Status deleted = registry.delete(positionId);
    if (deleted.isOk()) {
      record(
          actorId,
          positionId,
          AuditAction.Type.DELETE,
          before.map(AuditValues::of).orElse(null),
          null);
    }
    return deleted;
  }

  public Status bindUser(UUID actorId, UUID userId, UUID positionId) {
    Status allowed = authorize(actorId, Permissions.MANAGE_USERS);
    if (allowed.isError()) {
      return allowed;
    }
    UUID previous =
        users.loadUser(userId)
            .asOptional()
            .flatMap(account -> account)
            .map(UserAccount::positionId)
            .orElse(null);
    Status bound = binding.bind(userId, positionId);
    if (bound.isOk()) {
      record(
          actorId,
          userId,
          USER_ENTITY,
          AuditAction.Type.BIND,
          AuditValues.binding(previous),
          AuditValues.binding(positionId));
    }
    return bound;
  }

  public StatusOr<ImmutableList<Position>> listPositions(UUID actorId) {
    Status allowed = authorize(actorId, Permissions.VIEW_POSITIONS);
    if (allowed.isError()) {
      return StatusOr.ofStatus(allowed);
    }
    return registry.listAll();
  }

  public StatusOr<ImmutableSet<Permission>> listPermissions(UUID actorId) {
    Status allowed = authorize(actorId, Permissions.VIEW_PERMISSIONS);
    if (allowed.isError()) {
      return StatusOr.ofStatus(allowed);
    }
    return StatusOr.ofValue(catalog.listAll());
  }

  /** The caller's own permissions. Needs no permission beyond having a usable position. */
  public StatusOr<EffectivePermissions> myPermissions(UUID actorId) {
    return engine.effectivePermissions(actorId);
  }

  private Status authorize(UUID actorId, String code) {
    AuthorizationDecision decision = engine.check(actorId, code);
    if (decision.isAllowed()) {
      return Status.ok();
    }
    Logger.warn("User {} denied {} ({})", actorId, code, decision.reason());
    return decision.toStatus();
  }

  private void recordUpdate(UUID actorId, Optional<Position> before, Position after) {
    record(
        actorId,
        after.id(),
        AuditAction.Type.UPDATE,
        before.map(AuditValues::of).orElse(null),
        AuditValues.of(after));
  }

  private void record(
      UUID actorId,
      UUID positionId,
      AuditAction.Type type,
      @Nullable JsonObject oldValues,
      @Nullable JsonObject newValues) {
    record(actorId, positionId, POSITION_ENTITY, type, oldValues, newValues);
  }

  // The change is already committed; a failed audit write is logged, not rolled back.
  private void record(
      UUID actorId,
      UUID entityId,
      String entityType,
      AuditAction.Type type,
      @Nullable JsonObject oldValues,
      @Nullable JsonObject newValues) {
    AuditAction action =
        new AuditAction(
            UUID.randomUUID(),
            actorId,
            entityType,
            entityId,
            type,
            oldValues,
            newValues,
            clock.instant());
    try {
      Status recorded = auditSink.recordAction(action);
      if (recorded.isError()) {
        Logger.error("Audit of {} {} {} failed: {}", type, entityType, entityId, recorded);
      }
    } catch (RuntimeException e) {
      Logger.error(e, "Audit of {} {} {} failed", type, entityType, entityId);
    }
  }
}
