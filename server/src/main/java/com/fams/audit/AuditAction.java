package com.fams.audit;

import com.google.gson.JsonObject;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * A mutating administrative action, recorded with the entity state before and after.
 *
 * @param actionId unique identifier
 * @param actorId the user who performed the action
 * @param entityType the kind of entity changed, for example {@code "position"}
 * @param entityId the changed entity
 * @param action what was done
 * @param oldValues entity state before the action, null for CREATE
 * @param newValues entity state after the action, null for DELETE
 * @param occurredAt when the action completed
 */
public record AuditAction(
    UUID actionId,
    UUID actorId,
    String entityType,
    UUID entityId,
    Type action,
    @Nullable JsonObject oldValues,
    @Nullable JsonObject newValues,
    Instant occurredAt) {

  public enum Type {
    CREATE,
    UPDATE,
    DELETE,
    BIND
  }

  public AuditAction {
    Objects.requireNonNull(actionId, "actionId must not be null");
    Objects.requireNonNull(actorId, "actorId must not be null");
    Objects.requireNonNull(entityType, "entityType must not be null");
    Objects.requireNonNull(entityId, "entityId must not be null");
    Objects.requireNonNull(action, "action must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
  }
}
