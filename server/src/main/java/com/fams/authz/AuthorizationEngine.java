package com.fams.authz;

import com.fams.audit.AuditSink;
import com.fams.authz.AuthorizationDecision.Mode;
import com.fams.authz.AuthorizationDecision.Outcome;
import com.fams.authz.AuthorizationDecision.Reason;
import com.fams.authz.EffectivePermissionCache.ResolvedPosition;
import com.fams.common.status.Status;
import com.fams.common.status.StatusOr;
import com.fams.security.EffectivePermissions;
import com.fams.security.PermissionCatalog;
import com.fams.security.UnknownPermissionException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.Clock;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Answers "may this user do this?" for every request.
 *
 * <p>A check validates the required codes against the catalog, resolves the user's position
 * through the {@link UserPositionBinding} and the {@link EffectivePermissionCache}, evaluates the
 * requirement and hands the decision to the {@link AuditSink} before returning it.
 *
 * <p>The engine fails closed. Anything that prevents an answer (a storage fault, an unexpected
 * runtime failure, an audit sink that cannot record the decision) yields DENY. The one exception
 * is an unknown permission code, which is a defect in the caller and is thrown as
 * {@link UnknownPermissionException}.
 */
public class AuthorizationEngine {

  private final PermissionCatalog catalog;
  private final UserPositionBinding binding;
  private final EffectivePermissionCache cache;
  private final AuditSink auditSink;
  private final Clock clock;

  public AuthorizationEngine(
      PermissionCatalog catalog,
      UserPositionBinding binding,
      EffectivePermissionCache cache,
      AuditSink auditSink,
      Clock clock) {
    this.catalog = catalog;
    this.binding = binding;
    this.cache = cache;
    this.auditSink = auditSink;
    this.clock = clock;
  }

  /** Allows if the user's position grants {@code code}. */
  @Nonnull
  public AuthorizationDecision check(UUID userId, String code) {
    return decide(userId, Mode.SINGLE, ImmutableList.of(code));
  }

  /** Allows if the user's position grants every code. An empty list is trivially satisfied. */
  @Nonnull
  public AuthorizationDecision checkAll(UUID userId, Collection<String> codes) {
    return decide(userId, Mode.ALL, ImmutableList.copyOf(codes));
  }

  /** Allows if the user's position grants at least one code. An empty list never allows. */
  @Nonnull
  public AuthorizationDecision checkAny(UUID userId, Collection<String> codes) {
    return decide(userId, Mode.ANY, ImmutableList.copyOf(codes));
  }

  /**
   * Returns the permissions a user currently holds. Read-only and not audited.
   *
   * @return the effective set, NO_POSITION when the user has no usable position (including an
   *     inactive one), or UNAVAILABLE on a storage fault
   */
  @Nonnull
  public StatusOr<EffectivePermissions> effectivePermissions(UUID userId) {
    Resolution resolution = resolve(userId);
    if (resolution.failure() != null) {
      return switch (resolution.failure()) {
        case STORAGE_UNAVAILABLE -> AuthzFailure.STORAGE_UNAVAILABLE.error(
            "Permissions of user " + userId + " could not be loaded");
        default -> AuthzFailure.NO_POSITION.error(
            "User " + userId + " has no usable position (" + resolution.failure() + ")");
      };
    }
    return StatusOr.ofValue(resolution.permissions());
  }

  private AuthorizationDecision decide(UUID userId, Mode mode, ImmutableList<String> required) {
    Objects.requireNonNull(userId, "userId must not be null");
    ImmutableSet<String> unknown = catalog.unknownCodes(required);
    if (!unknown.isEmpty()) {
      Logger.error("Authorization requested for unknown permission code(s) {}", unknown);
      throw new UnknownPermissionException(unknown);
    }

    Resolution resolution = resolve(userId);
    AuthorizationDecision decision;
    if (resolution.failure() != null) {
      decision = newDecision(userId, mode, required, resolution, Outcome.DENY, resolution.failure());
    } else {
      boolean granted = evaluate(mode, required, resolution.permissions());
      decision =
          newDecision(
              userId,
              mode,
              required,
              resolution,
              granted ? Outcome.ALLOW : Outcome.DENY,
              granted ? Reason.GRANTED : Reason.INSUFFICIENT_PERMISSION);
    }
    Logger.debug(
        "{} {} {} for user {}: {}", decision.outcome(), mode, required, userId, decision.reason());
    return audited(decision);
  }

  private static boolean evaluate(
      Mode mode, ImmutableList<String> required, EffectivePermissions permissions) {
    return switch (mode) {
      case SINGLE, ALL -> permissions.hasAllPermissions(required);
      case ANY -> permissions.hasAnyPermission(required);
    };
  }

  private AuthorizationDecision audited(AuthorizationDecision decision) {
    Status recorded;
    try {
      recorded = auditSink.recordDecision(decision);
    } catch (RuntimeException e) {
      Logger.error(e, "Audit sink rejected decision {}", decision.decisionId());
      return decision.unaudited();
    }
    if (recorded.isError()) {
      Logger.error("Audit sink could not record decision {}: {}", decision.decisionId(), recorded);
      return decision.unaudited();
    }
    return decision;
  }

  private Resolution resolve(UUID userId) {
    try {
      StatusOr<UUID> positionIdOr = binding.boundPositionId(userId);
      if (positionIdOr.isNotOk()) {
        Status status = positionIdOr.getStatus();
        if (AuthzFailure.UNKNOWN_USER.matches(status) || AuthzFailure.NO_POSITION.matches(status)) {
          return Resolution.failed(null, Reason.NO_POSITION);
        }
        Logger.error("Failed to load user {}: {}", userId, status);
        return Resolution.failed(null, Reason.STORAGE_UNAVAILABLE);
      }
      UUID positionId = positionIdOr.getValue();

      StatusOr<Optional<ResolvedPosition>> positionOr = cache.resolve(positionId);
      if (positionOr.isNotOk()) {
        Logger.error("Failed to load position {}: {}", positionId, positionOr.getStatus());
        return Resolution.failed(positionId, Reason.STORAGE_UNAVAILABLE);
      }
      if (positionOr.getValue().isEmpty()) {
        Logger.warn("User {} references missing position {}", userId, positionId);
        return Resolution.failed(positionId, Reason.NO_POSITION);
      }
      ResolvedPosition resolved = positionOr.getValue().get();
      if (!resolved.position().active()) {
        return Resolution.failed(positionId, Reason.POSITION_INACTIVE);
      }
      return Resolution.granted(positionId, resolved.permissions());
    } catch (RuntimeException e) {
      Logger.error(e, "Unexpected failure resolving permissions of user {}", userId);
      return Resolution.failed(null, Reason.STORAGE_UNAVAILABLE);
    }
  }

  private AuthorizationDecision newDecision(
      UUID userId,
      Mode mode,
      ImmutableList<String> required,
      Resolution resolution,
      Outcome outcome,
      Reason reason) {
    return new AuthorizationDecision(
        UUID.randomUUID(),
        userId,
        required,
        mode,
        resolution.positionId(),
        resolution.permissions() == null ? ImmutableSet.of() : resolution.permissions().codes(),
        outcome,
        reason,
        clock.instant());
  }

  /** Either a usable effective set or the reason there is none. */
  private record Resolution(
      @Nullable UUID positionId,
      @Nullable EffectivePermissions permissions,
      @Nullable Reason failure) {

    static Resolution granted(UUID positionId, EffectivePermissions permissions) {
      return new Resolution(positionId, permissions, null);
    }

    static Resolution failed(@Nullable UUID positionId, Reason failure) {
      return new Resolution(positionId, null, failure);
    }
  }
}
