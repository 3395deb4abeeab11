package com.fams.authz;

import com.fams.common.status.Status;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * The outcome of one authorization check, as delivered to the audit sink.
 *
 * @param decisionId unique identifier of this decision
 * @param userId the user the check was made for
 * @param required the permission codes the caller asked for, in request order
 * @param mode how {@code required} was combined
 * @param positionId the position the user was bound to, null if none could be resolved
 * @param effectivePermissions the permissions the decision was evaluated against
 * @param outcome ALLOW or DENY
 * @param reason why the outcome was reached
 * @param decidedAt when the decision was made
 */
public record AuthorizationDecision(
    UUID decisionId,
    UUID userId,
    ImmutableList<String> required,
    Mode mode,
    @Nullable UUID positionId,
    ImmutableSet<String> effectivePermissions,
    Outcome outcome,
    Reason reason,
    Instant decidedAt) {

  public enum Mode {
    SINGLE,
    ALL,
    ANY
  }

  public enum Outcome {
    ALLOW,
    DENY
  }

  public enum Reason {
    GRANTED,
    NO_POSITION,
    POSITION_INACTIVE,
    INSUFFICIENT_PERMISSION,
    STORAGE_UNAVAILABLE,
    AUDIT_UNAVAILABLE
  }

  public AuthorizationDecision {
    Objects.requireNonNull(decisionId, "decisionId must not be null");
    Objects.requireNonNull(userId, "userId must not be null");
    Objects.requireNonNull(mode, "mode must not be null");
    Objects.requireNonNull(outcome, "outcome must not be null");
    Objects.requireNonNull(reason, "reason must not be null");
    Objects.requireNonNull(decidedAt, "decidedAt must not be null");
    required = required == null ? ImmutableList.of() : required;
    effectivePermissions = effectivePermissions == null ? ImmutableSet.of() : effectivePermissions;
    if ((outcome == Outcome.ALLOW) != (reason == Reason.GRANTED)) {
      throw new IllegalArgumentException(outcome + " cannot carry reason " + reason);
    }
  }

  public boolean isAllowed() {
    return outcome == Outcome.ALLOW;
  }

  public boolean isDenied() {
    return outcome == Outcome.DENY;
  }

  /** Returns the DENY decision that replaces this one when it could not be audited. */
  public AuthorizationDecision unaudited() {
    return new AuthorizationDecision(
        decisionId,
        userId,
        required,
        mode,
        positionId,
        effectivePermissions,
        Outcome.DENY,
        Reason.AUDIT_UNAVAILABLE,
        decidedAt);
  }

  /**
   * Converts the decision into a status for callers that propagate failures: OK when allowed,
   * UNAVAILABLE for infrastructure faults, PERMISSION_DENIED otherwise. The decision reason
   * travels as the status reason.
   */
  public Status toStatus() {
    return switch (reason) {
      case GRANTED -> Status.ok();
      case STORAGE_UNAVAILABLE, AUDIT_UNAVAILABLE -> Status.unavailable(
              "Authorization could not be evaluated for user " + userId, null)
          .withReason(reason.name());
      default -> Status.permissionDenied("User " + userId + " lacks " + describeRequirement())
          .withReason(reason.name());
    };
  }

  private String describeRequirement() {
    return switch (mode) {
      case SINGLE -> String.join("", required);
      case ALL -> "all of " + required;
      case ANY -> "any of " + required;
    };
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("decisionId", decisionId)
        .add("userId", userId)
        .add("mode", mode)
        .add("required", required)
        .add("positionId", positionId)
        .add("outcome", outcome)
        .add("reason", reason)
        .toString();
  }
}
