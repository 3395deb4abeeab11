package com.fams.audit;

import com.fams.authz.AuthorizationDecision;
import com.fams.common.status.Status;
import com.google.common.collect.ImmutableSortedSet;
import org.tinylog.Logger;
import org.tinylog.TaggedLogger;

/**
 * Writes audit records to the {@code audit} tinylog tag. The logging configuration decides where
 * that tag ends up (a separate file in production).
 */
public class LoggingAuditSink implements AuditSink {

  private static final TaggedLogger AUDIT = Logger.tag("audit");

  static final String DECISION_FORMAT =
      "decision={} user={} mode={} required={} position={} effective={} outcome={} reason={}"
          + " at={}";
  static final String ACTION_FORMAT = "action={} actor={} {}={} type={} old={} new={} at={}";

  @Override
  public Status recordDecision(AuthorizationDecision decision) {
    AUDIT.info(DECISION_FORMAT, decisionFields(decision));
    return Status.ok();
  }

  @Override
  public Status recordAction(AuditAction action) {
    AUDIT.info(ACTION_FORMAT, actionFields(action));
    return Status.ok();
  }

  /** Arguments for {@link #DECISION_FORMAT}, in placeholder order. */
  static Object[] decisionFields(AuthorizationDecision decision) {
    return new Object[] {
      decision.decisionId(),
      decision.userId(),
      decision.mode(),
      decision.required(),
      decision.positionId(),
      ImmutableSortedSet.copyOf(decision.effectivePermissions()),
      decision.outcome(),
      decision.reason(),
      decision.decidedAt()
    };
  }

  /** Arguments for {@link #ACTION_FORMAT}, in placeholder order. */
  static Object[] actionFields(AuditAction action) {
    return new Object[] {
      action.actionId(),
      action.actorId(),
      action.entityType(),
      action.entityId(),
      action.action(),
      AuditValues.toJson(action.oldValues()),
      AuditValues.toJson(action.newValues()),
      action.occurredAt()
    };
  }
}
