package com.fams.audit;

import com.fams.authz.AuthorizationDecision;
import com.fams.common.status.Status;

/**
 * Append-only destination for authorization decisions and administrative actions.
 *
 * <p>Callers treat a non-OK status and a thrown runtime exception alike: the record was not
 * stored. The authorization engine refuses to return an ALLOW it could not audit.
 */
public interface AuditSink {

  Status recordDecision(AuthorizationDecision decision);

  Status recordAction(AuditAction action);
}
