package com.fams.audit;

import static org.junit.jupiter.api.Assertions.*;

import com.fams.authz.AuthorizationDecision;
import com.fams.authz.AuthorizationDecision.Mode;
import com.fams.authz.AuthorizationDecision.Outcome;
import com.fams.authz.AuthorizationDecision.Reason;
import com.fams.security.Permissions;
import com.fams.security.Position;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LoggingAuditSinkTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  private final LoggingAuditSink sink = new LoggingAuditSink();

  @Test
  void recordsDecisionsAndActions() {
    AuthorizationDecision decision =
        new AuthorizationDecision(
            UUID.randomUUID(),
            UUID.randomUUID(),
            ImmutableList.of(Permissions.VIEW_ASSETS),
            Mode.SINGLE,
            null,
            ImmutableSet.of(),
            Outcome.DENY,
            Reason.NO_POSITION,
            NOW);
    AuditAction action =
        new AuditAction(
            UUID.randomUUID(),
            UUID.randomUUID(),
            "user",
            UUID.randomUUID(),
            AuditAction.Type.BIND,
            AuditValues.binding(null),
            AuditValues.binding(UUID.randomUUID()),
            NOW);

    assertTrue(sink.recordDecision(decision).isOk());
    assertTrue(sink.recordAction(action).isOk());
  }

  @Test
  void decisionLineCarriesTheEffectiveSet() {
    UUID positionId = UUID.randomUUID();
    AuthorizationDecision decision =
        new AuthorizationDecision(
            UUID.randomUUID(),
            UUID.randomUUID(),
            ImmutableList.of(Permissions.DELETE_ASSETS),
            Mode.SINGLE,
            positionId,
            ImmutableSet.of(Permissions.VIEW_USERS, Permissions.VIEW_ASSETS),
            Outcome.DENY,
            Reason.INSUFFICIENT_PERMISSION,
            NOW);

    Object[] fields = LoggingAuditSink.decisionFields(decision);

    assertTrue(LoggingAuditSink.DECISION_FORMAT.contains("effective={}"));
    assertEquals(placeholders(LoggingAuditSink.DECISION_FORMAT), fields.length);
    assertEquals(positionId, fields[4]);
    assertEquals(
        ImmutableList.of(Permissions.VIEW_ASSETS, Permissions.VIEW_USERS),
        ImmutableList.copyOf((Iterable<?>) fields[5]));
    assertEquals(Outcome.DENY, fields[6]);
  }

  @Test
  void actionLineMatchesItsFormat() {
    AuditAction action =
        new AuditAction(
            UUID.randomUUID(),
            UUID.randomUUID(),
            "position",
            UUID.randomUUID(),
            AuditAction.Type.DELETE,
            null,
            null,
            NOW);

    Object[] fields = LoggingAuditSink.actionFields(action);

    assertEquals(placeholders(LoggingAuditSink.ACTION_FORMAT), fields.length);
    assertEquals("null", fields[6]);
  }

  private static int placeholders(String format) {
    return format.split("\\{}", -1).length - 1;
  }

  @Test
  void positionValuesAreSortedJson() {
    Position position =
        new Position(
            UUID.randomUUID(),
            "Auditor",
            "المدقق",
            "Read only",
            2,
            true,
            false,
            ImmutableSet.of(Permissions.VIEW_USERS, Permissions.VIEW_ASSETS),
            NOW,
            NOW);

    JsonObject values = AuditValues.of(position);

    assertEquals("Auditor", values.get("name").getAsString());
    assertEquals(2, values.get("level").getAsInt());
    assertEquals(Permissions.VIEW_ASSETS, values.getAsJsonArray("permissions").get(0).getAsString());
    assertEquals("null", AuditValues.toJson(null));
    assertTrue(AuditValues.toJson(values).contains("\"full_catalog_grant\":false"));
  }
}
