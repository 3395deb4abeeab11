package com.fams.authz;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fams.audit.AuditSink;
import com.fams.authz.AuthorizationDecision.Mode;
import com.fams.authz.AuthorizationDecision.Outcome;
import com.fams.authz.AuthorizationDecision.Reason;
import com.fams.common.status.Status;
import com.fams.common.status.StatusCode;
import com.fams.common.status.StatusOr;
import com.fams.security.EffectivePermissions;
import com.fams.security.Permission;
import com.fams.security.PermissionCatalog;
import com.fams.security.Permissions;
import com.fams.security.Position;
import com.fams.security.UnknownPermissionException;
import com.fams.security.UserAccount;
import com.fams.store.InMemoryPositionStore;
import com.fams.store.InMemoryUserDirectory;
import com.fams.store.PositionStore;
import com.fams.store.UserDirectory;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthorizationEngineTest {

  @Mock private UserDirectory mockUsers;
  @Mock private PositionStore mockPositions;
  @Mock private AuditSink mockSink;
  @Mock private UserPositionBinding mockBinding;

  private AuthzFixture fixture;
  private Position auditor;
  private UUID auditorUser;
  private UUID adminUser;

  @BeforeEach
  void setUp() {
    fixture = new AuthzFixture();
    auditor =
        fixture.position("Auditor", List.of(Permissions.VIEW_ASSETS, Permissions.GENERATE_REPORTS));
    auditorUser = fixture.userWith("alice", auditor);
    Position admin = fixture.registry.ensureSystemAdministrator().getValue();
    adminUser = fixture.userWith("root", admin);
    fixture.recordingSink.clear();
  }

  @Test
  void allowsOnlyWhatThePositionGrants() {
    // When: the auditor asks for a granted and an ungranted permission
    AuthorizationDecision view = fixture.engine.check(auditorUser, Permissions.VIEW_ASSETS);
    AuthorizationDecision manage = fixture.engine.check(auditorUser, Permissions.MANAGE_ASSETS);

    // Then
    assertEquals(Outcome.ALLOW, view.outcome());
    assertEquals(Reason.GRANTED, view.reason());
    assertEquals(auditor.id(), view.positionId());
    assertEquals(Outcome.DENY, manage.outcome());
    assertEquals(Reason.INSUFFICIENT_PERMISSION, manage.reason());
    assertEquals(StatusCode.PERMISSION_DENIED, manage.toStatus().getCode());
  }

  @Test
  void newCatalogCodesReachOnlyTheFullCatalogPosition() {
    // Given: a permission registered after both positions exist
    fixture.catalog.register(Permission.of("export_audit_logs", "Export Audit Logs", "system"));

    // Then: the explicit snapshot does not inherit it, the administrator does
    assertEquals(Reason.INSUFFICIENT_PERMISSION,
        fixture.engine.check(auditorUser, "export_audit_logs").reason());
    assertTrue(fixture.engine.check(adminUser, "export_audit_logs").isAllowed());
  }

  @Test
  void administratorHoldsEveryCatalogCode() {
    for (String code : fixture.catalog.codes()) {
      assertTrue(fixture.engine.check(adminUser, code).isAllowed(), code);
    }
  }

  @Test
  void checkMatchesMembershipForEveryCatalogCode() {
    for (String code : fixture.catalog.codes()) {
      boolean expected = auditor.permissionCodes().contains(code);
      assertEquals(expected, fixture.engine.check(auditorUser, code).isAllowed(), code);
    }
  }

  @Test
  void checkAllNeedsEveryCodeAndAcceptsEmptyRequirement() {
    assertTrue(fixture.engine
        .checkAll(auditorUser, List.of(Permissions.VIEW_ASSETS, Permissions.GENERATE_REPORTS))
        .isAllowed());
    assertFalse(fixture.engine
        .checkAll(auditorUser, List.of(Permissions.VIEW_ASSETS, Permissions.EXPORT_DATA))
        .isAllowed());
    assertTrue(fixture.engine.checkAll(auditorUser, List.of()).isAllowed());
  }

  @Test
  void checkAnyNeedsOneCodeAndRejectsEmptyRequirement() {
    assertTrue(fixture.engine
        .checkAny(auditorUser, List.of(Permissions.EXPORT_DATA, Permissions.GENERATE_REPORTS))
        .isAllowed());
    assertFalse(fixture.engine
        .checkAny(auditorUser, List.of(Permissions.EXPORT_DATA, Permissions.DELETE_FILES))
        .isAllowed());
    AuthorizationDecision empty = fixture.engine.checkAny(auditorUser, List.of());
    assertEquals(Reason.INSUFFICIENT_PERMISSION, empty.reason());
  }

  @Test
  void userWithoutPositionIsDeniedEverything() {
    UUID drifter = fixture.user("drifter");

    assertEquals(Reason.NO_POSITION, fixture.engine.check(drifter, Permissions.VIEW_ASSETS).reason());
    assertEquals(Reason.NO_POSITION, fixture.engine.checkAll(drifter, List.of()).reason());
    assertEquals(Reason.NO_POSITION, fixture.engine.checkAny(drifter, List.of()).reason());
  }

  @Test
  void unknownUserIsDeniedWithNoPosition() {
    AuthorizationDecision decision =
        fixture.engine.check(UUID.randomUUID(), Permissions.VIEW_ASSETS);

    assertEquals(Outcome.DENY, decision.outcome());
    assertEquals(Reason.NO_POSITION, decision.reason());
    assertNull(decision.positionId());
  }

  @Test
  void danglingPositionReferenceIsDeniedWithNoPosition() {
    UUID ghostUser = UUID.randomUUID();
    fixture.users.save(new UserAccount(ghostUser, "ghost", UUID.randomUUID()));

    assertEquals(Reason.NO_POSITION, fixture.engine.check(ghostUser, Permissions.VIEW_ASSETS).reason());
  }

  @Test
  void inactivePositionDeniesEverything() {
    fixture.registry.setActive(auditor.id(), false);

    AuthorizationDecision decision = fixture.engine.check(auditorUser, Permissions.VIEW_ASSETS);
    assertEquals(Reason.POSITION_INACTIVE, decision.reason());
    assertTrue(decision.effectivePermissions().isEmpty());

    fixture.registry.setActive(auditor.id(), true);
    assertTrue(fixture.engine.check(auditorUser, Permissions.VIEW_ASSETS).isAllowed());
  }

  @Test
  void unknownPermissionCodeThrowsAndIsNotAudited() {
    UnknownPermissionException e =
        assertThrows(
            UnknownPermissionException.class,
            () -> fixture.engine.check(auditorUser, "view_asets"));
    assertTrue(e.getCodes().contains("view_asets"));
    assertThrows(
        UnknownPermissionException.class,
        () -> fixture.engine.checkAny(UUID.randomUUID(), List.of(Permissions.VIEW_ASSETS, "nope")));
    assertTrue(fixture.recordingSink.decisions().isEmpty());
  }

  @Test
  void everyCheckProducesExactlyOneMatchingAuditRecord() {
    AuthorizationDecision allowed = fixture.engine.check(auditorUser, Permissions.VIEW_ASSETS);
    AuthorizationDecision denied = fixture.engine.check(auditorUser, Permissions.DELETE_ASSETS);
    AuthorizationDecision anyOf =
        fixture.engine.checkAny(auditorUser, List.of(Permissions.DELETE_ASSETS));

    assertEquals(List.of(allowed, denied, anyOf), fixture.recordingSink.decisions());
    AuthorizationDecision audited = fixture.recordingSink.decisions().get(1);
    assertEquals(auditorUser, audited.userId());
    assertEquals(List.of(Permissions.DELETE_ASSETS), audited.required());
    assertEquals(Mode.SINGLE, audited.mode());
    assertEquals(Outcome.DENY, audited.outcome());
    assertEquals(AuthzFixture.NOW, audited.decidedAt());
  }

  @Test
  void userStorageFaultDeniesWithStorageUnavailable() {
    // Given: a user directory that cannot reach its database
    when(mockUsers.loadUser(any()))
        .thenReturn(StatusOr.ofStatus(
            AuthzFailure.STORAGE_UNAVAILABLE.status("connection refused")));
    AuthzFixture broken =
        new AuthzFixture(PermissionCatalog.builtIn(), new InMemoryPositionStore(), mockUsers, null);

    // When
    AuthorizationDecision decision = broken.engine.check(UUID.randomUUID(), Permissions.VIEW_ASSETS);

    // Then: fail closed, and the denial is still audited
    assertEquals(Outcome.DENY, decision.outcome());
    assertEquals(Reason.STORAGE_UNAVAILABLE, decision.reason());
    assertTrue(decision.toStatus().isRetryable());
    assertEquals(List.of(decision), broken.recordingSink.decisions());
  }

  @Test
  void positionStorageFaultDeniesWithStorageUnavailable() {
    InMemoryUserDirectory users = new InMemoryUserDirectory();
    UUID userId = UUID.randomUUID();
    users.save(new UserAccount(userId, "bob", UUID.randomUUID()));
    when(mockPositions.loadById(any()))
        .thenReturn(StatusOr.ofStatus(AuthzFailure.STORAGE_UNAVAILABLE.status("timeout")));
    AuthzFixture broken =
        new AuthzFixture(PermissionCatalog.builtIn(), mockPositions, users, null);

    AuthorizationDecision decision = broken.engine.check(userId, Permissions.VIEW_ASSETS);

    assertEquals(Reason.STORAGE_UNAVAILABLE, decision.reason());
  }

  @Test
  void unexpectedRuntimeFailureDeniesWithStorageUnavailable() {
    when(mockUsers.loadUser(any())).thenThrow(new IllegalStateException("pool closed"));
    AuthzFixture broken =
        new AuthzFixture(PermissionCatalog.builtIn(), new InMemoryPositionStore(), mockUsers, null);

    AuthorizationDecision decision = broken.engine.check(UUID.randomUUID(), Permissions.VIEW_ASSETS);

    assertEquals(Reason.STORAGE_UNAVAILABLE, decision.reason());
  }

  @Test
  void auditFailureTurnsAllowIntoDeny() {
    when(mockSink.recordDecision(any()))
        .thenReturn(Status.unavailable("audit table locked", null));
    AuthzFixture unaudited = new AuthzFixture(
        PermissionCatalog.builtIn(),
        new InMemoryPositionStore(),
        new InMemoryUserDirectory(),
        mockSink);
    Position viewer = unaudited.position("Viewer", List.of(Permissions.VIEW_ASSETS));
    UUID userId = unaudited.userWith("carol", viewer);

    AuthorizationDecision decision = unaudited.engine.check(userId, Permissions.VIEW_ASSETS);

    assertEquals(Outcome.DENY, decision.outcome());
    assertEquals(Reason.AUDIT_UNAVAILABLE, decision.reason());
  }

  @Test
  void throwingAuditSinkTurnsAllowIntoDeny() {
    when(mockSink.recordDecision(any())).thenThrow(new RuntimeException("disk full"));
    AuthzFixture unaudited = new AuthzFixture(
        PermissionCatalog.builtIn(),
        new InMemoryPositionStore(),
        new InMemoryUserDirectory(),
        mockSink);
    Position viewer = unaudited.position("Viewer", List.of(Permissions.VIEW_ASSETS));
    UUID userId = unaudited.userWith("dave", viewer);

    assertEquals(
        Reason.AUDIT_UNAVAILABLE, unaudited.engine.check(userId, Permissions.VIEW_ASSETS).reason());
  }

  @Test
  void positionIsLookedUpThroughTheBinding() {
    // Given: a binding that reports no position for a user the directory knows
    when(mockBinding.boundPositionId(auditorUser))
        .thenReturn(AuthzFailure.NO_POSITION.error("cleared"));
    AuthorizationEngine engine =
        new AuthorizationEngine(
            fixture.catalog, mockBinding, fixture.cache, fixture.recordingSink, fixture.clock);

    // When
    AuthorizationDecision decision = engine.check(auditorUser, Permissions.VIEW_ASSETS);

    // Then: the binding's answer wins
    assertEquals(Reason.NO_POSITION, decision.reason());
    verify(mockBinding).boundPositionId(auditorUser);
  }

  @Test
  void bindingStorageFaultDeniesWithStorageUnavailable() {
    when(mockBinding.boundPositionId(auditorUser))
        .thenReturn(StatusOr.ofStatus(Status.unavailable("connection reset", null)));
    AuthorizationEngine engine =
        new AuthorizationEngine(
            fixture.catalog, mockBinding, fixture.cache, fixture.recordingSink, fixture.clock);

    assertEquals(
        Reason.STORAGE_UNAVAILABLE, engine.check(auditorUser, Permissions.VIEW_ASSETS).reason());
  }

  @Test
  void effectivePermissionsReflectTheBoundPosition() {
    StatusOr<EffectivePermissions> mine = fixture.engine.effectivePermissions(auditorUser);
    assertEquals(auditor.permissionCodes(), mine.getValue().codes());
    assertFalse(mine.getValue().fullCatalogGrant());

    StatusOr<EffectivePermissions> admin = fixture.engine.effectivePermissions(adminUser);
    assertEquals(fixture.catalog.codes(), admin.getValue().codes());

    StatusOr<EffectivePermissions> none =
        fixture.engine.effectivePermissions(fixture.user("nobody"));
    assertTrue(AuthzFailure.NO_POSITION.matches(none.getStatus()));

    // read-only: nothing audited
    assertTrue(fixture.recordingSink.decisions().isEmpty());
  }

  @Test
  void permissionChangesApplyToTheNextCheck() {
    assertFalse(fixture.engine.check(auditorUser, Permissions.EXPORT_DATA).isAllowed());

    fixture.registry.update(
        auditor.id(), List.of(Permissions.VIEW_ASSETS, Permissions.EXPORT_DATA));

    assertTrue(fixture.engine.check(auditorUser, Permissions.EXPORT_DATA).isAllowed());
    assertFalse(fixture.engine.check(auditorUser, Permissions.GENERATE_REPORTS).isAllowed());
  }
}
