package com.fams.authz;

import static org.junit.jupiter.api.Assertions.*;

import com.fams.common.status.Status;
import com.fams.common.status.StatusCode;
import com.fams.common.status.StatusOr;
import com.fams.security.Permission;
import com.fams.security.Permissions;
import com.fams.security.Position;
import com.fams.security.PositionDraft;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PositionRegistryTest {

  private AuthzFixture fixture;
  private PositionRegistry registry;

  @BeforeEach
  void setUp() {
    fixture = new AuthzFixture();
    registry = fixture.registry;
  }

  @Test
  void createStoresTheDraft() {
    StatusOr<Position> created =
        registry.create(
            new PositionDraft(
                "Warehouse Manager",
                "مدير المستودع",
                "Warehouse operations",
                5,
                ImmutableSet.of(Permissions.VIEW_WAREHOUSES, Permissions.SCAN_BARCODES)));

    assertTrue(created.isOk());
    Position position = created.getValue();
    assertEquals("Warehouse Manager", position.name());
    assertEquals(5, position.level());
    assertTrue(position.active());
    assertFalse(position.fullCatalogGrant());
    assertEquals(AuthzFixture.NOW, position.createdAt());
    assertEquals(position, registry.get(position.id()).getValue());
  }

  @Test
  void createRejectsCodesOutsideTheCatalog() {
    StatusOr<Position> created =
        registry.create(PositionDraft.of("Typist", List.of(Permissions.VIEW_ASSETS, "view_asets")));

    assertTrue(AuthzFailure.INVALID_PERMISSION_SET.matches(created.getStatus()));
    assertEquals(StatusCode.INVALID_ARGUMENT, created.getStatus().getCode());
    assertTrue(registry.findByName("Typist").getValue().isEmpty());
  }

  @Test
  void createRejectsDuplicateNamesIgnoringCase() {
    fixture.position("Auditor", List.of(Permissions.VIEW_ASSETS));

    StatusOr<Position> duplicate = registry.create(PositionDraft.of("  AUDITOR ", List.of()));

    assertTrue(AuthzFailure.DUPLICATE_NAME.matches(duplicate.getStatus()));
    assertEquals(StatusCode.ALREADY_EXISTS, duplicate.getStatus().getCode());
  }

  @Test
  void createRejectsBlankName() {
    assertEquals(
        StatusCode.INVALID_ARGUMENT, registry.create(PositionDraft.of("   ", List.of())).getStatus().getCode());
  }

  @Test
  void updateReplacesTheWholeSet() {
    Position clerk = fixture.position("Clerk", List.of(Permissions.VIEW_ASSETS));

    Position updated =
        registry.update(clerk.id(), List.of(Permissions.MANAGE_ASSETS, Permissions.UPLOAD_FILES))
            .getValue();

    assertEquals(ImmutableSet.of(Permissions.MANAGE_ASSETS, Permissions.UPLOAD_FILES),
        updated.permissionCodes());
    assertEquals(updated, registry.get(clerk.id()).getValue());
  }

  @Test
  void failedUpdateLeavesThePreviousSet() {
    Position clerk = fixture.position("Clerk", List.of(Permissions.VIEW_ASSETS));

    StatusOr<Position> rejected = registry.update(clerk.id(), List.of(Permissions.MANAGE_ASSETS, "bogus"));

    assertTrue(AuthzFailure.INVALID_PERMISSION_SET.matches(rejected.getStatus()));
    assertEquals(ImmutableSet.of(Permissions.VIEW_ASSETS),
        registry.get(clerk.id()).getValue().permissionCodes());
  }

  @Test
  void updateOfUnknownPositionFails() {
    StatusOr<Position> result = registry.update(UUID.randomUUID(), List.of());
    assertTrue(AuthzFailure.UNKNOWN_POSITION.matches(result.getStatus()));
  }

  @Test
  void protectedPositionCannotBeNarrowedDeactivatedOrDeleted() {
    Position admin = registry.ensureSystemAdministrator().getValue();

    assertTrue(AuthzFailure.PROTECTED_POSITION.matches(
        registry.update(admin.id(), List.of(Permissions.VIEW_ASSETS)).getStatus()));
    assertTrue(AuthzFailure.PROTECTED_POSITION.matches(
        registry.setActive(admin.id(), false).getStatus()));
    assertTrue(AuthzFailure.PROTECTED_POSITION.matches(registry.delete(admin.id())));

    // The full catalog is accepted and keeps the flag
    StatusOr<Position> full = registry.update(admin.id(), fixture.catalog.codes());
    assertTrue(full.isOk());
    assertTrue(full.getValue().fullCatalogGrant());
  }

  @Test
  void ensureSystemAdministratorIsIdempotent() {
    Position first = registry.ensureSystemAdministrator().getValue();
    Position second = registry.ensureSystemAdministrator().getValue();

    assertEquals(first.id(), second.id());
    assertTrue(first.fullCatalogGrant());
    assertEquals(fixture.catalog.codes(), first.permissionCodes());
    assertEquals(1, registry.listAll().getValue().stream().filter(Position::fullCatalogGrant).count());
  }

  @Test
  void deleteOfPositionInUseFailsAndChangesNothing() {
    Position auditor = fixture.position("Auditor", List.of(Permissions.VIEW_ASSETS));
    fixture.userWith("alice", auditor);

    Status deleted = registry.delete(auditor.id());

    assertTrue(AuthzFailure.POSITION_IN_USE.matches(deleted));
    assertEquals(auditor, registry.get(auditor.id()).getValue());
  }

  @Test
  void deleteRemovesUnusedPosition() {
    Position temp = fixture.position("Temp", List.of(Permissions.VIEW_ASSETS));

    assertTrue(registry.delete(temp.id()).isOk());
    assertTrue(AuthzFailure.UNKNOWN_POSITION.matches(registry.get(temp.id()).getStatus()));
    assertTrue(AuthzFailure.UNKNOWN_POSITION.matches(registry.delete(temp.id())));
  }

  @Test
  void updateDetailsRenamesWithDuplicateCheck() {
    Position clerk = fixture.position("Clerk", List.of(Permissions.VIEW_ASSETS));
    fixture.position("Accountant", List.of(Permissions.VIEW_ASSETS));

    Position renamed =
        registry.updateDetails(clerk.id(), "Senior Clerk", "موظف أول", "Senior", 4).getValue();
    assertEquals("Senior Clerk", renamed.name());
    assertEquals(4, renamed.level());
    assertEquals(clerk.permissionCodes(), renamed.permissionCodes());
    assertTrue(registry.findByName("senior clerk").getValue().isPresent());
    assertTrue(registry.findByName("Clerk").getValue().isEmpty());

    StatusOr<Position> clash = registry.updateDetails(clerk.id(), "accountant", null, "", 4);
    assertTrue(AuthzFailure.DUPLICATE_NAME.matches(clash.getStatus()));

    // Renaming to its own name with different case is allowed
    assertTrue(registry.updateDetails(clerk.id(), "SENIOR CLERK", null, "", 4).isOk());
  }

  @Test
  void listAllIsOrderedByLevelThenName() {
    registry.create(new PositionDraft("b", null, "", 3, ImmutableSet.of()));
    registry.create(new PositionDraft("A", null, "", 3, ImmutableSet.of()));
    registry.create(new PositionDraft("z", null, "", 9, ImmutableSet.of()));

    ImmutableList<String> names =
        registry.listAll().getValue().stream().map(Position::name).collect(ImmutableList.toImmutableList());
    assertEquals(List.of("z", "A", "b"), names);
  }

  @Test
  void everyStoredSetStaysInsideTheCatalog() {
    fixture.catalog.register(Permission.of("approve_disposals", "Approve Disposals", "asset"));
    Position p = fixture.position("Disposals", List.of("approve_disposals", Permissions.VIEW_ASSETS));
    registry.update(p.id(), List.of("approve_disposals", "not_a_code"));

    for (Position position : registry.listAll().getValue()) {
      assertTrue(fixture.catalog.unknownCodes(position.permissionCodes()).isEmpty());
    }
  }

  @Test
  void concurrentReadersSeeEitherTheOldOrTheNewSet() throws Exception {
    Set<String> setA = ImmutableSet.of(Permissions.VIEW_ASSETS, Permissions.VIEW_BRANCHES);
    Set<String> setB =
        ImmutableSet.of(Permissions.MANAGE_ASSETS, Permissions.TRANSFER_ASSETS, Permissions.EXPORT_DATA);
    Position position = fixture.position("Flipper", setA);
    UUID userId = fixture.userWith("flip", position);

    ExecutorService executor = Executors.newFixedThreadPool(5);
    AtomicBoolean running = new AtomicBoolean(true);
    ConcurrentLinkedQueue<Set<String>> mixed = new ConcurrentLinkedQueue<>();
    CountDownLatch started = new CountDownLatch(4);
    try {
      List<Future<?>> readers = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        readers.add(executor.submit(() -> {
          started.countDown();
          while (running.get()) {
            Set<String> seen = fixture.engine.effectivePermissions(userId).getValue().codes();
            if (!seen.equals(setA) && !seen.equals(setB)) {
              mixed.add(seen);
            }
          }
        }));
      }
      started.await(5, TimeUnit.SECONDS);
      Future<?> writer = executor.submit(() -> {
        for (int i = 0; i < 200; i++) {
          assertTrue(registry.update(position.id(), i % 2 == 0 ? setB : setA).isOk());
        }
      });
      writer.get(30, TimeUnit.SECONDS);
      running.set(false);
      for (Future<?> reader : readers) {
        reader.get(10, TimeUnit.SECONDS);
      }
    } finally {
      running.set(false);
      executor.shutdownNow();
    }

    assertTrue(mixed.isEmpty(), "Readers observed mixed sets: " + mixed);
    assertEquals(setA, registry.get(position.id()).getValue().permissionCodes());
  }

  @Test
  void concurrentCreatesWithTheSameNameYieldOnePosition() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<StatusOr<Position>>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        String name = i % 2 == 0 ? "Night Guard" : "night guard";
        results.add(executor.submit(() -> registry.create(PositionDraft.of(name, List.of()))));
      }
      int ok = 0;
      for (Future<StatusOr<Position>> result : results) {
        StatusOr<Position> created = result.get(10, TimeUnit.SECONDS);
        if (created.isOk()) {
          ok++;
        } else {
          assertTrue(AuthzFailure.DUPLICATE_NAME.matches(created.getStatus()));
        }
      }
      assertEquals(1, ok);
    } finally {
      executor.shutdownNow();
    }
  }
}
