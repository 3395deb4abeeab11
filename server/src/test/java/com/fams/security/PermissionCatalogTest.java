package com.fams.security;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class PermissionCatalogTest {

  @Test
  void builtInCatalogHoldsThirtyOneCodesAtVersionOne() {
    PermissionCatalog catalog = PermissionCatalog.builtIn();

    assertEquals(31, catalog.size());
    assertEquals(1L, catalog.version());
    assertTrue(catalog.exists(Permissions.MANAGE_ASSETS));
    assertTrue(catalog.exists(Permissions.VIEW_AUDIT_LOGS));
    assertFalse(catalog.exists("export_audit_logs"));
    assertFalse(catalog.exists(null));
  }

  @Test
  void listAllIsOrderedByModuleThenCode() {
    ImmutableList<Permission> all = PermissionCatalog.builtIn().listAll().asList();

    for (int i = 1; i < all.size(); i++) {
      Permission previous = all.get(i - 1);
      Permission current = all.get(i);
      int byModule = previous.module().compareTo(current.module());
      assertTrue(
          byModule < 0 || (byModule == 0 && previous.code().compareTo(current.code()) < 0),
          previous.code() + " should sort before " + current.code());
    }
  }

  @Test
  void getThrowsForUnknownCode() {
    PermissionCatalog catalog = PermissionCatalog.builtIn();

    assertEquals("asset", catalog.get(Permissions.DELETE_ASSETS).module());
    UnknownPermissionException e =
        assertThrows(UnknownPermissionException.class, () -> catalog.get("fly_to_moon"));
    assertEquals(ImmutableSet.of("fly_to_moon"), e.getCodes());
  }

  @Test
  void requireAllListsEveryUnknownCode() {
    PermissionCatalog catalog = PermissionCatalog.builtIn();

    catalog.requireAll(List.of(Permissions.VIEW_ASSETS, Permissions.SCAN_BARCODES));
    UnknownPermissionException e =
        assertThrows(
            UnknownPermissionException.class,
            () -> catalog.requireAll(List.of("view_asets", Permissions.VIEW_ASSETS, "mange_users")));
    assertEquals(ImmutableSet.of("mange_users", "view_asets"), e.getCodes());
  }

  @Test
  void unknownCodesNeverThrows() {
    PermissionCatalog catalog = PermissionCatalog.builtIn();

    assertEquals(
        ImmutableSet.of("bogus"), catalog.unknownCodes(List.of(Permissions.VIEW_USERS, "bogus")));
    assertTrue(catalog.unknownCodes(List.of()).isEmpty());
  }

  @Test
  void registerIsAdditiveAndBumpsVersion() {
    PermissionCatalog catalog = PermissionCatalog.builtIn();
    Permission export = Permission.of("export_audit_logs", "Export Audit Logs", "system");

    assertTrue(catalog.register(export));
    assertEquals(2L, catalog.version());
    assertEquals(32, catalog.size());
    assertTrue(catalog.codes().contains("export_audit_logs"));

    // Identical re-registration is a no-op
    assertFalse(catalog.register(export));
    assertEquals(2L, catalog.version());

    // Redefinition is rejected
    assertThrows(
        IllegalArgumentException.class,
        () -> catalog.register(Permission.of("export_audit_logs", "Something Else", "system")));
    assertEquals(2L, catalog.version());
  }

  @Test
  void snapshotsHandedOutEarlierDoNotChange() {
    PermissionCatalog catalog = PermissionCatalog.builtIn();
    ImmutableSet<String> before = catalog.codes();

    catalog.register(Permission.of("approve_disposals", "Approve Disposals", "asset"));

    assertEquals(31, before.size());
    assertEquals(32, catalog.codes().size());
  }

  @Test
  void permissionCodeMustBeSnakeCase() {
    assertThrows(IllegalArgumentException.class, () -> Permission.of("Manage Assets", "x", "asset"));
    assertThrows(IllegalArgumentException.class, () -> Permission.of("", "x", "asset"));
    assertEquals("", Permission.of("view_things", "View", "misc").description());
  }
}
