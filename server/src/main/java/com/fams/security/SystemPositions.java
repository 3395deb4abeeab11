package com.fams.security;

import static com.fams.security.Permissions.*;

import com.google.common.collect.ImmutableSet;

/**
 * Enumeration of the positions installed when the system is first initialized.
 *
 * <p>The positions form an informational hierarchy through their {@code level}; permissions are
 * never inherited along it. Each position holds exactly the codes listed here:
 * <ul>
 *   <li>{@link #SYSTEM_ADMINISTRATOR}: protected, implicitly holds the whole catalog
 *   <li>{@link #GENERAL_MANAGER} down to {@link #USER}: explicit permission sets
 * </ul>
 *
 * <p>Once installed these are ordinary positions and can be edited through the registry, with
 * the exception of the System Administrator.
 *
 * <p>Usage:
 * <pre>
 * PositionDraft draft = SystemPositions.AUDITOR.draft();
 * StatusOr&lt;Position&gt; created = registry.create(draft);
 * </pre>
 */
public enum SystemPositions {
  /**
   * Full system access. This is the only position with {@code fullCatalogGrant}; it can be
   * neither deleted, deactivated nor narrowed.
   */
  SYSTEM_ADMINISTRATOR(
      "System Administrator",
      "مدير النظام",
      "Full system access with all permissions",
      10,
      true,
      ImmutableSet.of()),

  GENERAL_MANAGER(
      "General Manager",
      "المدير العام",
      "General management access",
      9,
      false,
      ImmutableSet.of(
          VIEW_COMPANY,
          MANAGE_COMPANY,
          VIEW_BRANCHES,
          MANAGE_BRANCHES,
          VIEW_WAREHOUSES,
          MANAGE_WAREHOUSES,
          VIEW_USERS,
          MANAGE_USERS,
          VIEW_ASSETS,
          MANAGE_ASSETS,
          TRANSFER_ASSETS,
          VIEW_ASSET_CATEGORIES,
          GENERATE_REPORTS,
          VIEW_FINANCIAL_REPORTS,
          EXPORT_DATA)),

  IT_MANAGER(
      "IT Manager",
      "مدير تقنية المعلومات",
      "IT management and system administration",
      8,
      false,
      ImmutableSet.of(
          VIEW_COMPANY,
          VIEW_BRANCHES,
          VIEW_WAREHOUSES,
          MANAGE_USERS,
          VIEW_USERS,
          MANAGE_PERMISSIONS,
          VIEW_PERMISSIONS,
          SYSTEM_ADMIN,
          VIEW_AUDIT_LOGS,
          MANAGE_SYSTEM_SETTINGS,
          GENERATE_BARCODES)),

  ASSETS_MANAGER(
      "Assets Manager",
      "مدير الأصول الثابتة",
      "Fixed assets management",
      7,
      false,
      ImmutableSet.of(
          VIEW_COMPANY,
          VIEW_BRANCHES,
          VIEW_WAREHOUSES,
          VIEW_USERS,
          MANAGE_ASSETS,
          VIEW_ASSETS,
          DELETE_ASSETS,
          TRANSFER_ASSETS,
          MANAGE_ASSET_CATEGORIES,
          VIEW_ASSET_CATEGORIES,
          MANAGE_MAINTENANCE,
          VIEW_MAINTENANCE,
          GENERATE_REPORTS,
          EXPORT_DATA,
          GENERATE_BARCODES,
          SCAN_BARCODES,
          UPLOAD_FILES)),

  BRANCH_MANAGER(
      "Branch Manager",
      "مدير الفرع",
      "Branch-level management access",
      6,
      false,
      ImmutableSet.of(
          VIEW_COMPANY,
          VIEW_BRANCHES,
          VIEW_WAREHOUSES,
          VIEW_USERS,
          VIEW_ASSETS,
          MANAGE_ASSETS,
          TRANSFER_ASSETS,
          VIEW_ASSET_CATEGORIES,
          VIEW_MAINTENANCE,
          GENERATE_REPORTS,
          SCAN_BARCODES)),

  WAREHOUSE_MANAGER(
      "Warehouse Manager",
      "مدير المستودع",
      "Warehouse operations management",
      5,
      false,
      ImmutableSet.of(
          VIEW_WAREHOUSES,
          VIEW_ASSETS,
          MANAGE_ASSETS,
          TRANSFER_ASSETS,
          VIEW_ASSET_CATEGORIES,
          VIEW_MAINTENANCE,
          SCAN_BARCODES,
          UPLOAD_FILES)),

  ASSETS_SUPERVISOR(
      "Assets Supervisor",
      "مشرف الأصول",
      "Assets supervision and monitoring",
      4,
      false,
      ImmutableSet.of(
          VIEW_ASSETS,
          MANAGE_ASSETS,
          VIEW_ASSET_CATEGORIES,
          VIEW_MAINTENANCE,
          MANAGE_MAINTENANCE,
          SCAN_BARCODES,
          UPLOAD_FILES)),

  DATA_ENTRY_CLERK(
      "Data Entry Clerk",
      "موظف إدخال البيانات",
      "Basic data entry access",
      3,
      false,
      ImmutableSet.of(VIEW_ASSETS, MANAGE_ASSETS, VIEW_ASSET_CATEGORIES, UPLOAD_FILES)),

  MAINTENANCE_TECHNICIAN(
      "Maintenance Technician",
      "فني الصيانة",
      "Asset maintenance operations",
      3,
      false,
      ImmutableSet.of(VIEW_ASSETS, VIEW_MAINTENANCE, MANAGE_MAINTENANCE, SCAN_BARCODES)),

  ACCOUNTANT(
      "Accountant",
      "المحاسب",
      "Financial reporting and asset valuation",
      4,
      false,
      ImmutableSet.of(
          VIEW_COMPANY,
          VIEW_ASSETS,
          VIEW_ASSET_CATEGORIES,
          GENERATE_REPORTS,
          VIEW_FINANCIAL_REPORTS,
          EXPORT_DATA)),

  /** Read-only access for auditing. */
  AUDITOR(
      "Auditor",
      "المدقق",
      "Read-only access for auditing",
      2,
      false,
      ImmutableSet.of(
          VIEW_COMPANY,
          VIEW_BRANCHES,
          VIEW_WAREHOUSES,
          VIEW_USERS,
          VIEW_ASSETS,
          VIEW_ASSET_CATEGORIES,
          VIEW_MAINTENANCE,
          GENERATE_REPORTS,
          VIEW_FINANCIAL_REPORTS,
          VIEW_AUDIT_LOGS)),

  USER(
      "User",
      "مستخدم",
      "Basic user access",
      1,
      false,
      ImmutableSet.of(VIEW_ASSETS, VIEW_ASSET_CATEGORIES, SCAN_BARCODES));

  private final String displayName;
  private final String localizedName;
  private final String description;
  private final int level;
  private final boolean fullCatalogGrant;
  private final ImmutableSet<String> permissionCodes;

  SystemPositions(
      String displayName,
      String localizedName,
      String description,
      int level,
      boolean fullCatalogGrant,
      ImmutableSet<String> permissionCodes) {
    this.displayName = displayName;
    this.localizedName = localizedName;
    this.description = description;
    this.level = level;
    this.fullCatalogGrant = fullCatalogGrant;
    this.permissionCodes = permissionCodes;
  }

  public String displayName() {
    return displayName;
  }

  public String localizedName() {
    return localizedName;
  }

  public String description() {
    return description;
  }

  public int level() {
    return level;
  }

  public boolean fullCatalogGrant() {
    return fullCatalogGrant;
  }

  /** The explicit codes; empty for the full-catalog position. */
  public ImmutableSet<String> permissionCodes() {
    return permissionCodes;
  }

  /** Returns a draft for creating this position through the registry. */
  public PositionDraft draft() {
    return new PositionDraft(displayName, localizedName, description, level, permissionCodes);
  }
}
