package com.fams.security;

import com.google.common.collect.ImmutableList;

/**
 * Codes of the permissions shipped with the system, and the definitions that make up the first
 * version of the {@link PermissionCatalog}.
 *
 * <p>Routes refer to these constants instead of string literals so that a misspelt code is a
 * compile error rather than a silent denial.
 */
public final class Permissions {

  private Permissions() {
    // Constants only
  }

  // Company
  public static final String MANAGE_COMPANY = "manage_company";
  public static final String VIEW_COMPANY = "view_company";

  // Branches
  public static final String MANAGE_BRANCHES = "manage_branches";
  public static final String VIEW_BRANCHES = "view_branches";

  // Warehouses
  public static final String MANAGE_WAREHOUSES = "manage_warehouses";
  public static final String VIEW_WAREHOUSES = "view_warehouses";

  // Users
  public static final String MANAGE_USERS = "manage_users";
  public static final String VIEW_USERS = "view_users";
  public static final String RESET_USER_PASSWORDS = "reset_user_passwords";

  // Positions
  public static final String MANAGE_POSITIONS = "manage_positions";
  public static final String VIEW_POSITIONS = "view_positions";

  // Permissions
  public static final String MANAGE_PERMISSIONS = "manage_permissions";
  public static final String VIEW_PERMISSIONS = "view_permissions";

  // Assets
  public static final String MANAGE_ASSETS = "manage_assets";
  public static final String VIEW_ASSETS = "view_assets";
  public static final String DELETE_ASSETS = "delete_assets";
  public static final String TRANSFER_ASSETS = "transfer_assets";
  public static final String MANAGE_ASSET_CATEGORIES = "manage_asset_categories";
  public static final String VIEW_ASSET_CATEGORIES = "view_asset_categories";

  // Maintenance
  public static final String MANAGE_MAINTENANCE = "manage_maintenance";
  public static final String VIEW_MAINTENANCE = "view_maintenance";

  // Reports
  public static final String GENERATE_REPORTS = "generate_reports";
  public static final String VIEW_FINANCIAL_REPORTS = "view_financial_reports";
  public static final String EXPORT_DATA = "export_data";

  // Barcodes
  public static final String GENERATE_BARCODES = "generate_barcodes";
  public static final String SCAN_BARCODES = "scan_barcodes";

  // Files
  public static final String UPLOAD_FILES = "upload_files";
  public static final String DELETE_FILES = "delete_files";

  // System administration
  public static final String SYSTEM_ADMIN = "system_admin";
  public static final String VIEW_AUDIT_LOGS = "view_audit_logs";
  public static final String MANAGE_SYSTEM_SETTINGS = "manage_system_settings";

  /** Returns the definitions of catalog version 1. */
  public static ImmutableList<Permission> builtIn() {
    return ImmutableList.of(
        new Permission(MANAGE_COMPANY, "Manage Company",
            "company", "Full access to company information management"),
        new Permission(VIEW_COMPANY, "View Company", "company", "View company information"),
        new Permission(MANAGE_BRANCHES, "Manage Branches",
            "branch", "Full access to branch management"),
        new Permission(VIEW_BRANCHES, "View Branches", "branch", "View branch information"),
        new Permission(MANAGE_WAREHOUSES, "Manage Warehouses",
            "warehouse", "Full access to warehouse management"),
        new Permission(VIEW_WAREHOUSES, "View Warehouses",
            "warehouse", "View warehouse information"),
        new Permission(MANAGE_USERS, "Manage Users", "user", "Full access to user management"),
        new Permission(VIEW_USERS, "View Users", "user", "View user information"),
        new Permission(RESET_USER_PASSWORDS, "Reset User Passwords",
            "user", "Reset other users passwords"),
        new Permission(MANAGE_POSITIONS, "Manage Positions",
            "position", "Full access to position/role management"),
        new Permission(VIEW_POSITIONS, "View Positions",
            "position", "View position/role information"),
        new Permission(MANAGE_PERMISSIONS, "Manage Permissions",
            "permission", "Full access to permission management"),
        new Permission(VIEW_PERMISSIONS, "View Permissions",
            "permission", "View permission information"),
        new Permission(MANAGE_ASSETS, "Manage Assets", "asset", "Full access to asset management"),
        new Permission(VIEW_ASSETS, "View Assets", "asset", "View asset information"),
        new Permission(DELETE_ASSETS, "Delete Assets", "asset", "Delete/dispose assets"),
        new Permission(TRANSFER_ASSETS, "Transfer Assets",
            "asset", "Transfer assets between locations"),
        new Permission(MANAGE_ASSET_CATEGORIES, "Manage Asset Categories",
            "asset", "Full access to asset category management"),
        new Permission(VIEW_ASSET_CATEGORIES, "View Asset Categories",
            "asset", "View asset category information"),
        new Permission(MANAGE_MAINTENANCE, "Manage Asset Maintenance",
            "maintenance", "Full access to asset maintenance management"),
        new Permission(VIEW_MAINTENANCE, "View Asset Maintenance",
            "maintenance", "View asset maintenance records"),
        new Permission(GENERATE_REPORTS, "Generate Reports", "report", "Generate and view reports"),
        new Permission(VIEW_FINANCIAL_REPORTS, "View Financial Reports",
            "report", "View financial reports and analytics"),
        new Permission(EXPORT_DATA, "Export Data", "report", "Export data to various formats"),
        new Permission(GENERATE_BARCODES, "Generate Barcodes",
            "barcode", "Generate and print barcodes"),
        new Permission(SCAN_BARCODES, "Scan Barcodes", "barcode", "Scan and lookup barcodes"),
        new Permission(UPLOAD_FILES, "Upload Files", "file", "Upload files and attachments"),
        new Permission(DELETE_FILES, "Delete Files", "file", "Delete files and attachments"),
        new Permission(SYSTEM_ADMIN, "System Administration",
            "system", "Full system administration access"),
        new Permission(VIEW_AUDIT_LOGS, "View Audit Logs", "system", "View system audit logs"),
        new Permission(MANAGE_SYSTEM_SETTINGS, "Manage System Settings",
            "system", "Manage system configuration"));
  }
}
