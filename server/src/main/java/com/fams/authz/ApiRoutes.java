package com.fams.authz;

import static com.fams.security.Permissions.*;

/** The permission table of the FAMS REST API. */
public final class ApiRoutes {

  private ApiRoutes() {
    // Static installer only
  }

  public static RouteGuard install(RouteGuard guard) {
    return guard
        .allowPublic("POST /api/auth/login")
        .allowPublic("POST /api/auth/refresh")
        .allowPublic("GET /api/auth/me")
        .allowPublic("POST /api/auth/change-password")
        .allowPublic("POST /api/auth/logout")
        .require("POST /api/auth/register", MANAGE_USERS)
        .require("GET /api/company", VIEW_COMPANY)
        .require("POST /api/company", MANAGE_COMPANY)
        .require("GET /api/company/{id}", VIEW_COMPANY)
        .require("PUT /api/company/{id}", MANAGE_COMPANY)
        .require("DELETE /api/company/{id}", MANAGE_COMPANY)
        .require("GET /api/branches", VIEW_BRANCHES)
        .require("POST /api/branches", MANAGE_BRANCHES)
        .require("GET /api/branches/{id}", VIEW_BRANCHES)
        .require("PUT /api/branches/{id}", MANAGE_BRANCHES)
        .require("DELETE /api/branches/{id}", MANAGE_BRANCHES)
        .require("GET /api/assets", VIEW_ASSETS)
        .require("POST /api/assets", MANAGE_ASSETS)
        .require("GET /api/assets/{id}", VIEW_ASSETS)
        .require("PUT /api/assets/{id}", MANAGE_ASSETS)
        .require("DELETE /api/assets/{id}", DELETE_ASSETS)
        .require("GET /api/assets/statistics", VIEW_ASSETS)
        .requireAny("GET /api/assets/search/{barcode}", VIEW_ASSETS, SCAN_BARCODES)
        .requireAny("GET /api/reports", GENERATE_REPORTS, VIEW_FINANCIAL_REPORTS)
        .requireAll("GET /api/reports/export", GENERATE_REPORTS, EXPORT_DATA)
        .require("GET /api/positions", VIEW_POSITIONS)
        .require("POST /api/positions", MANAGE_POSITIONS)
        .require("PUT /api/positions/{id}", MANAGE_POSITIONS)
        .require("DELETE /api/positions/{id}", MANAGE_POSITIONS)
        .require("GET /api/permissions", VIEW_PERMISSIONS)
        .require("GET /api/audit-logs", VIEW_AUDIT_LOGS);
  }
}
