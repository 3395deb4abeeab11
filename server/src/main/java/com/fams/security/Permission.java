package com.fams.security;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An atomic, named capability in the role-based access control (RBAC) system.
 *
 * <p>The {@code code} is the stable key shared between this engine and every route that declares
 * which permission it requires, following the pattern {@code [action]_[resource]} (for example
 * {@code manage_assets}, {@code view_audit_logs}). Codes are unique within a
 * {@link PermissionCatalog}; the label and module are for display and grouping only.
 *
 * @param code stable identifier, lowercase snake case
 * @param label human-readable name
 * @param module functional grouping (asset, user, report, ...)
 * @param description longer explanation shown in administration screens
 */
public record Permission(String code, String label, String module, String description) {

  private static final Pattern CODE_PATTERN = Pattern.compile("[a-z][a-z0-9_]{1,63}");

  public Permission {
    Objects.requireNonNull(code, "code must not be null");
    Objects.requireNonNull(label, "label must not be null");
    Objects.requireNonNull(module, "module must not be null");
    if (!CODE_PATTERN.matcher(code).matches()) {
      throw new IllegalArgumentException("Invalid permission code '" + code + "'");
    }
    if (description == null) {
      description = "";
    }
  }

  /** Creates a permission without a description. */
  public static Permission of(String code, String label, String module) {
    return new Permission(code, label, module, "");
  }
}
