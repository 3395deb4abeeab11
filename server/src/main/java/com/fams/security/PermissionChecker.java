package com.fams.security;

import java.util.Collection;

/**
 * Interface defining the contract for permission checking.
 *
 * <p>Implementers can determine whether they grant a specific permission code. The interface
 * provides the fundamental check {@link #hasPermission} and the all/any combinations built on it.
 * There is no partial credit: a composite check either holds for the whole collection or not.
 */
public interface PermissionChecker {
  /**
   * Checks if this entity grants the specified permission.
   *
   * @param code The permission code to check
   * @return true if the permission is granted, false otherwise
   */
  boolean hasPermission(String code);

  /**
   * Returns true if at least one of the codes is granted. An empty collection grants nothing.
   */
  default boolean hasAnyPermission(Collection<String> codes) {
    for (String code : codes) {
      if (hasPermission(code)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true only if all of the codes are granted. An empty collection is trivially
   * satisfied.
   */
  default boolean hasAllPermissions(Collection<String> codes) {
    for (String code : codes) {
      if (!hasPermission(code)) {
        return false;
      }
    }
    return true;
  }
}
