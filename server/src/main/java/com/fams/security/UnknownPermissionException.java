package com.fams.security;

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Set;

/**
 * Thrown when a permission code that is not part of the {@link PermissionCatalog} is used where a
 * real permission is required.
 *
 * <p>This signals a defect in the caller (typically a typo in a route definition), never a
 * security denial, so it is unchecked and is not converted into a DENY decision.
 */
public class UnknownPermissionException extends IllegalArgumentException {

  private final Set<String> codes;

  public UnknownPermissionException(Collection<String> codes) {
    super("Unknown permission code(s): " + ImmutableSortedSet.copyOf(codes));
    this.codes = ImmutableSortedSet.copyOf(codes);
  }

  /** Returns the codes that were not found in the catalog. */
  public Set<String> getCodes() {
    return codes;
  }
}
