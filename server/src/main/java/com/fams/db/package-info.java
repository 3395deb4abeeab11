/**
 * The database layer for the FAMS authorization core.
 *
 * <p>This package contains the record classes that represent database rows and the corresponding
 * helper classes that provide CRUD operations for each table.
 *
 * <p>The database layer follows a consistent pattern:
 *
 * <ul>
 *   <li>Each table has a helper class with a plural name (e.g., {@code Users}, {@code Positions})
 *   <li>Helper classes provide static methods taking an open {@link java.sql.Connection}
 *   <li>Operations return {@code StatusOr<T>}; a {@link java.sql.SQLException} becomes a status
 *       through {@link com.fams.db.util.DbUtil#storageFailure}
 * </ul>
 *
 * <p>Where the authorization core already has an immutable record for a row ({@code Position},
 * {@code AuditAction}, {@code AuthorizationDecision}) the helpers read and write it directly.
 * The {@code user} table has its own row record because the core only sees part of it.
 */
package com.fams.db;
