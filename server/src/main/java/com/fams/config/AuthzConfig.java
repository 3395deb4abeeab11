package com.fams.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the authorization core, read from environment variables.
 *
 * @param dbUrl JDBC URL of the PostgreSQL database ({@code DB_URL})
 * @param dbUser database user ({@code DB_USER})
 * @param dbPassword database password ({@code DB_PASSWORD})
 * @param dbPoolSize maximum HikariCP pool size ({@code DB_POOL_SIZE}, default 10)
 * @param cacheMaxSize maximum cached positions ({@code AUTHZ_CACHE_MAX_SIZE}, default 1000)
 * @param cacheExpiry lifetime of a cached position ({@code AUTHZ_CACHE_EXPIRE_SECONDS}, default
 *     300)
 * @param adminUsername login of the bootstrap administrator ({@code AUTHZ_ADMIN_USERNAME},
 *     default {@code admin})
 */
public record AuthzConfig(
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbPoolSize,
    long cacheMaxSize,
    Duration cacheExpiry,
    String adminUsername) {

  public static final int DEFAULT_POOL_SIZE = 10;
  public static final long DEFAULT_CACHE_MAX_SIZE = 1000;
  public static final long DEFAULT_CACHE_EXPIRE_SECONDS = 300;
  public static final String DEFAULT_ADMIN_USERNAME = "admin";

  /** Reads the configuration from the process environment. */
  public static AuthzConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from the given variables.
   *
   * @throws IllegalArgumentException if a numeric variable is malformed or not positive
   */
  public static AuthzConfig fromEnvironment(Map<String, String> env) {
    return new AuthzConfig(
        env.get("DB_URL"),
        env.get("DB_USER"),
        env.get("DB_PASSWORD"),
        (int) positive(env, "DB_POOL_SIZE", DEFAULT_POOL_SIZE),
        positive(env, "AUTHZ_CACHE_MAX_SIZE", DEFAULT_CACHE_MAX_SIZE),
        Duration.ofSeconds(
            positive(env, "AUTHZ_CACHE_EXPIRE_SECONDS", DEFAULT_CACHE_EXPIRE_SECONDS)),
        Strings.isNullOrEmpty(env.get("AUTHZ_ADMIN_USERNAME"))
            ? DEFAULT_ADMIN_USERNAME
            : env.get("AUTHZ_ADMIN_USERNAME"));
  }

  private static long positive(Map<String, String> env, String name, long defaultValue) {
    String raw = env.get(name);
    if (Strings.isNullOrEmpty(raw)) {
      return defaultValue;
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be a number, got '" + raw + "'", e);
    }
    if (value <= 0 || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(name + " must be a positive integer, got " + value);
    }
    return value;
  }

  /** Returns a string representation of this object without the database password. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("dbUrl", dbUrl)
        .add("dbUser", dbUser)
        .add("dbPoolSize", dbPoolSize)
        .add("cacheMaxSize", cacheMaxSize)
        .add("cacheExpiry", cacheExpiry)
        .add("adminUsername", adminUsername)
        .toString();
  }
}
