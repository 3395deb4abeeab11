package com.fams.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthzConfigTest {

  @Test
  void defaultsApplyWhenVariablesAreMissing() {
    AuthzConfig config = AuthzConfig.fromEnvironment(Map.of("DB_URL", "jdbc:postgresql://db/fams"));

    assertEquals("jdbc:postgresql://db/fams", config.dbUrl());
    assertEquals(AuthzConfig.DEFAULT_POOL_SIZE, config.dbPoolSize());
    assertEquals(AuthzConfig.DEFAULT_CACHE_MAX_SIZE, config.cacheMaxSize());
    assertEquals(Duration.ofSeconds(300), config.cacheExpiry());
    assertEquals("admin", config.adminUsername());
  }

  @Test
  void variablesOverrideDefaults() {
    AuthzConfig config =
        AuthzConfig.fromEnvironment(
            Map.of(
                "DB_POOL_SIZE", "4",
                "AUTHZ_CACHE_MAX_SIZE", "50",
                "AUTHZ_CACHE_EXPIRE_SECONDS", " 30 ",
                "AUTHZ_ADMIN_USERNAME", "root"));

    assertEquals(4, config.dbPoolSize());
    assertEquals(50, config.cacheMaxSize());
    assertEquals(Duration.ofSeconds(30), config.cacheExpiry());
    assertEquals("root", config.adminUsername());
  }

  @Test
  void malformedNumbersAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> AuthzConfig.fromEnvironment(Map.of("DB_POOL_SIZE", "ten")));
    assertThrows(IllegalArgumentException.class,
        () -> AuthzConfig.fromEnvironment(Map.of("AUTHZ_CACHE_MAX_SIZE", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> AuthzConfig.fromEnvironment(Map.of("AUTHZ_CACHE_EXPIRE_SECONDS", "-5")));
  }

  @Test
  void secureStringOmitsThePassword() {
    AuthzConfig config =
        AuthzConfig.fromEnvironment(Map.of("DB_USER", "fams", "DB_PASSWORD", "s3cret"));

    String secure = config.toSecureString();
    assertTrue(secure.contains("fams"));
    assertFalse(secure.contains("s3cret"));
  }
}
