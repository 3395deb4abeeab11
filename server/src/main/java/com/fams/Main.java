package com.fams;

import com.fams.audit.JdbcAuditSink;
import com.fams.authz.ApiRoutes;
import com.fams.authz.AuthorizationEngine;
import com.fams.authz.EffectivePermissionCache;
import com.fams.authz.PositionLocks;
import com.fams.authz.PositionRegistry;
import com.fams.authz.RouteGuard;
import com.fams.authz.UserPositionBinding;
import com.fams.config.AuthzConfig;
import com.fams.operations.PositionAdministration;
import com.fams.operations.SystemInitOperation;
import com.fams.security.PermissionCatalog;
import com.fams.store.JdbcPositionStore;
import com.fams.store.JdbcUserDirectory;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Clock;
import org.tinylog.Logger;

/**
 * Entry point of the FAMS authorization core.
 *
 * <p>Builds the connection pool, wires the catalog, registry, binding, engine and route guard
 * over PostgreSQL, and runs system initialization. HTTP routing lives outside this module; it
 * receives the {@link RouteGuard} and {@link PositionAdministration} built here.
 */
public class Main {

  private final HikariDataSource dataSource;
  private final PermissionCatalog catalog;
  private final AuthorizationEngine engine;
  private final RouteGuard routeGuard;
  private final PositionAdministration administration;
  private final SystemInitOperation systemInit;

  public Main(AuthzConfig config) {
    Logger.info("Starting with configuration {}", config.toSecureString());

    // Initialize database connection pool
    this.dataSource = setupDataSource(config);

    Clock clock = Clock.systemUTC();
    this.catalog = PermissionCatalog.builtIn();
    var positions = new JdbcPositionStore(new JdbcPositionStore.Config(dataSource));
    var users = new JdbcUserDirectory(new JdbcUserDirectory.Config(dataSource, clock));
    var auditSink = new JdbcAuditSink(new JdbcAuditSink.Config(dataSource));
    var cache =
        new EffectivePermissionCache(
            positions, catalog, config.cacheMaxSize(), config.cacheExpiry());
    var locks = new PositionLocks();

    var registry = new PositionRegistry(positions, users, catalog, cache, locks, clock);
    var binding = new UserPositionBinding(users, positions, locks);
    this.engine = new AuthorizationEngine(catalog, binding, cache, auditSink, clock);
    this.routeGuard = ApiRoutes.install(new RouteGuard(catalog, engine));
    this.administration =
        new PositionAdministration(engine, registry, binding, users, catalog, auditSink, clock);
    this.systemInit = new SystemInitOperation(registry, users, binding, config.adminUsername());
  }

  private static HikariDataSource setupDataSource(AuthzConfig config) {
    // Configure HikariCP
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.dbUrl());
    hikari.setUsername(config.dbUser());
    hikari.setPassword(config.dbPassword());
    hikari.setMaximumPoolSize(config.dbPoolSize());
    hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
    hikari.setIdleTimeout(30000);
    hikari.setMaxLifetime(1800000);
    hikari.setConnectionTimeout(30000);
    hikari.setAutoCommit(true);
    hikari.setPoolName("fams-authz");

    return new HikariDataSource(hikari);
  }

  /** Seeds positions and the bootstrap administrator. */
  public SystemInitOperation.InitResult initialize() {
    SystemInitOperation.InitResult result = systemInit.execute();
    if (!result.isSuccess()) {
      Logger.error("System initialization failed: {}", result.errorMessage());
    } else if (result.alreadyInitialized()) {
      Logger.info("System was already initialized; administrator is {}", result.adminUserId());
    } else {
      Logger.info(
          "Initialized system: {} positions created, administrator {} bound to {}",
          result.positionsCreated(),
          result.adminUserId(),
          result.adminPositionId());
    }
    return result;
  }

  public RouteGuard routeGuard() {
    return routeGuard;
  }

  public PositionAdministration administration() {
    return administration;
  }

  public AuthorizationEngine engine() {
    return engine;
  }

  /** Closes the connection pool. */
  public void shutdown() {
    if (dataSource != null && !dataSource.isClosed()) {
      dataSource.close();
    }
    Logger.info("Authorization core stopped");
  }

  public static void main(String[] args) {
    Main main = new Main(AuthzConfig.fromEnvironment());
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down since JVM is shutting down");
                  try {
                    main.shutdown();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));
    SystemInitOperation.InitResult result = main.initialize();
    if (!result.isSuccess()) {
      System.exit(1);
    }
    Logger.info(
        "Catalog version {} with {} permissions; {} routes guarded",
        main.catalog.version(),
        main.catalog.size(),
        main.routeGuard.requirements().size());
  }
}
