package com.fams.authz;

import static com.google.common.base.Preconditions.checkArgument;

import com.fams.authz.AuthorizationDecision.Mode;
import com.fams.security.PermissionCatalog;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;

/**
 * The table of permissions each route requires, built once at startup.
 *
 * <p>Every code is checked against the catalog when the route is registered, so a misspelt
 * permission fails startup instead of silently denying requests. An empty requirement is rejected
 * too; routes that need no permission are registered with {@link #allowPublic}. Routes are named
 * {@code "METHOD /path"} by convention, e.g. {@code "DELETE /api/assets/{id}"}.
 *
 * <pre>
 * RouteGuard guard = new RouteGuard(catalog, engine)
 *     .require("GET /api/assets", Permissions.VIEW_ASSETS)
 *     .requireAny("GET /api/reports", Permissions.GENERATE_REPORTS, Permissions.VIEW_FINANCIAL_REPORTS)
 *     .allowPublic("POST /api/auth/login");
 * </pre>
 */
public class RouteGuard {

  /** What a route demands of the caller's position. */
  public record Requirement(Mode mode, ImmutableList<String> codes) {}

  private final PermissionCatalog catalog;
  private final AuthorizationEngine engine;
  private final ConcurrentMap<String, Requirement> requirements = Maps.newConcurrentMap();
  private final Set<String> publicRoutes = Sets.newConcurrentHashSet();

  public RouteGuard(PermissionCatalog catalog, AuthorizationEngine engine) {
    this.catalog = catalog;
    this.engine = engine;
  }

  public RouteGuard require(String route, String code) {
    return register(route, Mode.SINGLE, ImmutableList.of(code));
  }

  public RouteGuard requireAll(String route, String... codes) {
    return register(route, Mode.ALL, ImmutableList.copyOf(codes));
  }

  public RouteGuard requireAny(String route, String... codes) {
    return register(route, Mode.ANY, ImmutableList.copyOf(codes));
  }

  /** Marks a route as reachable without any permission, such as login. */
  public RouteGuard allowPublic(String route) {
    if (requirements.containsKey(route)) {
      throw new IllegalArgumentException("Route " + route + " already has a requirement");
    }
    publicRoutes.add(route);
    return this;
  }

  public boolean isPublic(String route) {
    return publicRoutes.contains(route);
  }

  /**
   * Runs the check registered for a route.
   *
   * @throws IllegalArgumentException if the route is public or was never registered
   */
  public AuthorizationDecision authorize(UUID userId, String route) {
    Requirement requirement = requirements.get(route);
    if (requirement == null) {
      throw new IllegalArgumentException(
          isPublic(route)
              ? "Route " + route + " is public and needs no authorization"
              : "No permission requirement registered for route " + route);
    }
    return switch (requirement.mode()) {
      case SINGLE -> engine.check(userId, requirement.codes().get(0));
      case ALL -> engine.checkAll(userId, requirement.codes());
      case ANY -> engine.checkAny(userId, requirement.codes());
    };
  }

  public Optional<Requirement> requirementFor(String route) {
    return Optional.ofNullable(requirements.get(route));
  }

  /** Returns the whole route table, for clients that render menus from it. */
  public Map<String, Requirement> requirements() {
    return ImmutableMap.copyOf(requirements);
  }

  private RouteGuard register(String route, Mode mode, ImmutableList<String> codes) {
    checkArgument(!codes.isEmpty(), "Route %s must require at least one permission", route);
    catalog.requireAll(codes);
    if (publicRoutes.contains(route)) {
      throw new IllegalArgumentException("Route " + route + " is already public");
    }
    Requirement previous = requirements.putIfAbsent(route, new Requirement(mode, codes));
    if (previous != null) {
      throw new IllegalArgumentException("Route " + route + " is already registered");
    }
    return this;
  }
}
