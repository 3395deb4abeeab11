package com.fams.audit;

import com.fams.security.Position;
import com.google.common.collect.ImmutableSortedSet;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.UUID;
import javax.annotation.Nullable;

/** Builds the JSON old/new values stored with an {@link AuditAction}. */
public final class AuditValues {

  private static final Gson GSON = new Gson();

  private AuditValues() {
    // Utility class
  }

  public static JsonObject of(Position position) {
    JsonObject json = new JsonObject();
    json.addProperty("id", position.id().toString());
    json.addProperty("name", position.name());
    json.addProperty("localized_name", position.localizedName());
    json.addProperty("description", position.description());
    json.addProperty("level", position.level());
    json.addProperty("active", position.active());
    json.addProperty("full_catalog_grant", position.fullCatalogGrant());
    JsonArray codes = new JsonArray();
    ImmutableSortedSet.copyOf(position.permissionCodes()).forEach(codes::add);
    json.add("permissions", codes);
    return json;
  }

  /** The values recorded for a user's binding. */
  public static JsonObject binding(@Nullable UUID positionId) {
    JsonObject json = new JsonObject();
    json.addProperty("position_id", positionId == null ? null : positionId.toString());
    return json;
  }

  public static String toJson(@Nullable JsonObject values) {
    return values == null ? "null" : GSON.toJson(values);
  }
}
