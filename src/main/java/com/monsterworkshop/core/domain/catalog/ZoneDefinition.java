package com.monsterworkshop.core.domain.catalog;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GridPosition;
import com.monsterworkshop.core.common.JsonFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static layout of one zone: size, spawn points, pre-placed entities and
 * terrain-blocked cells. Loaded from data, never modified at runtime.
 */
public record ZoneDefinition(
        String name,
        int width,
        int height,
        List<GridPosition> spawnPoints,
        List<StaticEntity> staticEntities,
        Set<GridPosition> blockedCells
) {

    public static final String DEFAULT_NAME = "Starting Village";

    /**
     * One pre-placed entity: kind plus footprint plus its own metadata.
     */
    public record StaticEntity(String kind, int x, int y, int width, int height, JsonObject metadata) {}

    public static ZoneDefinition defaultDefinition() {
        return new ZoneDefinition(DEFAULT_NAME, 60, 20, List.of(new GridPosition(3, 3)), List.of(), Set.of());
    }

    public boolean isTerrainBlocked(int x, int y) {
        return blockedCells.contains(new GridPosition(x, y));
    }

    public static ZoneDefinition fromJson(JsonObject json) {
        List<GridPosition> spawns = new ArrayList<>();
        JsonArray sp = JsonFields.getArray(json, "spawn_points");
        if (sp != null) {
            for (JsonElement el : sp) {
                if (!el.isJsonObject()) continue;
                JsonObject p = el.getAsJsonObject();
                spawns.add(new GridPosition(JsonFields.getInt(p, "x", 0), JsonFields.getInt(p, "y", 0)));
            }
        }

        List<StaticEntity> statics = new ArrayList<>();
        JsonArray se = JsonFields.getArray(json, "static_entities");
        if (se != null) {
            for (JsonElement el : se) {
                if (!el.isJsonObject()) continue;
                JsonObject e = el.getAsJsonObject();
                String kind = JsonFields.getString(e, "kind");
                if (kind == null) continue;
                JsonObject meta = JsonFields.getObject(e, "metadata");
                statics.add(new StaticEntity(
                        kind,
                        JsonFields.getInt(e, "x", 0),
                        JsonFields.getInt(e, "y", 0),
                        JsonFields.getInt(e, "width", 1),
                        JsonFields.getInt(e, "height", 1),
                        meta != null ? meta.deepCopy() : new JsonObject()
                ));
            }
        }

        // Accepts either [[x,y], ...] or [{"x":..,"y":..}, ...]
        Set<GridPosition> blocked = new HashSet<>();
        JsonArray bc = JsonFields.getArray(json, "blocked");
        if (bc == null) bc = JsonFields.getArray(json, "blocked_cells");
        if (bc == null) bc = JsonFields.getArray(JsonFields.getObject(json, "terrain"), "blocked");
        if (bc != null) {
            for (JsonElement el : bc) {
                if (el.isJsonArray() && el.getAsJsonArray().size() >= 2) {
                    JsonArray pair = el.getAsJsonArray();
                    blocked.add(new GridPosition(JsonFields.asInt(pair.get(0), 0), JsonFields.asInt(pair.get(1), 0)));
                } else if (el.isJsonObject()) {
                    JsonObject p = el.getAsJsonObject();
                    blocked.add(new GridPosition(JsonFields.getInt(p, "x", 0), JsonFields.getInt(p, "y", 0)));
                }
            }
        }

        return new ZoneDefinition(
                JsonFields.getString(json, "name", DEFAULT_NAME),
                JsonFields.getInt(json, "width", 100),
                JsonFields.getInt(json, "height", 100),
                Collections.unmodifiableList(spawns),
                Collections.unmodifiableList(statics),
                Collections.unmodifiableSet(blocked)
        );
    }
}
