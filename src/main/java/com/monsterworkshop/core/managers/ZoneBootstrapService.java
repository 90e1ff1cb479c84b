package com.monsterworkshop.core.managers;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GridPosition;
import com.monsterworkshop.core.domain.catalog.ZoneDefinition;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.tick.EntityCreate;

import java.util.ArrayList;
import java.util.List;

/**
 * First-tick population of a zone: world marker, boundary walls and the
 * entities placed by the zone definition.
 */
final class ZoneBootstrapService {

    static final GridPosition FALLBACK_SPAWN = new GridPosition(2, 2);

    private final ZoneGeometry geometry;

    ZoneBootstrapService(ZoneGeometry geometry) {
        this.geometry = geometry;
    }

    void bootstrap(TickContext ctx) {
        for (EntityCreate create : initialEntities(ctx.zoneDefinition(), ctx.zoneWidth(), ctx.zoneHeight())) {
            ctx.create(create);
        }
    }

    List<EntityCreate> initialEntities(ZoneDefinition def, int width, int height) {
        List<EntityCreate> out = new ArrayList<>();

        JsonObject marker = new JsonObject();
        marker.addProperty("kind", EntityKind.WORLD_MARKER.key());
        marker.addProperty("zone_name", def != null ? def.name() : ZoneDefinition.DEFAULT_NAME);
        marker.addProperty("width", width);
        marker.addProperty("height", height);
        out.add(new EntityCreate(0, 0, 0, 0, null, marker));

        out.addAll(boundaryBlocks(width, height));

        if (def != null) {
            for (ZoneDefinition.StaticEntity s : def.staticEntities()) {
                JsonObject meta = s.metadata().deepCopy();
                meta.addProperty("kind", s.kind());
                EntityKind kind = EntityKind.fromKey(s.kind());
                if (kind != null && kind.isCraftingStation() && !meta.has("blocks_movement")) {
                    meta.addProperty("blocks_movement", false);
                }
                out.add(new EntityCreate(s.x(), s.y(), s.width(), s.height(), null, meta));
            }
        }
        return out;
    }

    // Four one-cell-thick walls along the zone edges.
    static List<EntityCreate> boundaryBlocks(int width, int height) {
        if (width < 2 || height < 2) return List.of();
        return List.of(
                wall(0, 0, width, 1),
                wall(0, height - 1, width, 1),
                wall(0, 0, 1, height),
                wall(width - 1, 0, 1, height)
        );
    }

    private static EntityCreate wall(int x, int y, int w, int h) {
        JsonObject meta = new JsonObject();
        meta.addProperty("kind", EntityKind.TERRAIN_BLOCK.key());
        return new EntityCreate(x, y, w, h, null, meta);
    }

    /**
     * First configured spawn point that is inside the zone, not terrain and free.
     */
    GridPosition chooseSpawnPoint(TickContext ctx) {
        ZoneDefinition def = ctx.zoneDefinition();
        List<GridPosition> candidates = def != null && !def.spawnPoints().isEmpty()
                ? def.spawnPoints()
                : List.of(FALLBACK_SPAWN);
        for (GridPosition p : candidates) {
            if (p.x() < 0 || p.y() < 0 || p.x() >= ctx.zoneWidth() || p.y() >= ctx.zoneHeight()) continue;
            if (geometry.terrainBlocked(ctx, p.x(), p.y())) continue;
            if (geometry.findBlockerAtCell(ctx, p.x(), p.y()) == null) return p;
        }
        return FALLBACK_SPAWN;
    }
}
