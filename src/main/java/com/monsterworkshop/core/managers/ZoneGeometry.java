package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.Direction;
import com.monsterworkshop.core.common.GridRect;
import com.monsterworkshop.core.common.GridSize;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GoodType;
import com.monsterworkshop.core.domain.catalog.GoodTypeRegistry;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;

import java.util.Set;
import java.util.UUID;

/**
 * Footprints, collision and the fixed layout rules of workshops.
 */
final class ZoneGeometry {

    private final GoodTypeRegistry goodTypes;

    ZoneGeometry(GoodTypeRegistry goodTypes) {
        this.goodTypes = goodTypes;
    }

    // ==========================================================
    // SIZES
    // ==========================================================

    /**
     * Declared size, except that 1x1 items take their real size from metadata or the catalog.
     */
    GridSize size(Entity e) {
        int w = e.getWidth() > 0 ? e.getWidth() : 1;
        int h = e.getHeight() > 0 ? e.getHeight() : 1;
        if (e.is(EntityKind.ITEM) && w == 1 && h == 1) {
            return itemSize(e.getMetadata());
        }
        return new GridSize(w, h);
    }

    GridSize itemSize(JsonObject metadata) {
        JsonArray size = JsonFields.getArray(metadata, "size");
        if (size != null && size.size() >= 2) {
            return GoodType.parseSize(size);
        }
        GoodType entry = goodTypes.findByGoodType(JsonFields.getString(metadata, "good_type"));
        return entry != null ? entry.size() : GridSize.DEFAULT_ITEM;
    }

    /**
     * Writes the catalog size onto item metadata when it carries none.
     */
    void ensureItemSize(JsonObject metadata) {
        if (metadata.has("size")) return;
        GoodType entry = goodTypes.findByGoodType(JsonFields.getString(metadata, "good_type"));
        if (entry != null) {
            JsonArray arr = new JsonArray();
            arr.add(entry.size().width());
            arr.add(entry.size().height());
            metadata.add("size", arr);
        }
    }

    GridRect rect(Entity e) {
        GridSize s = size(e);
        return new GridRect(e.getX(), e.getY(), s.width(), s.height());
    }

    GridRect rectAt(Entity e, int x, int y) {
        GridSize s = size(e);
        return new GridRect(x, y, s.width(), s.height());
    }

    // ==========================================================
    // COLLISION
    // ==========================================================
    boolean isBlocking(Entity e) {
        JsonObject m = e.getMetadata();
        if (JsonFields.isTruthy(m, "is_stored")) return false;
        if (m.has("blocks_movement")) return JsonFields.isTruthy(m, "blocks_movement");
        EntityKind kind = e.kind();
        return kind != null && kind.blocksByDefault();
    }

    boolean inBounds(TickContext ctx, Entity e, int x, int y) {
        GridSize s = size(e);
        return inBounds(ctx, x, y, s.width(), s.height());
    }

    boolean inBounds(TickContext ctx, int x, int y, int w, int h) {
        if (x < 0 || y < 0) return false;
        return x + w <= ctx.zoneWidth() && y + h <= ctx.zoneHeight();
    }

    boolean terrainBlocked(TickContext ctx, int x, int y) {
        return ctx.zoneDefinition() != null && ctx.zoneDefinition().isTerrainBlocked(x, y);
    }

    /**
     * First blocking entity overlapping {@code mover} placed at (x, y).
     */
    Entity findBlocker(TickContext ctx, Entity mover, int x, int y, Set<UUID> ignore) {
        GridRect target = rectAt(mover, x, y);
        for (Entity e : ctx.entities()) {
            if (e.getId().equals(mover.getId()) || ignore.contains(e.getId())) continue;
            if (!isBlocking(e)) continue;
            if (target.overlaps(rect(e))) return e;
        }
        return null;
    }

    Entity findBlocker(TickContext ctx, Entity mover, int x, int y) {
        return findBlocker(ctx, mover, x, y, Set.of());
    }

    /**
     * Blocker of a single free-standing cell (spawn points, unload cells).
     */
    Entity findBlockerAtCell(TickContext ctx, int x, int y) {
        GridRect cell = GridRect.cell(x, y);
        for (Entity e : ctx.entities()) {
            if (!isBlocking(e)) continue;
            if (cell.overlaps(rect(e))) return e;
        }
        return null;
    }

    Entity findEntityAtKind(TickContext ctx, EntityKind kind, int x, int y) {
        for (Entity e : ctx.entities()) {
            if (!e.is(kind)) continue;
            if (rect(e).containsCell(x, y)) return e;
        }
        return null;
    }

    /**
     * First entity touching one of the four cells next to the monster (up, down, left, right).
     */
    Entity findAdjacentEntity(TickContext ctx, Entity monster) {
        for (Direction d : Direction.values()) {
            int cx = monster.getX() + d.dx();
            int cy = monster.getY() + d.dy();
            for (Entity e : ctx.entities()) {
                if (e.getId().equals(monster.getId())) continue;
                if (rect(e).containsCell(cx, cy)) return e;
            }
        }
        return null;
    }

    Entity findAdjacentWagon(TickContext ctx, Entity monster) {
        for (Entity wagon : ctx.ofKind(EntityKind.WAGON)) {
            GridRect r = rect(wagon);
            for (Direction d : Direction.values()) {
                if (r.containsCell(monster.getX() + d.dx(), monster.getY() + d.dy())) return wagon;
            }
        }
        return null;
    }

    // ==========================================================
    // WORKSHOP LAYOUT
    // ==========================================================
    boolean isGatheringSpot(Entity e) {
        return e.is(EntityKind.GATHERING_SPOT) || JsonFields.isTruthy(e.getMetadata(), "gathering_good_type");
    }

    /**
     * Strictly inside the outer ring of the structure.
     */
    boolean isInterior(Entity workshop, int x, int y) {
        GridSize s = size(workshop);
        int relX = x - workshop.getX();
        int relY = y - workshop.getY();
        if (relX <= 0 || relY <= 0) return false;
        return relX < s.width() - 1 && relY < s.height() - 1;
    }

    // first interior column holds tools
    boolean isToolSlot(Entity workshop, int x, int y) {
        return isInterior(workshop, x, y) && x - workshop.getX() == 1;
    }

    /**
     * Inclusive interior bounds: {minX, minY, maxX, maxY}.
     */
    int[] interiorBounds(Entity workshop) {
        GridRect r = rect(workshop);
        return new int[]{r.x() + 1, r.y() + 1, r.x() + r.width() - 2, r.y() + r.height() - 2};
    }

    /**
     * Interior cell closest to the bottom-right corner.
     */
    int[] outputAnchor(Entity workshop) {
        GridSize s = size(workshop);
        return new int[]{workshop.getX() + s.width() - 2, workshop.getY() + s.height() - 2};
    }

    /**
     * Where an output of the given size lands, or null when it cannot fit inside.
     */
    int[] outputPosition(Entity workshop, GridSize itemSize) {
        int[] anchor = outputAnchor(workshop);
        int[] b = interiorBounds(workshop);
        int ox = anchor[0] - (itemSize.width() - 1);
        int oy = anchor[1] - (itemSize.height() - 1);
        if (ox < b[0] || oy < b[1]) return null;
        if (ox + itemSize.width() - 1 > b[2] || oy + itemSize.height() - 1 > b[3]) return null;
        return new int[]{ox, oy};
    }

    GridRect storedItemRect(Entity item) {
        JsonObject slot = JsonFields.getObject(item.getMetadata(), "stored_slot");
        int x = item.getX();
        int y = item.getY();
        if (slot != null) {
            x = JsonFields.getInt(slot, "x", item.getX());
            y = JsonFields.getInt(slot, "y", item.getY());
        }
        GridSize s = itemSize(item.getMetadata());
        return new GridRect(x, y, s.width(), s.height());
    }
}
