package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GridRect;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.entity.MonsterView;
import com.monsterworkshop.core.domain.tick.GameEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Wagons: hitching, loading, unloading and dragging a chain of wagons
 * behind a moving monster.
 */
final class WagonService {

    static final String ROLE_WAGON = "wagon";

    private final ZoneGeometry geometry;
    private final ContainerService containers;

    WagonService(ZoneGeometry geometry, ContainerService containers) {
        this.geometry = geometry;
        this.containers = containers;
    }

    // ==========================================================
    // HITCH / UNHITCH
    // ==========================================================
    void hitch(TickContext ctx, Entity monster, UUID playerId) {
        MonsterView view = MonsterView.of(monster);
        if (view.hitchedWagonId() != null) {
            ctx.emit(GameEvent.error("Monster is already hitched to a wagon", playerId));
            return;
        }
        Entity wagon = geometry.findAdjacentWagon(ctx, monster);
        if (wagon == null) {
            ctx.emit(GameEvent.error("No wagon adjacent to monster", playerId));
            return;
        }
        String hitchedBy = JsonFields.getString(wagon.getMetadata(), "hitched_by");
        if (hitchedBy != null && !hitchedBy.equals(monster.getId().toString())) {
            ctx.emit(GameEvent.error("Wagon is already hitched", playerId));
            return;
        }

        view.currentTask().addProperty("hitched_wagon_id", wagon.getId().toString());
        wagon.getMetadata().addProperty("hitched_by", monster.getId().toString());
        ctx.touch(monster);
        ctx.touch(wagon);

        ctx.emit(GameEvent.of("wagon_hitched", playerId).with("wagon_id", wagon.getId()));
    }

    void unhitch(TickContext ctx, Entity monster, UUID playerId) {
        MonsterView view = MonsterView.of(monster);
        UUID wagonId = view.hitchedWagonId();
        if (wagonId == null) {
            ctx.emit(GameEvent.error("Monster is not hitched to any wagon", playerId));
            return;
        }
        Entity wagon = ctx.entity(wagonId);
        if (wagon != null && wagon.is(EntityKind.WAGON)
                && monster.getId().toString().equals(JsonFields.getString(wagon.getMetadata(), "hitched_by"))) {
            wagon.getMetadata().remove("hitched_by");
            ctx.touch(wagon);
        }
        view.currentTask().remove("hitched_wagon_id");
        ctx.touch(monster);

        ctx.emit(GameEvent.of("wagon_unhitched", playerId));
    }

    // ==========================================================
    // UNLOAD
    // ==========================================================
    void unload(TickContext ctx, Entity monster, UUID playerId) {
        UUID wagonId = MonsterView.of(monster).hitchedWagonId();
        if (wagonId == null) {
            ctx.emit(GameEvent.error("Monster is not hitched to any wagon", playerId));
            return;
        }
        Entity wagon = ctx.entity(wagonId);
        if (wagon == null || !wagon.is(EntityKind.WAGON)) {
            ctx.emit(GameEvent.error("Hitched wagon not found", playerId));
            return;
        }
        List<Entity> stored = containers.storedItems(ctx, wagon);
        if (stored.isEmpty()) {
            ctx.emit(GameEvent.error("Wagon has no items to unload", playerId));
            return;
        }
        int[] cell = findUnloadCell(ctx, wagon);
        if (cell == null) {
            ctx.emit(GameEvent.error("No space to unload wagon", playerId));
            return;
        }

        Entity item = stored.get(0);
        JsonObject m = item.getMetadata();
        m.addProperty("is_stored", false);
        m.remove("container_id");
        m.remove("stored_offset");
        m.remove("stored_role");
        ctx.move(item, cell[0], cell[1]);

        String itemId = item.getId().toString();
        JsonArray remaining = new JsonArray();
        for (String id : JsonFields.getStringList(wagon.getMetadata(), "loaded_item_ids")) {
            if (!id.equals(itemId)) remaining.add(id);
        }
        wagon.getMetadata().add("loaded_item_ids", remaining);
        wagon.getMetadata().addProperty("loaded_item_count", remaining.size());
        ctx.touch(wagon);

        ctx.emit(GameEvent.of("wagon_unloaded", playerId)
                .with("wagon_id", wagon.getId())
                .with("entity_id", item.getId()));
    }

    /**
     * First free cell of the ring around the wagon, scanned column by column.
     */
    int[] findUnloadCell(TickContext ctx, Entity wagon) {
        GridRect r = geometry.rect(wagon);
        for (int x = r.x() - 1; x <= r.x() + r.width(); x++) {
            for (int y = r.y() - 1; y <= r.y() + r.height(); y++) {
                if (r.containsCell(x, y)) continue;
                if (!geometry.inBounds(ctx, x, y, 1, 1)) continue;
                if (geometry.terrainBlocked(ctx, x, y)) continue;
                if (geometry.findBlockerAtCell(ctx, x, y) != null) continue;
                return new int[]{x, y};
            }
        }
        return null;
    }

    // ==========================================================
    // LOAD
    // ==========================================================
    boolean loadItem(TickContext ctx, Entity item, Entity wagon, int slotX, int slotY, Entity transporter) {
        if (!containers.typeCompatible(wagon, item)) {
            ctx.emit(GameEvent.of("wagon_reject", null)
                    .with("wagon_id", wagon.getId())
                    .with("reason", "type_mismatch"));
            return false;
        }
        if (containers.usedUnits(ctx, wagon) + containers.units(item) > containers.capacity(wagon)) {
            ctx.emit(GameEvent.of("wagon_full", null).with("wagon_id", wagon.getId()));
            return false;
        }

        if (transporter != null) ContainerService.markLastTransporter(ctx, item, transporter);
        containers.lockStoredType(wagon, ContainerService.itemType(item));

        JsonObject m = item.getMetadata();
        geometry.ensureItemSize(m);
        m.addProperty("is_stored", true);
        m.addProperty("container_id", wagon.getId().toString());
        m.addProperty("stored_role", ROLE_WAGON);
        JsonObject offset = new JsonObject();
        offset.addProperty("x", slotX - wagon.getX());
        offset.addProperty("y", slotY - wagon.getY());
        m.add("stored_offset", offset);
        ctx.move(item, slotX, slotY);

        List<String> loaded = JsonFields.getStringList(wagon.getMetadata(), "loaded_item_ids");
        String itemId = item.getId().toString();
        if (!loaded.contains(itemId)) loaded.add(itemId);
        wagon.getMetadata().add("loaded_item_ids", JsonFields.toJsonArray(loaded));
        wagon.getMetadata().addProperty("loaded_item_count", loaded.size());
        ctx.touch(wagon);

        ctx.emit(GameEvent.of("wagon_loaded", null)
                .with("wagon_id", wagon.getId())
                .with("entity_id", item.getId()));
        return true;
    }

    // ==========================================================
    // MOVEMENT
    // ==========================================================

    /**
     * Drags the monster's hitched wagon and every wagon linked behind it
     * through {@code next_wagon_id}: each one takes the cell vacated ahead of it.
     */
    void dragChain(TickContext ctx, Entity monster, int oldX, int oldY) {
        MonsterView view = MonsterView.of(monster);
        if (view == null) return;
        Entity head = ctx.entity(view.hitchedWagonId());
        if (head == null || !head.is(EntityKind.WAGON)) return;

        // TODO: enforce strength/weight limits for pulling long wagon chains
        int prevX = oldX;
        int prevY = oldY;
        for (Entity wagon : chain(ctx, head)) {
            int wagonX = wagon.getX();
            int wagonY = wagon.getY();
            moveWithContents(ctx, wagon, prevX, prevY);
            prevX = wagonX;
            prevY = wagonY;
        }
    }

    List<Entity> chain(TickContext ctx, Entity head) {
        List<Entity> out = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        Entity current = head;
        while (current != null && seen.add(current.getId())) {
            out.add(current);
            current = ctx.entity(JsonFields.getUuid(current.getMetadata(), "next_wagon_id"));
        }
        return out;
    }

    /**
     * Moves a wagon and keeps its cargo at the same offset from the wagon anchor.
     */
    void moveWithContents(TickContext ctx, Entity wagon, int newX, int newY) {
        int oldX = wagon.getX();
        int oldY = wagon.getY();
        ctx.move(wagon, newX, newY);

        for (Entity item : containers.storedItems(ctx, wagon)) {
            JsonObject m = item.getMetadata();
            JsonObject offset = JsonFields.getObject(m, "stored_offset");
            if (offset == null) {
                offset = new JsonObject();
                offset.addProperty("x", item.getX() - oldX);
                offset.addProperty("y", item.getY() - oldY);
                m.add("stored_offset", offset);
            }
            int dx = offsetPart(offset.get("x"));
            int dy = offsetPart(offset.get("y"));
            ctx.move(item, newX + dx, newY + dy);
        }
    }

    private static int offsetPart(JsonElement el) {
        return JsonFields.asInt(el, 0);
    }
}
