package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GridRect;
import com.monsterworkshop.core.common.GridSize;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GoodType;
import com.monsterworkshop.core.domain.catalog.GoodTypeRegistry;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.tick.GameEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Items held by workshops, gathering spots and dispensers.
 *
 * Capacity is counted in units of one per stored item.
 */
final class ContainerService {

    static final int DEFAULT_CAPACITY = 20;
    static final String ROLE_TOOL = "tool";
    static final String ROLE_INPUT = "input";

    private final GoodTypeRegistry goodTypes;
    private final ZoneGeometry geometry;
    private final ItemRules items;

    ContainerService(GoodTypeRegistry goodTypes, ZoneGeometry geometry, ItemRules items) {
        this.goodTypes = goodTypes;
        this.geometry = geometry;
        this.items = items;
    }

    /**
     * Workshop contents split by stored role.
     */
    record Contents(List<Entity> inputs, List<Entity> tools) {}

    // ==========================================================
    // QUERIES
    // ==========================================================
    static boolean isStoredIn(Entity item, Entity container) {
        if (!item.is(EntityKind.ITEM)) return false;
        JsonObject m = item.getMetadata();
        return JsonFields.isTruthy(m, "is_stored")
                && container.getId().toString().equals(JsonFields.getString(m, "container_id"));
    }

    List<Entity> storedItems(TickContext ctx, Entity container) {
        List<Entity> out = new ArrayList<>();
        for (Entity e : ctx.entities()) {
            if (isStoredIn(e, container)) out.add(e);
        }
        return out;
    }

    Contents contents(TickContext ctx, Entity workshop) {
        List<Entity> inputs = new ArrayList<>();
        List<Entity> tools = new ArrayList<>();
        for (Entity e : storedItems(ctx, workshop)) {
            if (ROLE_TOOL.equals(JsonFields.getString(e.getMetadata(), "stored_role"))) tools.add(e);
            else inputs.add(e);
        }
        return new Contents(inputs, tools);
    }

    int capacity(Entity container) {
        JsonObject m = container.getMetadata();
        if (!JsonFields.has(m, "capacity")) return DEFAULT_CAPACITY;
        int sentinel = Integer.MIN_VALUE;
        int cap = JsonFields.asInt(m.get("capacity"), sentinel);
        return cap == sentinel ? DEFAULT_CAPACITY : Math.max(1, cap);
    }

    // TODO: weigh units by item size and material once containers have a quality stat
    int units(Entity item) {
        return 1;
    }

    int usedUnits(TickContext ctx, Entity container) {
        int used = 0;
        for (Entity e : storedItems(ctx, container)) used += units(e);
        return used;
    }

    static String storedType(Entity container) {
        return JsonFields.normalizeKey(JsonFields.getString(container.getMetadata(), "stored_good_type"));
    }

    static String itemType(Entity item) {
        return JsonFields.normalizeKey(JsonFields.getString(item.getMetadata(), "good_type"));
    }

    boolean typeCompatible(Entity container, Entity item) {
        String stored = storedType(container);
        String type = itemType(item);
        return stored.isEmpty() || type.isEmpty() || stored.equals(type);
    }

    boolean accepts(TickContext ctx, Entity container, Entity item) {
        if (!typeCompatible(container, item)) return false;
        return usedUnits(ctx, container) + units(item) <= capacity(container);
    }

    /**
     * Remembers the first good type put in a container (normalized).
     */
    void lockStoredType(Entity container, String itemType) {
        String stored = storedType(container);
        if (!stored.isEmpty()) {
            container.getMetadata().addProperty("stored_good_type", stored);
        } else if (itemType != null && !itemType.isEmpty()) {
            container.getMetadata().addProperty("stored_good_type", itemType);
        }
    }

    static void markLastTransporter(TickContext ctx, Entity item, Entity transporter) {
        JsonObject m = item.getMetadata();
        m.addProperty("last_transporter_monster_id", transporter.getId().toString());
        if (transporter.getOwnerId() != null) {
            m.addProperty("last_transporter_player_id", transporter.getOwnerId().toString());
        }
        ctx.touch(item);
    }

    // ==========================================================
    // WORKSHOP SLOTS
    // ==========================================================
    List<GoodType> recipesFor(Entity workshop) {
        List<GoodType> out = new ArrayList<>();
        if (geometry.isGatheringSpot(workshop)) {
            GoodType r = goodTypes.findRecipe(JsonFields.getString(workshop.getMetadata(), "gathering_good_type"));
            if (r != null) out.add(r);
            return out;
        }
        // TODO: map workshop types to their recipes instead of offering every workshop recipe
        for (GoodType gt : goodTypes.all()) {
            if (gt.requiresWorkshop() || gt.requiresWorkshopType() != null) out.add(gt);
        }
        return out;
    }

    GridSize slotMaxSize(Entity workshop, String role) {
        List<List<String>> groups = new ArrayList<>();
        for (GoodType r : recipesFor(workshop)) {
            groups.addAll(ROLE_TOOL.equals(role) ? r.toolsRequiredTags() : r.inputTagsRequired());
        }
        return goodTypes.maxSizeForTagGroups(groups);
    }

    String slotRole(Entity workshop, Entity item, int slotX, int slotY) {
        return items.isTool(item.getMetadata()) && geometry.isToolSlot(workshop, slotX, slotY) ? ROLE_TOOL : ROLE_INPUT;
    }

    boolean fitsInWorkshop(TickContext ctx, Entity workshop, Entity item, int slotX, int slotY, String role) {
        GridSize size = geometry.itemSize(item.getMetadata());
        if (!size.fitsWithin(slotMaxSize(workshop, role))) return false;

        int[] b = geometry.interiorBounds(workshop);
        if (slotX < b[0] || slotY < b[1]) return false;
        if (slotX + size.width() - 1 > b[2] || slotY + size.height() - 1 > b[3]) return false;

        GridRect placed = new GridRect(slotX, slotY, size.width(), size.height());
        for (Entity stored : storedItems(ctx, workshop)) {
            if (stored.getId().equals(item.getId())) continue;
            if (placed.overlaps(geometry.storedItemRect(stored))) return false;
        }
        return true;
    }

    // ==========================================================
    // DEPOSITS
    // ==========================================================
    boolean depositIntoWorkshop(TickContext ctx, Entity item, Entity workshop, int slotX, int slotY) {
        String role = slotRole(workshop, item, slotX, slotY);
        if (geometry.isGatheringSpot(workshop) && !ROLE_TOOL.equals(role)) return false;
        if (!fitsInWorkshop(ctx, workshop, item, slotX, slotY, role)) return false;

        JsonObject m = item.getMetadata();
        if (ROLE_TOOL.equals(role)) {
            int max = items.storedMaxDurability(m);
            int durability = items.durability(m, max);
            m.addProperty("durability", durability);
            m.addProperty("max_durability", max);
            m.add("tool_tags", JsonFields.toJsonArray(items.toolTags(m)));
        }
        geometry.ensureItemSize(m);
        store(m, workshop, slotX, slotY);
        m.addProperty("stored_role", role);
        ctx.move(item, slotX, slotY);

        String key = ROLE_TOOL.equals(role) ? "tool_item_ids" : "input_item_ids";
        JsonArray ids = JsonFields.getArray(workshop.getMetadata(), key);
        if (ids == null) {
            ids = new JsonArray();
            workshop.getMetadata().add(key, ids);
        }
        ids.add(item.getId().toString());
        ctx.touch(workshop);

        ctx.emit(GameEvent.of("deposit", null)
                .with("entity_id", item.getId())
                .with("workshop_id", workshop.getId()));
        return true;
    }

    boolean depositIntoDispenser(TickContext ctx, Entity item, Entity dispenser, int slotX, int slotY) {
        if (!accepts(ctx, dispenser, item)) return false;

        lockStoredType(dispenser, itemType(item));
        JsonObject m = item.getMetadata();
        geometry.ensureItemSize(m);
        store(m, dispenser, slotX, slotY);
        ctx.move(item, slotX, slotY);
        ctx.touch(dispenser);

        ctx.emit(GameEvent.of("dispenser_deposit", null)
                .with("entity_id", item.getId())
                .with("dispenser_id", dispenser.getId()));
        return true;
    }

    private static void store(JsonObject m, Entity container, int slotX, int slotY) {
        m.addProperty("is_stored", true);
        m.addProperty("container_id", container.getId().toString());
        JsonObject slot = new JsonObject();
        slot.addProperty("x", slotX);
        slot.addProperty("y", slotY);
        m.add("stored_slot", slot);
    }

    // ==========================================================
    // DISPENSER RELEASE
    // ==========================================================

    /**
     * For each dispenser touched this tick: when nothing loose lies on its cell,
     * the first stored item is released onto it.
     */
    void syncDispensers(TickContext ctx) {
        for (var id : ctx.touchedDispensers()) {
            Entity dispenser = ctx.entity(id);
            if (dispenser == null) continue;

            List<Entity> stored = new ArrayList<>();
            boolean visible = false;
            for (Entity e : ctx.entities()) {
                if (!e.is(EntityKind.ITEM)) continue;
                if (isStoredIn(e, dispenser)) {
                    stored.add(e);
                } else if (e.getX() == dispenser.getX() && e.getY() == dispenser.getY()
                        && !JsonFields.isTruthy(e.getMetadata(), "is_stored")) {
                    visible = true;
                }
            }
            if (visible || stored.isEmpty()) continue;

            Entity item = stored.get(0);
            JsonObject m = item.getMetadata();
            m.addProperty("is_stored", false);
            m.remove("container_id");
            m.remove("stored_slot");
            ctx.move(item, dispenser.getX(), dispenser.getY());
        }
    }
}
