package com.monsterworkshop.core.managers;

import com.monsterworkshop.core.domain.catalog.ZoneDefinition;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.tick.EntityCreate;
import com.monsterworkshop.core.domain.tick.EntityUpdate;
import com.monsterworkshop.core.domain.tick.GameEvent;
import com.monsterworkshop.core.domain.tick.TickResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Working state of one zone tick.
 *
 * Holds deep copies of the input entities; services mutate those copies and
 * {@link #toResult()} diffs them against the untouched input. Deleted entities
 * leave the working set immediately so later steps of the same tick never see them.
 */
final class TickContext {

    private final ZoneDefinition zoneDefinition;
    private final int zoneWidth;
    private final int zoneHeight;
    private final long tickNumber;
    private final Random rng;
    private final LocalDateTime now;

    private final Map<UUID, Entity> originals = new HashMap<>();
    private final List<Entity> entities = new ArrayList<>();
    private final Map<UUID, Entity> byId = new HashMap<>();

    private final List<EntityCreate> creates = new ArrayList<>();
    private final Set<UUID> deletes = new LinkedHashSet<>();
    private final Set<UUID> touched = new LinkedHashSet<>();
    private final List<GameEvent> events = new ArrayList<>();

    // item id -> pushing monster id
    private final Map<UUID, UUID> activePushes = new LinkedHashMap<>();
    private final Set<UUID> touchedDispensers = new LinkedHashSet<>();

    TickContext(ZoneDefinition zoneDefinition, int zoneWidth, int zoneHeight,
                long tickNumber, Random rng, LocalDateTime now, List<Entity> input) {
        this.zoneDefinition = zoneDefinition;
        this.zoneWidth = zoneWidth;
        this.zoneHeight = zoneHeight;
        this.tickNumber = tickNumber;
        this.rng = rng;
        this.now = now;

        for (Entity e : input) {
            if (e == null || e.getId() == null) continue;
            Entity copy = e.copy();
            originals.put(e.getId(), e);
            entities.add(copy);
            byId.put(copy.getId(), copy);
        }
    }

    ZoneDefinition zoneDefinition() { return zoneDefinition; }
    int zoneWidth() { return zoneWidth; }
    int zoneHeight() { return zoneHeight; }
    long tickNumber() { return tickNumber; }
    Random rng() { return rng; }
    LocalDateTime now() { return now; }

    // ==========================================================
    // ENTITIES
    // ==========================================================
    List<Entity> entities() {
        return Collections.unmodifiableList(entities);
    }

    /**
     * Stable copy for loops that may delete while iterating.
     */
    List<Entity> snapshot() {
        return new ArrayList<>(entities);
    }

    Entity entity(UUID id) {
        return id == null ? null : byId.get(id);
    }

    boolean isLive(Entity e) {
        return e != null && byId.containsKey(e.getId());
    }

    List<Entity> ofKind(EntityKind kind) {
        List<Entity> out = new ArrayList<>();
        for (Entity e : entities) {
            if (e.is(kind)) out.add(e);
        }
        return out;
    }

    boolean hasWorldMarker() {
        for (Entity e : entities) {
            if (e.is(EntityKind.WORLD_MARKER)) return true;
        }
        return false;
    }

    /**
     * Records that the entity may have changed. Untouched changes are still
     * found by the final diff, this only fixes the update order.
     */
    void touch(Entity e) {
        if (e != null) touched.add(e.getId());
    }

    void move(Entity e, int x, int y) {
        e.setPosition(x, y);
        touch(e);
    }

    void delete(Entity e) {
        if (e == null || !byId.containsKey(e.getId())) return;
        deletes.add(e.getId());
        entities.remove(e);
        byId.remove(e.getId());
        activePushes.remove(e.getId());
    }

    // ==========================================================
    // OUTPUT
    // ==========================================================
    void create(EntityCreate create) {
        creates.add(create);
    }

    List<EntityCreate> creates() {
        return creates;
    }

    void emit(GameEvent event) {
        events.add(event);
    }

    Map<UUID, UUID> activePushes() {
        return activePushes;
    }

    Set<UUID> touchedDispensers() {
        return touchedDispensers;
    }

    TickResult toResult() {
        List<EntityUpdate> updates = new ArrayList<>();
        Set<UUID> order = new LinkedHashSet<>(touched);
        for (Entity e : entities) order.add(e.getId());

        for (UUID id : order) {
            Entity current = byId.get(id);
            Entity original = originals.get(id);
            if (current == null || original == null) continue;

            boolean moved = current.getX() != original.getX() || current.getY() != original.getY();
            boolean changed = !current.getMetadata().equals(original.getMetadata());
            if (!moved && !changed) continue;

            updates.add(new EntityUpdate(
                    id,
                    moved ? current.getX() : null,
                    moved ? current.getY() : null,
                    null,
                    null,
                    changed ? current.getMetadata().deepCopy() : null
            ));
        }

        return new TickResult(
                List.copyOf(creates),
                List.copyOf(updates),
                List.copyOf(deletes),
                List.copyOf(events)
        );
    }
}
