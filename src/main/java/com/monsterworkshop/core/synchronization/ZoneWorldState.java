package com.monsterworkshop.core.synchronization;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.tick.EntityCreate;
import com.monsterworkshop.core.domain.tick.EntityUpdate;
import com.monsterworkshop.core.domain.tick.RawIntent;
import com.monsterworkshop.core.domain.tick.TickResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory store of one zone: the entities, the intents queued since the last
 * tick, and the events of the last applied tick.
 *
 * Intents may be queued from any thread. Entity state is only read and written
 * under the instance lock.
 */
public class ZoneWorldState {

    private final UUID zoneId;
    private final Map<UUID, Entity> entities = new LinkedHashMap<>();
    private final ConcurrentLinkedQueue<RawIntent> pendingIntents = new ConcurrentLinkedQueue<>();

    private List<JsonObject> lastEvents = List.of();
    private long lastTick = 0;

    public ZoneWorldState(UUID zoneId) {
        this.zoneId = zoneId;
    }

    public UUID getZoneId() {
        return zoneId;
    }

    // ==========================================================
    // INTENTS
    // ==========================================================
    public void submit(RawIntent intent) {
        if (intent != null) pendingIntents.add(intent);
    }

    public List<RawIntent> drainIntents() {
        List<RawIntent> out = new ArrayList<>();
        RawIntent next;
        while ((next = pendingIntents.poll()) != null) out.add(next);
        return out;
    }

    // ==========================================================
    // ENTITIES
    // ==========================================================
    public synchronized void put(Entity entity) {
        entities.put(entity.getId(), entity.copy());
    }

    public synchronized Entity get(UUID id) {
        Entity e = entities.get(id);
        return e != null ? e.copy() : null;
    }

    public synchronized List<Entity> snapshot() {
        List<Entity> out = new ArrayList<>(entities.size());
        for (Entity e : entities.values()) out.add(e.copy());
        return out;
    }

    public synchronized int size() {
        return entities.size();
    }

    public synchronized long getLastTick() {
        return lastTick;
    }

    /**
     * Applies a tick diff: updates, then deletes, then creates (with fresh ids).
     *
     * @return ids assigned to the creates, in order
     */
    public synchronized List<UUID> apply(TickResult result, long tickNumber) {
        for (EntityUpdate u : result.updates()) {
            Entity e = entities.get(u.id());
            if (e == null) continue;
            if (u.hasPosition()) e.setPosition(u.x(), u.y());
            if (u.width() != null && u.height() != null) e.setSize(u.width(), u.height());
            if (u.hasMetadata()) e.setMetadata(u.metadata().deepCopy());
        }

        for (UUID id : result.deletes()) entities.remove(id);

        List<UUID> created = new ArrayList<>(result.creates().size());
        for (EntityCreate c : result.creates()) {
            UUID id = UUID.randomUUID();
            entities.put(id, new Entity(id, zoneId, c.x(), c.y(), c.width(), c.height(), c.ownerId(), c.metadata().deepCopy()));
            created.add(id);
        }

        List<JsonObject> events = new ArrayList<>(result.events().size());
        result.events().forEach(ev -> events.add(ev.serialize()));
        this.lastEvents = events;
        this.lastTick = tickNumber;
        return created;
    }

    /**
     * Full zone state as sent to clients before per-player filtering.
     */
    public synchronized JsonObject fullState() {
        JsonObject state = new JsonObject();
        state.addProperty("zone_id", zoneId.toString());
        state.addProperty("tick", lastTick);

        JsonArray arr = new JsonArray();
        for (Entity e : entities.values()) {
            JsonObject o = new JsonObject();
            o.addProperty("id", e.getId().toString());
            o.addProperty("x", e.getX());
            o.addProperty("y", e.getY());
            o.addProperty("width", e.getWidth());
            o.addProperty("height", e.getHeight());
            if (e.getOwnerId() != null) o.addProperty("owner_id", e.getOwnerId().toString());
            o.add("metadata", e.getMetadata().deepCopy());
            arr.add(o);
        }
        state.add("entities", arr);

        JsonArray events = new JsonArray();
        lastEvents.forEach(events::add);
        state.add("events", events);
        return state;
    }
}
