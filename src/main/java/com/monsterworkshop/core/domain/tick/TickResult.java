package com.monsterworkshop.core.domain.tick;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.UUID;

/**
 * The atomic outcome of one zone tick.
 */
public record TickResult(
        List<EntityCreate> creates,
        List<EntityUpdate> updates,
        List<UUID> deletes,
        List<GameEvent> events
) {

    public EntityUpdate updateFor(UUID id) {
        for (EntityUpdate u : updates) {
            if (u.id().equals(id)) return u;
        }
        return null;
    }

    public GameEvent firstEvent(String type) {
        for (GameEvent e : events) {
            if (type.equals(e.type())) return e;
        }
        return null;
    }

    /**
     * Events in wire form, as delivered to {@code extras.events}.
     */
    public JsonObject extras() {
        JsonObject extras = new JsonObject();
        if (!events.isEmpty()) {
            JsonArray arr = new JsonArray();
            events.forEach(e -> arr.add(e.serialize()));
            extras.add("events", arr);
        }
        return extras;
    }
}
