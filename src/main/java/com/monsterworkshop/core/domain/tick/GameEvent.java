package com.monsterworkshop.core.domain.tick;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.UUID;

/**
 * Player-visible notification produced during a tick.
 * Events with a target are meant for that player only.
 */
public final class GameEvent {

    private final String type;
    private final String message;
    private final UUID targetPlayerId;
    private final JsonObject extra = new JsonObject();

    private GameEvent(String type, String message, UUID targetPlayerId) {
        this.type = type;
        this.message = message;
        this.targetPlayerId = targetPlayerId;
    }

    public static GameEvent of(String type, UUID target) {
        return new GameEvent(type, null, target);
    }

    public static GameEvent message(String type, String message, UUID target) {
        return new GameEvent(type, message, target);
    }

    public static GameEvent error(String message, UUID target) {
        return new GameEvent("error", message, target);
    }

    public GameEvent with(String key, String value) {
        extra.addProperty(key, value);
        return this;
    }

    public GameEvent with(String key, Number value) {
        extra.addProperty(key, value);
        return this;
    }

    public GameEvent with(String key, JsonElement value) {
        extra.add(key, value);
        return this;
    }

    public GameEvent with(String key, UUID value) {
        extra.addProperty(key, value == null ? null : value.toString());
        return this;
    }

    public String type() { return type; }
    public String message() { return message; }
    public UUID targetPlayerId() { return targetPlayerId; }

    public JsonElement get(String key) {
        return extra.get(key);
    }

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        json.addProperty("type", type);
        if (message != null) json.addProperty("message", message);
        if (targetPlayerId != null) json.addProperty("target_player_id", targetPlayerId.toString());
        for (var e : extra.entrySet()) {
            json.add(e.getKey(), e.getValue());
        }
        return json;
    }

    @Override
    public String toString() {
        return serialize().toString();
    }
}
