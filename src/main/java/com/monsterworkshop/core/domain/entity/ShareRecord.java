package com.monsterworkshop.core.domain.entity;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.monsterworkshop.core.common.JsonFields;

import java.util.Objects;

/**
 * One revenue-entitlement line attached to an item.
 * At least one of monsterId / playerId is set.
 */
public record ShareRecord(String monsterId, String playerId, double count, String description) {

    public boolean sameContributor(String otherMonsterId, String otherPlayerId) {
        return Objects.equals(monsterId, otherMonsterId)
                && Objects.equals(playerId, otherPlayerId);
    }

    public ShareRecord plus(double extra) {
        return new ShareRecord(monsterId, playerId, count + extra, description);
    }

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        json.add("monster_id", nullable(monsterId));
        json.add("player_id", nullable(playerId));
        json.addProperty("count", count);
        json.addProperty("description", description == null ? "" : description);
        return json;
    }

    /**
     * Accepts legacy aliases ("monster", "owner_id"). Null for non-positive or unparsable counts.
     */
    public static ShareRecord fromJson(JsonObject json) {
        if (json == null) return null;
        String monster = JsonFields.getString(json, "monster_id");
        if (monster == null) monster = JsonFields.getString(json, "monster");
        String player = JsonFields.getString(json, "player_id");
        if (player == null) player = JsonFields.getString(json, "owner_id");
        double count = JsonFields.getDouble(json, "count", 0.0);
        if (count <= 0) return null;
        return new ShareRecord(monster, player, count, JsonFields.getString(json, "description", ""));
    }

    private static JsonElement nullable(String s) {
        return s == null ? JsonNull.INSTANCE : new JsonPrimitive(s);
    }
}
