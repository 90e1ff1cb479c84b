package com.monsterworkshop.core.domain.intent;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.monsterworkshop.core.common.Direction;
import com.monsterworkshop.core.common.GridPosition;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.tick.RawIntent;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns the transport's free-form intent maps into {@link Intent} variants.
 * Never throws: structurally broken fields become nulls or zero deltas and
 * the handlers treat those as silent no-ops.
 */
public final class IntentParser {

    private IntentParser() {}

    public static List<Intent> parseAll(List<RawIntent> raw) {
        List<Intent> out = new ArrayList<>(raw.size());
        for (RawIntent r : raw) out.add(parse(r));
        return out;
    }

    public static Intent parse(RawIntent raw) {
        UUID player = raw.playerId();
        JsonObject data = raw.data();
        String action = JsonFields.getString(data, "action");
        if (action == null) return new Intent.Ignored(player);

        return switch (action) {
            case "move", "push" -> new Intent.Move(player, JsonFields.getUuid(data, "entity_id"), parseDelta(data));
            case "spawn_monster" -> new Intent.SpawnMonster(
                    player,
                    JsonFields.getString(data, "monster_type", "goblin").toLowerCase(),
                    JsonFields.getString(data, "name", "Monster"),
                    parseSkillList(data.get("transferable_skills"))
            );
            case "owner_disconnect" -> new Intent.OwnerDisconnect(player, JsonFields.getUuid(data, "player_id"));
            case "recording_start" -> new Intent.RecordingStart(player, monsterId(data));
            case "recording_stop" -> new Intent.RecordingStop(player, monsterId(data));
            case "autorepeat_start" -> new Intent.AutorepeatStart(player, monsterId(data));
            case "autorepeat_stop" -> new Intent.AutorepeatStop(player, monsterId(data));
            case "select_recipe" -> new Intent.SelectRecipe(
                    player,
                    JsonFields.getUuid(data, "workshop_id"),
                    JsonFields.getString(data, "recipe_id"),
                    monsterId(data)
            );
            case "interact" -> new Intent.Interact(player, monsterId(data), JsonFields.getUuid(data, "entity_id"));
            case "hitch_wagon" -> new Intent.HitchWagon(player, monsterId(data));
            case "unhitch_wagon" -> new Intent.UnhitchWagon(player, monsterId(data));
            case "unload_wagon" -> new Intent.UnloadWagon(player, monsterId(data));
            default -> new Intent.Unsupported(player, action);
        };
    }

    /**
     * Named direction wins; otherwise integral dx/dy clamped to -1..1.
     * Anything else is the zero delta.
     */
    public static GridPosition parseDelta(JsonObject data) {
        Direction dir = Direction.fromKey(JsonFields.getString(data, "direction"));
        if (dir != null) return dir.toDelta();

        Integer dx = integral(data.get("dx"), 0);
        Integer dy = integral(data.get("dy"), 0);
        if (dx == null || dy == null) return new GridPosition(0, 0);
        return new GridPosition(clamp(dx), clamp(dy));
    }

    // "monster_id" first, "entity_id" as fallback
    private static UUID monsterId(JsonObject data) {
        UUID id = JsonFields.getUuid(data, "monster_id");
        return id != null ? id : JsonFields.getUuid(data, "entity_id");
    }

    private static Integer integral(JsonElement el, int absentValue) {
        if (el == null || el.isJsonNull()) return absentValue;
        if (!el.isJsonPrimitive()) return null;
        JsonPrimitive p = el.getAsJsonPrimitive();
        if (!p.isNumber()) return null;
        double v = p.getAsDouble();
        if (v != Math.rint(v) || p.getAsString().contains(".")) return null;
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, v));
    }

    private static int clamp(int v) {
        return Math.max(-1, Math.min(1, v));
    }

    private static List<String> parseSkillList(JsonElement el) {
        if (el == null || !el.isJsonArray()) return null;
        JsonArray arr = el.getAsJsonArray();
        List<String> out = new ArrayList<>(arr.size());
        for (JsonElement e : arr) {
            if (e == null || e.isJsonNull()) out.add("");
            else if (e.isJsonPrimitive()) out.add(e.getAsString());
            else out.add(e.toString());
        }
        return out;
    }
}
