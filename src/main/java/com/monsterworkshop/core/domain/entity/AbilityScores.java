package com.monsterworkshop.core.domain.entity;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;

public record AbilityScores(int str, int dex, int con, int intel, int wis, int cha) {

    public int get(Ability ability) {
        return switch (ability) {
            case STR -> str;
            case DEX -> dex;
            case CON -> con;
            case INT -> intel;
            case WIS -> wis;
            case CHA -> cha;
        };
    }

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        for (Ability a : Ability.values()) {
            json.addProperty(a.key(), get(a));
        }
        return json;
    }

    /**
     * Missing scores default to 8, the floor of the monster catalog.
     */
    public static AbilityScores fromJson(JsonObject json) {
        return new AbilityScores(
                JsonFields.getInt(json, "str", 8),
                JsonFields.getInt(json, "dex", 8),
                JsonFields.getInt(json, "con", 8),
                JsonFields.getInt(json, "int", 8),
                JsonFields.getInt(json, "wis", 8),
                JsonFields.getInt(json, "cha", 8)
        );
    }
}
