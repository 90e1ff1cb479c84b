package com.monsterworkshop.core.domain.catalog;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.entity.AbilityScores;

public record MonsterType(
        String id,
        String name,
        int cost,
        AbilityScores stats,
        int bodyCap,
        int mindCap
) {

    public static final int DEFAULT_COST = 50;

    public static MonsterType fromJson(String id, JsonObject json) {
        return new MonsterType(
                id,
                JsonFields.getString(json, "name", id),
                JsonFields.getInt(json, "cost", DEFAULT_COST),
                AbilityScores.fromJson(JsonFields.getObject(json, "stats")),
                JsonFields.getInt(json, "body_cap", 100),
                JsonFields.getInt(json, "mind_cap", 100)
        );
    }

    /**
     * Used when a stored monster references a type missing from the catalog.
     */
    public static MonsterType fallback(String id) {
        return new MonsterType(id, id, DEFAULT_COST, new AbilityScores(8, 8, 8, 8, 8, 8), 100, 100);
    }
}
