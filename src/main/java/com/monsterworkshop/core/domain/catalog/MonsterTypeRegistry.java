package com.monsterworkshop.core.domain.catalog;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.monsterworkshop.core.domain.entity.AbilityScores;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spawnable monster types, keyed by lower-cased id ("goblin", "orc", ...).
 */
public class MonsterTypeRegistry {

    private final Map<String, MonsterType> types;

    public MonsterTypeRegistry(Map<String, MonsterType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static MonsterTypeRegistry defaults() {
        Map<String, MonsterType> m = new LinkedHashMap<>();
        m.put("cyclops", new MonsterType("cyclops", "Cyclops", 100, new AbilityScores(18, 10, 16, 8, 10, 8), 100, 100));
        m.put("elf", new MonsterType("elf", "Elf", 150, new AbilityScores(8, 16, 10, 18, 12, 10), 50, 150));
        m.put("goblin", new MonsterType("goblin", "Goblin", 50, new AbilityScores(8, 18, 10, 10, 8, 16), 150, 50));
        m.put("orc", new MonsterType("orc", "Orc", 2000, new AbilityScores(16, 10, 18, 8, 10, 8), 150, 50));
        m.put("troll", new MonsterType("troll", "Troll", 1, new AbilityScores(12, 8, 14, 8, 10, 8), 1500, 1500));
        return new MonsterTypeRegistry(m);
    }

    /**
     * Parses {"monster_types": {...}}. Anything unusable yields the defaults.
     */
    public static MonsterTypeRegistry fromJson(String json) {
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) return defaults();
            JsonElement section = root.getAsJsonObject().get("monster_types");
            if (section == null || !section.isJsonObject()) return defaults();

            Map<String, MonsterType> out = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> e : section.getAsJsonObject().entrySet()) {
                if (!e.getValue().isJsonObject()) continue;
                String id = e.getKey().toLowerCase();
                out.put(id, MonsterType.fromJson(id, e.getValue().getAsJsonObject()));
            }
            return out.isEmpty() ? defaults() : new MonsterTypeRegistry(out);
        } catch (JsonParseException e) {
            System.err.println("[MonsterTypeRegistry] Invalid monster type catalog: " + e.getMessage());
            return defaults();
        }
    }

    public MonsterType find(String id) {
        if (id == null) return null;
        return types.get(id.toLowerCase());
    }

    /**
     * Never null: unknown ids get a neutral fallback (upkeep and ages still work).
     */
    public MonsterType getOrFallback(String id) {
        MonsterType t = find(id);
        return t != null ? t : MonsterType.fallback(id == null ? "" : id.toLowerCase());
    }

    public Collection<MonsterType> all() {
        return types.values();
    }
}
