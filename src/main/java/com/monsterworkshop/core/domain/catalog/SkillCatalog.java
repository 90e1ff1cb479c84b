package com.monsterworkshop.core.domain.catalog;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.monsterworkshop.core.common.JsonFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Valid transferable and applied skill names, plus which transferable skills
 * are relevant to each applied skill. All names are normalized keys.
 */
public record SkillCatalog(
        List<String> transferableSkills,
        List<String> appliedSkills,
        Map<String, List<String>> relevantTransferableSkills
) {

    public static final List<String> DEFAULT_TRANSFERABLE = List.of(
            "mathematics", "science", "engineering", "writing", "visual_art",
            "music", "handcrafts", "athletics", "outdoorsmonstership", "social"
    );

    public static final List<String> DEFAULT_APPLIED = List.of(
            "hauling", "wagon_driving", "sericulture", "spinning", "weaving",
            "harvesting", "textiles", "threshing", "gathering", "dyeing",
            "prospecting", "chemistry", "milling", "confectionery", "firing",
            "pottery", "painting", "casting", "stone_carving", "carpentry",
            "blacksmithing"
    );

    public static SkillCatalog defaults() {
        return new SkillCatalog(DEFAULT_TRANSFERABLE, DEFAULT_APPLIED, Map.of());
    }

    public static SkillCatalog fromJson(String json) {
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) return defaults();
            JsonObject obj = root.getAsJsonObject();

            List<String> transferable = normalize(JsonFields.getArray(obj, "transferable_skills"));
            if (transferable.isEmpty()) transferable = DEFAULT_TRANSFERABLE;

            List<String> applied = normalize(JsonFields.getArray(obj, "applied_skills"));
            if (applied.isEmpty()) applied = DEFAULT_APPLIED;

            Map<String, List<String>> relevant = new LinkedHashMap<>();
            JsonObject rel = JsonFields.getObject(obj, "relevant_transferable_skills");
            if (rel != null) {
                for (Map.Entry<String, JsonElement> e : rel.entrySet()) {
                    String key = JsonFields.normalizeKey(e.getKey());
                    if (key.isEmpty()) continue;
                    JsonArray values = e.getValue().isJsonArray() ? e.getValue().getAsJsonArray() : null;
                    relevant.put(key, normalize(values));
                }
            }
            return new SkillCatalog(transferable, applied, Collections.unmodifiableMap(relevant));
        } catch (JsonParseException e) {
            System.err.println("[SkillCatalog] Invalid skill catalog: " + e.getMessage());
            return defaults();
        }
    }

    public boolean isTransferable(String normalizedKey) {
        return transferableSkills.contains(normalizedKey);
    }

    /**
     * Transferable skills relevant to an applied skill; empty when none are configured.
     */
    public List<String> relevantFor(String appliedSkill) {
        if (appliedSkill == null) return List.of();
        return relevantTransferableSkills.getOrDefault(JsonFields.normalizeKey(appliedSkill), List.of());
    }

    private static List<String> normalize(JsonArray arr) {
        List<String> out = new ArrayList<>();
        for (String s : JsonFields.toStringList(arr)) {
            out.add(JsonFields.normalizeKey(s));
        }
        return Collections.unmodifiableList(out);
    }
}
