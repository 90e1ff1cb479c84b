package com.monsterworkshop.core.domain.catalog;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.monsterworkshop.core.common.GridSize;
import com.monsterworkshop.core.common.JsonFields;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only good-type / recipe catalog, keyed by lower-cased name.
 */
public class GoodTypeRegistry {

    private final Map<String, GoodType> byName;

    public GoodTypeRegistry(Map<String, GoodType> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }

    public static GoodTypeRegistry empty() {
        return new GoodTypeRegistry(Map.of());
    }

    /**
     * Parses a {"good_types": [...]} payload. Entries without a name are skipped.
     */
    public static GoodTypeRegistry fromJson(String json) {
        Map<String, GoodType> out = new LinkedHashMap<>();
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) return empty();
            var arr = JsonFields.getArray(root.getAsJsonObject(), "good_types");
            if (arr == null) return empty();
            for (JsonElement el : arr) {
                if (!el.isJsonObject()) continue;
                GoodType gt = GoodType.fromJson(el.getAsJsonObject());
                if (gt.name() != null) out.put(gt.name().toLowerCase(), gt);
            }
        } catch (JsonParseException e) {
            System.err.println("[GoodTypeRegistry] Invalid good type catalog: " + e.getMessage());
            return empty();
        }
        return new GoodTypeRegistry(out);
    }

    /**
     * Recipe lookup by id as players send it: exact lower-case name first,
     * then with underscores read as spaces.
     */
    public GoodType findRecipe(String recipeId) {
        if (recipeId == null) return null;
        String key = recipeId.trim().toLowerCase();
        GoodType direct = byName.get(key);
        if (direct != null) return direct;
        return byName.get(key.replace("_", " ").trim());
    }

    /**
     * Lookup by an item's good_type key (usually underscore form).
     */
    public GoodType findByGoodType(String goodType) {
        if (goodType == null || goodType.isBlank()) return null;
        String lower = goodType.trim().toLowerCase();
        GoodType spaced = byName.get(lower.replace("_", " "));
        if (spaced != null) return spaced;
        return byName.get(lower);
    }

    public Collection<GoodType> all() {
        return byName.values();
    }

    public int size() {
        return byName.size();
    }

    /**
     * Largest footprint among good types satisfying any of the tag groups,
     * never smaller than the default item size.
     */
    public GridSize maxSizeForTagGroups(List<List<String>> tagGroups) {
        GridSize max = GridSize.DEFAULT_ITEM;
        for (List<String> group : tagGroups) {
            for (GoodType gt : byName.values()) {
                if (gt.typeTags().containsAll(group)) {
                    max = max.max(gt.size());
                }
            }
        }
        return max;
    }
}
