package com.monsterworkshop.core.domain.catalog;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GridSize;
import com.monsterworkshop.core.common.JsonFields;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A good-type catalog entry: both the material description and the recipe that produces it.
 *
 * Tag lists are lower-cased on load. Tag groups are AND-matches: one item (or one tool)
 * must carry every tag of the group.
 */
public record GoodType(
        String name,
        List<String> typeTags,
        List<List<String>> inputTagsRequired,
        List<List<String>> inputTagsCarryover,
        List<List<String>> toolsRequiredTags,
        List<Integer> toolsWeights,
        String primaryAppliedSkill,
        List<String> secondaryAppliedSkills,
        List<String> destabilizerSkills,
        List<String> transferableSkills,
        int relevantAbilityScore,
        int difficultyRating,
        int productionTime,
        JsonElement rawProductionTime,
        double quantity,
        boolean fixedQuantity,
        int valueAddedShares,
        Double rawMaterialBaseValue,
        Double rawMaterialDensity,
        double storageVolume,
        boolean hasQuality,
        GridSize size,
        String requiresWorkshopType,
        boolean requiresWorkshop,
        boolean workshopEntry,
        double cost
) {

    public static final int DEFAULT_PRODUCTION_TIME = 60;

    /**
     * Canonical good-type key (lower case, underscores) used on items and in specific skills.
     */
    public String key() {
        return JsonFields.normalizeKey(name);
    }

    public boolean isRawMaterial() {
        return rawMaterialBaseValue != null;
    }

    /**
     * Recipe weight of the tool at {@code index}; missing or invalid entries weigh 1.
     */
    public int toolWeight(int index) {
        if (index < 0 || index >= toolsWeights.size()) return 1;
        return Math.max(1, toolsWeights.get(index));
    }

    /**
     * Lineage record for this raw material, as stored in an item's "raw_materials".
     */
    public JsonObject rawMaterialEntry() {
        JsonObject json = new JsonObject();
        json.addProperty("good_type", name);
        json.addProperty("base_value", rawMaterialBaseValue != null ? rawMaterialBaseValue : 0.0);
        json.addProperty("density", rawMaterialDensity != null ? rawMaterialDensity : 0.0);
        return json;
    }

    // ==========================================================
    // PARSING
    // ==========================================================
    public static GoodType fromJson(JsonObject json) {
        String name = JsonFields.getString(json, "name");

        List<Integer> weights = new ArrayList<>();
        JsonArray w = JsonFields.getArray(json, "tools_weights");
        if (w != null) {
            for (JsonElement el : w) weights.add(JsonFields.asInt(el, 1));
        }

        int difficulty = JsonFields.getInt(json, "difficulty_rating", 1);
        if (difficulty == 0) difficulty = 1;

        JsonElement requires = json.get("requires_workshop");
        String requiresType = null;
        boolean requiresAny = false;
        if (requires != null && requires.isJsonPrimitive() && requires.getAsJsonPrimitive().isString()) {
            requiresType = requires.getAsString();
        } else {
            requiresAny = JsonFields.isTruthy(requires);
        }

        return new GoodType(
                name,
                lowerList(JsonFields.getArray(json, "type_tags")),
                tagGroups(JsonFields.getArray(json, "input_goods_tags_required")),
                tagGroups(JsonFields.getArray(json, "input_goods_tags_carryover")),
                tagGroups(JsonFields.getArray(json, "tools_required_tags")),
                Collections.unmodifiableList(weights),
                JsonFields.getString(json, "primary_applied_skill"),
                JsonFields.getStringList(json, "secondary_applied_skills"),
                JsonFields.getStringList(json, "destabilizer_skills"),
                JsonFields.getStringList(json, "transferable_skills"),
                JsonFields.getInt(json, "relevant_ability_score", 0),
                difficulty,
                JsonFields.getInt(json, "production_time", DEFAULT_PRODUCTION_TIME),
                json.get("production_time"),
                JsonFields.getDouble(json, "quantity", 1.0),
                JsonFields.isTruthy(json, "is_fixed_quantity"),
                JsonFields.getInt(json, "value_added_shares", 0),
                JsonFields.getDoubleOrNull(json, "raw_material_base_value"),
                JsonFields.getDoubleOrNull(json, "raw_material_density"),
                JsonFields.getDouble(json, "storage_volume", 1.0),
                !json.has("has_quality") || JsonFields.isTruthy(json, "has_quality"),
                parseSize(JsonFields.getArray(json, "size")),
                requiresType,
                requiresAny,
                JsonFields.has(json, "workshop_task_slots") || JsonFields.has(json, "workshop_task_tags"),
                JsonFields.getDouble(json, "cost", 0.0)
        );
    }

    /**
     * [w, h] with each side at least 1; anything else is the default item size.
     */
    public static GridSize parseSize(JsonArray arr) {
        if (arr == null || arr.size() < 2) return GridSize.DEFAULT_ITEM;
        int w = JsonFields.asInt(arr.get(0), GridSize.DEFAULT_ITEM.width());
        int h = JsonFields.asInt(arr.get(1), GridSize.DEFAULT_ITEM.height());
        return GridSize.of(w, h);
    }

    private static List<String> lowerList(JsonArray arr) {
        List<String> out = new ArrayList<>();
        for (String s : JsonFields.toStringList(arr)) out.add(s.toLowerCase());
        return Collections.unmodifiableList(out);
    }

    // A bare string inside the outer list counts as a single-tag group.
    private static List<List<String>> tagGroups(JsonArray arr) {
        List<List<String>> groups = new ArrayList<>();
        if (arr == null) return groups;
        for (JsonElement el : arr) {
            if (el == null || el.isJsonNull()) continue;
            if (el.isJsonArray()) {
                groups.add(lowerList(el.getAsJsonArray()));
            } else if (el.isJsonPrimitive()) {
                groups.add(List.of(el.getAsString().toLowerCase()));
            }
        }
        return Collections.unmodifiableList(groups);
    }
}
