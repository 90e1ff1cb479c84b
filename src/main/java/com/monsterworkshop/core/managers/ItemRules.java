package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GoodType;
import com.monsterworkshop.core.domain.catalog.GoodTypeRegistry;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Item properties derived from metadata plus the good-type catalog:
 * tags, tool detection, durability, weight, quality and value.
 */
final class ItemRules {

    static final int DEFAULT_MAX_DURABILITY = 100;
    static final int WORKSHOP_MAX_DURABILITY = 1000;
    static final int WORKSHOP_WEIGHT = 100000;
    static final int WAGON_WEIGHT = 10;

    private static final List<String> TOOL_WORDS = List.of("hammer", "tongs", "anvil", "loom");

    private final GoodTypeRegistry goodTypes;
    private final MonsterAbilities abilities;

    ItemRules(GoodTypeRegistry goodTypes, MonsterAbilities abilities) {
        this.goodTypes = goodTypes;
        this.abilities = abilities;
    }

    GoodType entryFor(JsonObject metadata) {
        return goodTypes.findByGoodType(JsonFields.getString(metadata, "good_type"));
    }

    // ==========================================================
    // TAGS / TOOLS
    // ==========================================================

    /**
     * Catalog type_tags, or the words of the good type plus the good type itself;
     * carried-over tags are appended.
     */
    List<String> itemTags(JsonObject metadata) {
        String goodType = JsonFields.getString(metadata, "good_type", "").trim().toLowerCase();
        GoodType entry = goodTypes.findByGoodType(goodType);
        List<String> tags = new ArrayList<>();
        if (entry != null) {
            tags.addAll(entry.typeTags());
        } else if (!goodType.isEmpty()) {
            for (String part : goodType.replace("_", " ").split("\\s+")) {
                if (!part.isEmpty()) tags.add(part);
            }
            if (!tags.contains(goodType)) tags.add(goodType);
        }
        for (String tag : JsonFields.getStringList(metadata, "carried_over_tags")) {
            String t = tag.toLowerCase();
            if (!tags.contains(t)) tags.add(t);
        }
        return tags;
    }

    boolean isTool(JsonObject metadata) {
        String goodType = JsonFields.getString(metadata, "good_type", "").toLowerCase();
        if (goodType.contains("tool")) return true;
        for (String w : TOOL_WORDS) {
            if (goodType.contains(w)) return true;
        }
        return JsonFields.isTruthy(metadata, "is_tool");
    }

    List<String> toolTags(JsonObject metadata) {
        List<String> tags = new ArrayList<>(JsonFields.getStringList(metadata, "tool_tags"));
        String goodType = JsonFields.getString(metadata, "good_type", "").toLowerCase();
        for (String w : TOOL_WORDS) {
            if (goodType.contains(w) && !tags.contains(w)) tags.add(w);
        }
        return tags;
    }

    int maxDurability(JsonObject metadata) {
        GoodType entry = entryFor(metadata);
        if (entry != null && entry.workshopEntry()) return WORKSHOP_MAX_DURABILITY;
        return DEFAULT_MAX_DURABILITY;
    }

    /**
     * Stored max durability, else the catalog default; garbage reads as 100.
     */
    int storedMaxDurability(JsonObject metadata) {
        if (!JsonFields.has(metadata, "max_durability")) return maxDurability(metadata);
        return JsonFields.getInt(metadata, "max_durability", DEFAULT_MAX_DURABILITY);
    }

    /**
     * Stored durability, else max durability; garbage reads as {@code fallback}.
     */
    int durability(JsonObject metadata, int fallback) {
        if (!JsonFields.has(metadata, "durability")) return storedMaxDurability(metadata);
        return JsonFields.getInt(metadata, "durability", fallback);
    }

    /**
     * A tool satisfies a tag group only while it still has durability.
     */
    boolean toolMatches(Entity tool, List<String> tagGroup) {
        JsonObject m = tool.getMetadata();
        if (durability(m, 0) <= 0) return false;
        List<String> tags = new ArrayList<>();
        for (String t : toolTags(m)) tags.add(t.toLowerCase());
        return tags.containsAll(tagGroup);
    }

    boolean itemMatches(Entity item, List<String> tagGroup) {
        return itemTags(item.getMetadata()).containsAll(tagGroup);
    }

    // ==========================================================
    // WEIGHT
    // ==========================================================
    int weight(Entity item) {
        JsonObject m = item.getMetadata();
        if (m.has("weight")) {
            return JsonFields.asInt(m.get("weight"), 1);
        }
        if (item.is(EntityKind.WAGON)) return WAGON_WEIGHT;
        GoodType entry = entryFor(m);
        if (entry != null) return calculateWeight(entry, JsonFields.getArray(m, "raw_materials"));
        return 1;
    }

    /**
     * Density times storage volume: the good's own density for raw materials,
     * the average density of its lineage otherwise.
     */
    int calculateWeight(GoodType entry, JsonArray rawMaterials) {
        if (entry.workshopEntry()) return WORKSHOP_WEIGHT;
        double volume = entry.storageVolume();
        if (entry.isRawMaterial() && entry.rawMaterialDensity() != null) {
            return Math.max(1, (int) Math.rint(entry.rawMaterialDensity() * volume));
        }
        double sum = 0;
        int count = 0;
        if (rawMaterials != null) {
            for (JsonElement el : rawMaterials) {
                if (!el.isJsonObject()) continue;
                Double density = JsonFields.getDoubleOrNull(el.getAsJsonObject(), "density");
                if (density == null) continue;
                sum += density;
                count++;
            }
        }
        if (count > 0) {
            return Math.max(1, (int) Math.rint(sum / count * volume));
        }
        return Math.max(1, (int) Math.rint(volume));
    }

    // ==========================================================
    // QUALITY / VALUE
    // ==========================================================

    /**
     * Values above 5 are read as percentages.
     */
    static double normalizeQuality(double quality) {
        return quality > 5.0 ? quality / 100.0 : quality;
    }

    double quality(Entity item) {
        if (item == null) return 1.0;
        JsonObject m = item.getMetadata();
        double q = m.has("quality") ? JsonFields.asDouble(m.get("quality"), 0.0) : 1.0;
        return Math.max(0.0, normalizeQuality(q));
    }

    /**
     * Raw materials: base * (q + 0.5)^0.5. Refined goods: sum of lineage base
     * values * (q + 0.5)^(0.5 + 0.5 * depth), scaled by the crafter's charisma.
     */
    int value(GoodType entry, JsonArray rawMaterials, int maxDepth, double quality, Entity crafter) {
        double q = normalizeQuality(quality);
        if (entry.rawMaterialBaseValue() != null) {
            return (int) (entry.rawMaterialBaseValue() * Math.pow(q + 0.5, 0.5));
        }
        double raw = 0;
        if (rawMaterials != null) {
            for (JsonElement el : rawMaterials) {
                if (!el.isJsonObject()) continue;
                raw += JsonFields.getDouble(el.getAsJsonObject(), "base_value", 0.0);
            }
        }
        if (raw <= 0) return 0;
        double exponent = 0.5 + 0.5 * maxDepth;
        double value = Math.rint(raw * Math.pow(q + 0.5, exponent));
        if (crafter != null) {
            value = value * (10 + abilities.rawCharisma(crafter) / 2.0) / 10;
        }
        return (int) value;
    }

    /**
     * Stored value, or a value recomputed from lineage when it is missing or not numeric.
     */
    int storedOrComputedValue(JsonObject metadata) {
        JsonElement v = metadata.get("value");
        if (v != null && v.isJsonPrimitive()) {
            int sentinel = Integer.MIN_VALUE;
            int parsed = JsonFields.asInt(v, sentinel);
            if (parsed != sentinel) return parsed;
        }
        GoodType entry = entryFor(metadata);
        if (entry == null) return 0;
        return value(
                entry,
                JsonFields.getArray(metadata, "raw_materials"),
                JsonFields.getInt(metadata, "raw_material_max_depth", 0),
                JsonFields.getDouble(metadata, "quality", 0.0),
                null
        );
    }
}
