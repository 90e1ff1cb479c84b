package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GoodType;
import com.monsterworkshop.core.domain.catalog.GoodTypeRegistry;
import com.monsterworkshop.core.domain.entity.Ability;
import com.monsterworkshop.core.domain.entity.Entity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * The numbers behind a craft: duration, output quantity and quality, and the
 * lineage an output inherits from its inputs.
 */
final class CraftingRolls {

    /**
     * Raw-material lineage of an output plus its refinement depth.
     */
    record Lineage(JsonArray rawMaterials, int maxDepth) {}

    private final GoodTypeRegistry goodTypes;
    private final MonsterAbilities abilities;
    private final SkillService skills;
    private final ItemRules items;

    CraftingRolls(GoodTypeRegistry goodTypes, MonsterAbilities abilities, SkillService skills, ItemRules items) {
        this.goodTypes = goodTypes;
        this.abilities = abilities;
        this.skills = skills;
        this.items = items;
    }

    // ==========================================================
    // DURATION
    // ==========================================================

    /**
     * Production time in ticks, shortened by dexterity and intelligence.
     */
    int duration(GoodType recipe, Entity crafter, LocalDateTime now) {
        double result = recipe.productionTime();
        if (crafter != null) {
            int dex = abilities.effective(crafter, Ability.DEX, now);
            int intel = abilities.effective(crafter, Ability.INT, now);
            if (dex > 0) result *= 10.0 / dex;
            result *= 30.0 / (20 + intel);
        }
        return Math.max(1, (int) result);
    }

    // ==========================================================
    // SKILL / TOOL AVERAGES
    // ==========================================================
    double secondarySkillsAverage(GoodType recipe, Entity crafter, int transferableCount) {
        if (crafter == null || recipe.secondaryAppliedSkills().isEmpty()) return 1.0;
        List<Double> values = new ArrayList<>();
        for (String skill : recipe.secondaryAppliedSkills()) {
            String key = JsonFields.normalizeKey(skill);
            if (key.isEmpty()) continue;
            values.add(skills.skillValue(crafter, key, SkillService.APPLIED));
        }
        return averageAfterDropping(values, transferableCount);
    }

    /**
     * Tool qualities repeated by recipe weight; each matching transferable skill
     * drops the two weakest entries.
     */
    double toolQualitiesAverage(GoodType recipe, List<Entity> tools, int transferableCount) {
        if (tools.isEmpty()) return 1.0;
        List<Double> qualities = new ArrayList<>();
        for (int i = 0; i < tools.size(); i++) {
            double q = items.quality(tools.get(i));
            for (int w = 0; w < recipe.toolWeight(i); w++) qualities.add(q);
        }
        return averageAfterDropping(qualities, transferableCount * 2);
    }

    private static double averageAfterDropping(List<Double> values, int drop) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(null);
        if (drop >= sorted.size()) return 1.0;
        List<Double> kept = sorted.subList(Math.max(0, drop), sorted.size());
        double sum = 0;
        for (double v : kept) sum += v;
        return sum / kept.size();
    }

    private double averageInputQuality(List<Entity> inputs) {
        if (inputs.isEmpty()) return 1.0;
        double sum = 0;
        for (Entity input : inputs) sum += items.quality(input);
        return sum / inputs.size();
    }

    // ==========================================================
    // QUALITY
    // ==========================================================
    double rollQuality(GoodType recipe, Entity crafter, List<Entity> inputs, List<Entity> tools,
                       Random rng, LocalDateTime now) {
        double avgInput = averageInputQuality(inputs);
        int transferable = skills.matchingTransferableCount(recipe, crafter);
        double secondaryAvg = secondarySkillsAverage(recipe, crafter, transferable);
        double toolAvg = toolQualitiesAverage(recipe, tools, transferable);

        if (!recipe.hasQuality()) return (avgInput + toolAvg) / 2;
        if (crafter == null) return avgInput;

        double primary = skills.skillValue(crafter, JsonFields.normalizeKey(recipe.primaryAppliedSkill()), SkillService.APPLIED);
        double specific = skills.skillValue(crafter, recipe.key(), SkillService.SPECIFIC);
        int relevant = abilities.effective(crafter, recipe.relevantAbilityScore(), now);
        double abilityFactor = Math.min(1.2, (double) relevant / recipe.difficultyRating());

        double mu = avgInput * primary * secondaryAvg + toolAvg * specific * abilityFactor;

        double destabilizer = 0.0;
        if (!recipe.destabilizerSkills().isEmpty()) {
            double sum = 0;
            for (String skill : recipe.destabilizerSkills()) {
                sum += skills.skillValue(crafter, JsonFields.normalizeKey(skill), SkillService.APPLIED);
            }
            destabilizer = sum / recipe.destabilizerSkills().size();
        }
        double sigma = 0.1 + destabilizer / 10;
        double result = Math.max(0.0, rng.nextGaussian() * sigma + mu);
        return effectiveQuality(crafter, result, now);
    }

    double effectiveQuality(Entity crafter, double quality, LocalDateTime now) {
        double wisdomPlusStrength = abilities.effective(crafter, Ability.WIS, now)
                + abilities.effective(crafter, Ability.STR, now) * 0.25;
        double distanceFromPerfect = Math.max(1 - quality, 0);
        return quality + wisdomPlusStrength / 25 * distanceFromPerfect * 0.25;
    }

    // ==========================================================
    // QUANTITY
    // ==========================================================
    int outputQuantity(GoodType recipe, Entity crafter, List<Entity> tools, Random rng, LocalDateTime now) {
        int quantity = recipe.fixedQuantity()
                ? (int) recipe.quantity()
                : rollQuantity(recipe, crafter, tools, rng, now);
        return Math.max(1, quantity);
    }

    int rollQuantity(GoodType recipe, Entity crafter, List<Entity> tools, Random rng, LocalDateTime now) {
        double mu = recipe.quantity();
        if (crafter == null) return Math.max(1, (int) Math.rint(mu));

        int relevant = abilities.effective(crafter, recipe.relevantAbilityScore(), now);
        double primary = skills.skillValue(crafter, JsonFields.normalizeKey(recipe.primaryAppliedSkill()), SkillService.APPLIED);
        double specific = skills.skillValue(crafter, recipe.key(), SkillService.SPECIFIC);
        int transferable = skills.matchingTransferableCount(recipe, crafter);
        double toolAvg = toolQualitiesAverage(recipe, tools, transferable);
        double secondaryAvg = secondarySkillsAverage(recipe, crafter, transferable);

        double sigma = mu * 0.05 * relevant * primary * specific * toolAvg * secondaryAvg;
        double result = Math.abs(rng.nextGaussian() * sigma) + mu;
        result = effectiveQuantity(crafter, result, now);
        return Math.max(1, (int) Math.rint(result));
    }

    double effectiveQuantity(Entity crafter, double quantity, LocalDateTime now) {
        double result = quantity;
        double strength = (abilities.effective(crafter, Ability.STR, now) - 10) / 10.0;
        result += Math.rint(quantity * strength);
        double dexterity = (abilities.effective(crafter, Ability.DEX, now) - 10) / 10.0;
        result += Math.rint(quantity * dexterity * 0.25);
        return Math.max(result, 1);
    }

    // Sub-type selection for raw materials is not modelled yet: the recipe itself is the output.
    GoodType rollRawMaterialType(GoodType recipe, Entity crafter) {
        return recipe;
    }

    // ==========================================================
    // INHERITANCE
    // ==========================================================

    /**
     * Pairs each required tag group with the first unused input satisfying it.
     */
    List<Entity> matchInputs(List<Entity> inputs, List<List<String>> required) {
        List<Entity> remaining = new ArrayList<>(inputs);
        List<Entity> matched = new ArrayList<>();
        for (List<String> group : required) {
            Entity found = null;
            for (Entity item : remaining) {
                if (items.itemMatches(item, group)) {
                    found = item;
                    break;
                }
            }
            matched.add(found);
            if (found != null) remaining.remove(found);
        }
        return matched;
    }

    List<String> carriedOverTags(GoodType recipe, List<Entity> inputs) {
        if (recipe.inputTagsCarryover().isEmpty() || inputs.isEmpty()) return List.of();
        List<Entity> matched = matchInputs(inputs, recipe.inputTagsRequired());
        TreeSet<String> carried = new TreeSet<>();
        for (int i = 0; i < recipe.inputTagsCarryover().size() && i < matched.size(); i++) {
            Entity item = matched.get(i);
            if (item == null) continue;
            List<String> tags = items.itemTags(item.getMetadata());
            for (String tag : recipe.inputTagsCarryover().get(i)) {
                if (tags.contains(tag)) carried.add(tag);
            }
        }
        return new ArrayList<>(carried);
    }

    Lineage lineage(GoodType output, List<Entity> inputs) {
        if (output.isRawMaterial()) {
            JsonArray own = new JsonArray();
            own.add(output.rawMaterialEntry());
            return new Lineage(own, 0);
        }
        JsonArray materials = new JsonArray();
        if (inputs.isEmpty()) return new Lineage(materials, 0);

        boolean refinedInput = false;
        int maxRefinedDepth = 0;
        for (Entity input : inputs) {
            JsonObject m = input.getMetadata();
            GoodType entry = goodTypes.findByGoodType(JsonFields.getString(m, "good_type"));
            boolean raw = entry != null && entry.isRawMaterial();

            JsonArray stored = JsonFields.getArray(m, "raw_materials");
            int depth = 0;
            if (stored != null && stored.size() > 0) {
                for (JsonElement el : stored) materials.add(el.deepCopy());
                depth = JsonFields.getInt(m, "raw_material_max_depth", 0);
            } else if (raw) {
                materials.add(entry.rawMaterialEntry());
            }
            if (!raw) {
                refinedInput = true;
                maxRefinedDepth = Math.max(maxRefinedDepth, depth);
            }
        }
        return new Lineage(materials, refinedInput ? maxRefinedDepth + 1 : 0);
    }
}
