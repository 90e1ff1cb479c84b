package com.monsterworkshop.core.managers;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GameTime;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GoodType;
import com.monsterworkshop.core.domain.catalog.SkillCatalog;
import com.monsterworkshop.core.domain.entity.Ability;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.MonsterView;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Learned skill levels and how crafting changes them.
 *
 * Stored levels are raw totals; the effective value is the stored level minus
 * total_forgotten, never below zero. Learning integrates in steps of ten seconds
 * of crafting time.
 */
final class SkillService {

    static final String APPLIED = "applied";
    static final String SPECIFIC = "specific";

    static final int LEARNING_STEP_SECONDS = 10;
    static final double PRIMARY_RATE = 0.001;
    static final double SPECIFIC_RATE = 0.002;
    static final double SECONDARY_RATE = 0.0005;
    static final double FORGETTING_RATE = 0.0001;
    static final double DECAY_PER_GAME_DAY = 0.001;
    static final int DECAY_INTERVAL_TICKS = 60;

    private final SkillCatalog catalog;
    private final MonsterAbilities abilities;

    SkillService(SkillCatalog catalog, MonsterAbilities abilities) {
        this.catalog = catalog;
        this.abilities = abilities;
    }

    /**
     * Summary of one craft's learning, all values already applied to the monster.
     */
    record SkillGain(String primarySkill, double primaryGain, String specificSkill, double specificGain,
                     Map<String, Double> secondaryGains, double forgetting) {}

    // ==========================================================
    // READS
    // ==========================================================
    static double totalForgotten(Entity monster) {
        return JsonFields.getDouble(monster.getMetadata(), "total_forgotten", 0.0);
    }

    /**
     * Stored level clamped up to the forgetting floor; the floor itself when never learned.
     */
    static double totalLearned(double totalForgotten, JsonObject map, String key) {
        if (map == null || !map.has(key)) return totalForgotten;
        double value = JsonFields.asDouble(map.get(key), totalForgotten);
        return Math.max(value, totalForgotten);
    }

    double skillValue(Entity monster, String key, String kind) {
        if (monster == null || key == null || key.isEmpty()) return 0.0;
        double forgotten = totalForgotten(monster);
        JsonObject skills = JsonFields.getObject(monster.getMetadata(), "skills");
        JsonObject map = JsonFields.getObject(skills, kind);
        return Math.max(0.0, totalLearned(forgotten, map, key) - forgotten);
    }

    int matchingTransferableCount(GoodType recipe, Entity monster) {
        MonsterView view = MonsterView.of(monster);
        if (view == null) return 0;
        Set<String> wanted = new HashSet<>();
        for (String s : recipe.transferableSkills()) wanted.add(JsonFields.normalizeKey(s));
        Set<String> has = new HashSet<>();
        for (String s : view.transferableSkills()) has.add(JsonFields.normalizeKey(s));
        wanted.retainAll(has);
        return wanted.size();
    }

    // ==========================================================
    // LEARNING CURVES
    // ==========================================================
    private double learningFactor(Entity monster, LocalDateTime now) {
        int intel = abilities.effective(monster, Ability.INT, now);
        int con = abilities.effective(monster, Ability.CON, now);
        return (intel * 0.8 + con * 0.2) / 20;
    }

    double primaryLearning(Entity monster, double startingValue, int duration, String primarySkill, LocalDateTime now) {
        if (monster == null || duration <= 0) return 0.0;
        double factor = learningFactor(monster, now);

        Set<String> relevant = new HashSet<>(catalog.relevantFor(primarySkill));
        Set<String> owned = new HashSet<>();
        MonsterView view = MonsterView.of(monster);
        if (view != null) {
            for (String s : view.transferableSkills()) owned.add(JsonFields.normalizeKey(s));
        }
        relevant.retainAll(owned);
        double transferableFactor = 1 + relevant.size() / 4.0;

        double result = 0.0;
        for (int i = 0; i < duration / LEARNING_STEP_SECONDS; i++) {
            double remaining = 1 - startingValue - result;
            result += PRIMARY_RATE * remaining * factor * transferableFactor;
        }
        return result;
    }

    double specificLearning(Entity monster, double startingValue, int duration, double primaryValue, LocalDateTime now) {
        if (monster == null || duration <= 0) return 0.0;
        double factor = learningFactor(monster, now);
        double result = 0.0;
        for (int i = 0; i < duration / LEARNING_STEP_SECONDS; i++) {
            double remaining = 1 - startingValue - result;
            result += SPECIFIC_RATE * remaining * factor * primaryValue;
        }
        return result;
    }

    double secondaryLearning(Entity monster, double startingValue, int duration, LocalDateTime now) {
        if (monster == null || duration <= 0) return 0.0;
        double factor = learningFactor(monster, now);
        double result = 0.0;
        for (int i = 0; i < duration / LEARNING_STEP_SECONDS; i++) {
            double remaining = 1 - startingValue - result;
            result += SECONDARY_RATE * remaining * factor;
        }
        return result;
    }

    double forgetting(Entity monster, int duration, LocalDateTime now) {
        if (monster == null || duration <= 0) return 0.0;
        int wis = abilities.effective(monster, Ability.WIS, now);
        double factor = 1 - (wis / 20.0) * 0.25;
        double result = 0.0;
        for (int i = 0; i < duration / LEARNING_STEP_SECONDS; i++) {
            result += FORGETTING_RATE * factor;
        }
        return result;
    }

    // ==========================================================
    // APPLY
    // ==========================================================

    /**
     * Applies one completed craft to the crafter. Null when nothing changed
     * (no crafter, no duration, or a recipe without primary skill).
     */
    SkillGain applyGain(TickContext ctx, Entity monster, GoodType recipe, int duration) {
        MonsterView view = MonsterView.of(monster);
        if (view == null || duration <= 0) return null;

        String appliedKey = JsonFields.normalizeKey(recipe.primaryAppliedSkill());
        String specificKey = recipe.key();
        if (appliedKey.isEmpty() || specificKey.isEmpty()) return null;

        List<String> secondaryKeys = recipe.secondaryAppliedSkills().stream()
                .map(JsonFields::normalizeKey)
                .filter(k -> !k.isEmpty())
                .toList();

        JsonObject applied = view.appliedSkills();
        JsonObject specific = view.specificSkills();
        double forgotten = totalForgotten(monster);

        double appliedTotal = totalLearned(forgotten, applied, appliedKey);
        double specificTotal = totalLearned(forgotten, specific, specificKey);
        Map<String, Double> secondaryTotals = new LinkedHashMap<>();
        for (String key : secondaryKeys) {
            secondaryTotals.put(key, totalLearned(forgotten, applied, key));
        }

        double appliedValue = Math.max(0.0, appliedTotal - forgotten);
        double specificValue = Math.max(0.0, specificTotal - forgotten);

        LocalDateTime now = ctx.now();
        double specificGain = specificLearning(monster, specificValue, duration, appliedValue, now);
        double primaryGain = primaryLearning(monster, appliedValue, duration, recipe.primaryAppliedSkill(), now);
        Map<String, Double> secondaryGains = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : secondaryTotals.entrySet()) {
            double value = Math.max(0.0, e.getValue() - forgotten);
            secondaryGains.put(e.getKey(), secondaryLearning(monster, value, duration, now));
        }
        double forgettingGain = forgetting(monster, duration, now);

        applied.addProperty(appliedKey, appliedTotal + primaryGain);
        specific.addProperty(specificKey, specificTotal + specificGain);
        for (Map.Entry<String, Double> e : secondaryGains.entrySet()) {
            applied.addProperty(e.getKey(), secondaryTotals.get(e.getKey()) + e.getValue());
        }

        double newForgotten = forgotten + forgettingGain;
        raiseToFloor(applied, newForgotten);
        raiseToFloor(specific, newForgotten);
        view.setTotalForgotten(newForgotten);

        JsonObject lastUsed = JsonFields.getOrCreateObject(view.skills(), "last_used");
        String stamp = GameTime.format(now);
        lastUsed.addProperty(appliedKey, stamp);
        for (String key : secondaryGains.keySet()) lastUsed.addProperty(key, stamp);
        ctx.touch(monster);

        return new SkillGain(appliedKey, primaryGain, specificKey, specificGain, secondaryGains, forgettingGain);
    }

    // Stored levels never sink below the forgetting floor.
    private static void raiseToFloor(JsonObject map, double floor) {
        for (String key : new ArrayList<>(map.keySet())) {
            JsonElement el = map.get(key);
            double v = JsonFields.asDouble(el, floor);
            if (v < floor || !el.isJsonPrimitive()) {
                map.addProperty(key, Math.max(v, floor));
            }
        }
    }

    // ==========================================================
    // DECAY
    // ==========================================================
    static boolean isDecayTick(long tickNumber) {
        return tickNumber % DECAY_INTERVAL_TICKS == 0;
    }

    /**
     * Unused applied skills fade by 0.001 per game day since last use (or last decay),
     * slower for wise monsters. Levels stop at the forgetting floor.
     */
    void applyDecay(TickContext ctx, Entity monster) {
        MonsterView view = MonsterView.of(monster);
        if (view == null) return;
        JsonObject skills = JsonFields.getObject(monster.getMetadata(), "skills");
        JsonObject applied = JsonFields.getObject(skills, APPLIED);
        if (applied == null || applied.size() == 0) return;

        LocalDateTime now = ctx.now();
        JsonObject lastUsed = JsonFields.getObject(skills, "last_used");
        JsonObject lastDecay = JsonFields.getObject(skills, "last_decay_at");
        LocalDateTime created = view.createdAt() != null ? view.createdAt() : now;

        int wis = view.stat(Ability.WIS, MonsterAbilities.NEUTRAL_SCORE);
        double wisModifier = Math.max(0.1, Math.min(2.0, 1.0 - (wis - 10) * 0.1));
        double floor = totalForgotten(monster);

        boolean changed = false;
        for (String key : new ArrayList<>(applied.keySet())) {
            double level = JsonFields.asDouble(applied.get(key), 0.0);

            LocalDateTime start = GameTime.parse(JsonFields.getString(lastUsed, key));
            if (start == null) start = created;
            LocalDateTime decayedAt = GameTime.parse(JsonFields.getString(lastDecay, key));
            if (decayedAt != null && decayedAt.isAfter(start)) start = decayedAt;
            if (!start.isBefore(now)) continue;

            double amount = DECAY_PER_GAME_DAY * GameTime.gameDaysBetween(start, now) * wisModifier;
            double next = Math.rint(Math.max(floor, level - amount) * 1000) / 1000;
            if (next < floor) next = floor;
            if (next != level) {
                applied.addProperty(key, next);
                JsonFields.getOrCreateObject(skills, "last_decay_at").addProperty(key, GameTime.format(now));
                changed = true;
            }
        }
        if (changed) ctx.touch(monster);
    }
}
