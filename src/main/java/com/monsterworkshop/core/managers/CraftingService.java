package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GameTime;
import com.monsterworkshop.core.common.GridSize;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GoodType;
import com.monsterworkshop.core.domain.catalog.GoodTypeRegistry;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.entity.ShareRecord;
import com.monsterworkshop.core.domain.tick.EntityCreate;
import com.monsterworkshop.core.domain.tick.GameEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Workshop and gathering-spot state machine: idle, crafting, idle again once
 * the outputs are produced.
 */
final class CraftingService {

    static final int FALLBACK_DURATION = 60;
    static final String DEFAULT_WORKSHOP_TYPE = "general";

    private final GoodTypeRegistry goodTypes;
    private final ZoneGeometry geometry;
    private final ItemRules items;
    private final ContainerService containers;
    private final SkillService skills;
    private final ShareService shares;
    private final CraftingRolls rolls;

    CraftingService(GoodTypeRegistry goodTypes, ZoneGeometry geometry, ItemRules items, ContainerService containers,
                    SkillService skills, ShareService shares, CraftingRolls rolls) {
        this.goodTypes = goodTypes;
        this.geometry = geometry;
        this.items = items;
        this.containers = containers;
        this.skills = skills;
        this.shares = shares;
        this.rolls = rolls;
    }

    /**
     * Unmet requirements of a recipe against a workshop's current contents.
     */
    record Missing(List<List<String>> inputs, List<String> tools) {

        boolean none() {
            return inputs.isEmpty() && tools.isEmpty();
        }

        JsonArray inputsJson() {
            JsonArray arr = new JsonArray();
            for (List<String> group : inputs) arr.add(JsonFields.toJsonArray(group));
            return arr;
        }

        JsonArray toolsJson() {
            return JsonFields.toJsonArray(tools);
        }
    }

    // ==========================================================
    // REQUIREMENTS
    // ==========================================================
    Missing missingRequirements(TickContext ctx, Entity workshop, GoodType recipe) {
        ContainerService.Contents contents = containers.contents(ctx, workshop);
        boolean gathering = geometry.isGatheringSpot(workshop);

        List<List<String>> missingInputs = new ArrayList<>();
        if (!gathering) {
            for (List<String> group : recipe.inputTagsRequired()) {
                boolean found = false;
                for (Entity input : contents.inputs()) {
                    if (items.itemMatches(input, group)) {
                        found = true;
                        break;
                    }
                }
                if (!found) missingInputs.add(group);
            }
        }

        List<String> missingTools = new ArrayList<>();
        for (List<String> group : recipe.toolsRequiredTags()) {
            boolean found = false;
            for (Entity tool : contents.tools()) {
                if (items.toolMatches(tool, group)) {
                    found = true;
                    break;
                }
            }
            if (!found) missingTools.add(String.join(" & ", group));
        }
        return new Missing(missingInputs, missingTools);
    }

    private Entity monster(TickContext ctx, JsonObject workshopMeta) {
        Entity e = ctx.entity(JsonFields.getUuid(workshopMeta, "crafter_monster_id"));
        return e != null && e.is(EntityKind.MONSTER) ? e : null;
    }

    private void start(TickContext ctx, Entity workshop, GoodType recipe, Entity crafter) {
        JsonObject m = workshop.getMetadata();
        int duration = rolls.duration(recipe, crafter, ctx.now());
        m.addProperty("is_crafting", true);
        m.addProperty("crafting_started_tick", ctx.tickNumber());
        m.addProperty("crafting_duration", duration);
        JsonElement base = recipe.rawProductionTime();
        if (base != null && !base.isJsonNull()) m.add("base_duration", base.deepCopy());
        else m.addProperty("base_duration", duration);
        ctx.touch(workshop);
    }

    // ==========================================================
    // SELECT RECIPE
    // ==========================================================
    void selectRecipe(TickContext ctx, Entity workshop, String recipeId, Entity crafter, UUID playerId) {
        JsonObject m = workshop.getMetadata();
        boolean gathering = geometry.isGatheringSpot(workshop);

        String gatheringGood = JsonFields.getString(m, "gathering_good_type");
        if (gatheringGood != null) {
            if (recipeId != null && !JsonFields.normalizeKey(recipeId).equals(JsonFields.normalizeKey(gatheringGood))) {
                ctx.emit(GameEvent.error("Gathering spot is locked to " + gatheringGood, playerId));
                return;
            }
            recipeId = gatheringGood;
        }

        GoodType recipe = goodTypes.findRecipe(recipeId);
        if (recipe == null) {
            ctx.emit(GameEvent.error("Unknown recipe", playerId));
            return;
        }
        if (gathering && !recipe.isRawMaterial()) {
            ctx.emit(GameEvent.error("Gathering spots can only produce raw materials", playerId));
            return;
        }
        String workshopType = JsonFields.getString(m, "workshop_type", DEFAULT_WORKSHOP_TYPE);
        if (recipe.requiresWorkshopType() != null && !recipe.requiresWorkshopType().equals(workshopType)) {
            ctx.emit(GameEvent.error("Recipe requires " + recipe.requiresWorkshopType(), playerId));
            return;
        }

        Missing missing = missingRequirements(ctx, workshop, recipe);
        m.addProperty("selected_recipe_id", recipe.name());
        m.addProperty("selected_recipe_name", recipe.name());
        m.add("missing_inputs", missing.inputsJson());
        m.add("missing_tools", missing.toolsJson());
        if (crafter != null) m.addProperty("crafter_monster_id", crafter.getId().toString());
        ctx.touch(workshop);

        if (missing.none()) {
            start(ctx, workshop, recipe, crafter);
            m.addProperty("primary_applied_skill", recipe.primaryAppliedSkill());
            ctx.emit(GameEvent.of("crafting_started", playerId)
                    .with("workshop_id", workshop.getId())
                    .with("recipe_name", recipe.name()));
        } else {
            m.addProperty("is_crafting", false);
            m.remove("crafting_started_tick");
            ctx.emit(GameEvent.of("crafting_blocked", playerId)
                    .with("workshop_id", workshop.getId())
                    .with("missing_inputs", missing.inputsJson())
                    .with("missing_tools", missing.toolsJson()));
        }
    }

    // ==========================================================
    // PER-TICK PROCESSING
    // ==========================================================
    void process(TickContext ctx) {
        for (Entity workshop : ctx.snapshot()) {
            if (!ctx.isLive(workshop)) continue;
            EntityKind kind = workshop.kind();
            if (kind == null || !kind.isCraftingStation()) continue;
            processWorkshop(ctx, workshop);
        }
    }

    private void processWorkshop(TickContext ctx, Entity workshop) {
        JsonObject m = workshop.getMetadata();
        boolean gathering = geometry.isGatheringSpot(workshop);

        String recipeName = JsonFields.getString(m, "selected_recipe_name");
        if (recipeName == null) recipeName = JsonFields.getString(m, "selected_recipe_id");
        if (gathering && JsonFields.getString(m, "gathering_good_type") != null) {
            recipeName = JsonFields.getString(m, "gathering_good_type");
        }
        GoodType recipe = recipeName != null ? goodTypes.findRecipe(recipeName) : null;
        if (gathering && recipe != null) {
            if (!m.has("selected_recipe_name")) m.addProperty("selected_recipe_name", recipe.name());
            if (!m.has("selected_recipe_id")) m.addProperty("selected_recipe_id", recipe.name());
        }

        Missing missing = new Missing(List.of(), List.of());
        if (recipe != null) {
            missing = missingRequirements(ctx, workshop, recipe);
            JsonArray inputsJson = missing.inputsJson();
            JsonArray toolsJson = missing.toolsJson();
            if (!inputsJson.equals(m.get("missing_inputs"))) m.add("missing_inputs", inputsJson);
            if (!toolsJson.equals(m.get("missing_tools"))) m.add("missing_tools", toolsJson);
        }

        if (!JsonFields.isTruthy(m, "is_crafting")) {
            if (recipe != null && missing.none()) {
                start(ctx, workshop, recipe, monster(ctx, m));
            }
            return;
        }

        int duration = JsonFields.getInt(m, "crafting_duration", FALLBACK_DURATION);
        Integer started = JsonFields.getIntOrNull(m, "crafting_started_tick");
        if (started == null) {
            m.addProperty("is_crafting", false);
            ctx.touch(workshop);
            return;
        }
        if (ctx.tickNumber() - started < duration) return;

        if (recipe == null) {
            m.addProperty("is_crafting", false);
            ctx.touch(workshop);
            return;
        }
        complete(ctx, workshop, recipe, duration);
    }

    // ==========================================================
    // COMPLETION
    // ==========================================================
    private void complete(TickContext ctx, Entity workshop, GoodType recipe, int duration) {
        JsonObject m = workshop.getMetadata();
        ContainerService.Contents contents = containers.contents(ctx, workshop);
        List<Entity> inputs = geometry.isGatheringSpot(workshop) ? List.of() : contents.inputs();
        List<Entity> tools = contents.tools();

        Entity crafter = monster(ctx, m);
        SkillService.SkillGain gain = skills.applyGain(ctx, crafter, recipe, duration);

        int quantity = createOutputs(ctx, workshop, recipe, crafter, tools, inputs);
        List<String> depleted = consumeToolDurability(ctx, tools, recipe, quantity);
        List<String> consumed = consumeInputs(ctx, inputs);

        if (!depleted.isEmpty()) m.add("last_depleted_tools", JsonFields.toJsonArray(depleted));
        m.addProperty("is_crafting", false);
        m.addProperty("crafting_completed_tick", ctx.tickNumber());
        m.add("input_item_ids", new JsonArray());
        JsonArray survivors = new JsonArray();
        for (Entity tool : tools) {
            if (ctx.isLive(tool)) survivors.add(tool.getId().toString());
        }
        m.add("tool_item_ids", survivors);
        ctx.touch(workshop);

        GameEvent event = GameEvent.of("crafting_complete", null)
                .with("workshop_id", workshop.getId())
                .with("recipe_name", recipe.name())
                .with("consumed_inputs", JsonFields.toJsonArray(consumed));
        if (gain != null) {
            event.with("skill_trained", gain.primarySkill()).with("skill_gain", gain.primaryGain());
        }
        ctx.emit(event);
    }

    /**
     * Queues the output items and returns the rolled quantity (units that do not
     * fit inside the workshop are dropped but still count).
     */
    int createOutputs(TickContext ctx, Entity workshop, GoodType recipe, Entity crafter,
                      List<Entity> tools, List<Entity> inputs) {
        int[] anchor = geometry.outputAnchor(workshop);
        if (anchor[0] < 0 || anchor[1] < 0) return 0;

        int quantity = rolls.outputQuantity(recipe, crafter, tools, ctx.rng(), ctx.now());
        List<String> carried = rolls.carriedOverTags(recipe, inputs);

        List<String> toolCreators = new ArrayList<>();
        for (Entity tool : tools) {
            String creator = JsonFields.getString(tool.getMetadata(), "producer_player_id");
            if (creator == null) creator = JsonFields.getString(tool.getMetadata(), "creator_player_id");
            if (creator != null && !toolCreators.contains(creator)) toolCreators.add(creator);
        }

        Entity dispenser = geometry.findEntityAtKind(ctx, EntityKind.DISPENSER, anchor[0], anchor[1]);
        int capacity = dispenser != null ? containers.capacity(dispenser) : 0;
        int used = dispenser != null ? containers.usedUnits(ctx, dispenser) : 0;
        String storedType = dispenser != null ? ContainerService.storedType(dispenser) : "";

        for (int i = 0; i < quantity; i++) {
            GoodType output = recipe.isRawMaterial() ? rolls.rollRawMaterialType(recipe, crafter) : recipe;
            double quality = rolls.rollQuality(output, crafter, inputs, tools, ctx.rng(), ctx.now());
            GridSize size = output.size();
            int[] pos = geometry.outputPosition(workshop, size);
            if (pos == null) continue;

            CraftingRolls.Lineage lineage = rolls.lineage(output, inputs);
            int weight = items.calculateWeight(output, lineage.rawMaterials());
            int value = items.value(output, lineage.rawMaterials(), lineage.maxDepth(), quality, crafter);
            List<ShareRecord> outputShares = shares.buildOutputShares(recipe, crafter, tools, inputs, workshop);

            boolean store = false;
            String outputType = output.key();
            if (dispenser != null && (storedType.isEmpty() || outputType.isEmpty() || storedType.equals(outputType))) {
                if (used + 1 <= capacity) {
                    store = true;
                    used += 1;
                    if (storedType.isEmpty() && !outputType.isEmpty()) storedType = outputType;
                }
            }

            JsonObject meta = new JsonObject();
            meta.addProperty("kind", EntityKind.ITEM.key());
            meta.addProperty("name", output.name() != null ? output.name() : "Item");
            meta.addProperty("good_type", outputType);
            JsonArray sizeJson = new JsonArray();
            sizeJson.add(size.width());
            sizeJson.add(size.height());
            meta.add("size", sizeJson);
            meta.addProperty("quality", quality);
            meta.addProperty("weight", weight);
            meta.addProperty("value", value);
            meta.add("carried_over_tags", JsonFields.toJsonArray(carried));
            meta.add("raw_materials", lineage.rawMaterials());
            meta.addProperty("raw_material_max_depth", lineage.maxDepth());
            meta.addProperty("crafted_at", GameTime.format(ctx.now()));
            putNullable(meta, "producer_monster_id", crafter != null ? crafter.getId() : null);
            putNullable(meta, "producer_player_id", crafter != null ? crafter.getOwnerId() : null);
            meta.add("tool_creator_player_ids", JsonFields.toJsonArray(toolCreators));
            meta.add("shares", ShareService.serialize(outputShares));
            meta.addProperty("is_stored", store);
            putNullable(meta, "container_id", store ? dispenser.getId() : null);
            if (store) {
                JsonObject slot = new JsonObject();
                slot.addProperty("x", anchor[0]);
                slot.addProperty("y", anchor[1]);
                meta.add("stored_slot", slot);
            } else {
                meta.add("stored_slot", JsonNull.INSTANCE);
            }
            putNullable(meta, "last_transporter_monster_id", crafter != null ? crafter.getId() : null);
            putNullable(meta, "last_transporter_player_id", crafter != null ? crafter.getOwnerId() : null);

            ctx.create(new EntityCreate(pos[0], pos[1], size.width(), size.height(), null, meta));
        }

        if (dispenser != null && !storedType.isEmpty()) {
            dispenser.getMetadata().addProperty("stored_good_type", storedType);
            ctx.touch(dispenser);
        }
        return quantity;
    }

    private static void putNullable(JsonObject meta, String key, UUID value) {
        JsonFields.putUuid(meta, key, value);
    }

    /**
     * Each tool loses its recipe weight per unit produced; worn-out tools are removed.
     * Returns the names of removed tools.
     */
    List<String> consumeToolDurability(TickContext ctx, List<Entity> tools, GoodType recipe, int quantity) {
        List<String> depleted = new ArrayList<>();
        int units = Math.max(1, quantity);
        for (int i = 0; i < tools.size(); i++) {
            Entity tool = tools.get(i);
            JsonObject m = tool.getMetadata();
            int max = items.storedMaxDurability(m);
            int durability = items.durability(m, max);
            durability -= recipe.toolWeight(i) * units;
            if (durability <= 0) {
                String name = JsonFields.getString(m, "name");
                if (name == null) name = JsonFields.getString(m, "good_type", "tool");
                depleted.add(name);
                ctx.delete(tool);
            } else {
                m.addProperty("durability", durability);
                m.addProperty("max_durability", max);
                ctx.touch(tool);
            }
        }
        return depleted;
    }

    List<String> consumeInputs(TickContext ctx, List<Entity> inputs) {
        List<String> consumed = new ArrayList<>();
        for (Entity input : inputs) {
            String name = JsonFields.getString(input.getMetadata(), "name");
            if (name == null) name = JsonFields.getString(input.getMetadata(), "good_type", "item");
            consumed.add(name);
            ctx.delete(input);
        }
        return consumed;
    }
}
