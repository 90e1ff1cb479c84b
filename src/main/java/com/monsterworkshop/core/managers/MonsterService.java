package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GameTime;
import com.monsterworkshop.core.common.GridPosition;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.MonsterType;
import com.monsterworkshop.core.domain.catalog.MonsterTypeRegistry;
import com.monsterworkshop.core.domain.catalog.SkillCatalog;
import com.monsterworkshop.core.domain.entity.CommuneView;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.entity.MonsterView;
import com.monsterworkshop.core.domain.intent.Intent;
import com.monsterworkshop.core.domain.tick.EntityCreate;
import com.monsterworkshop.core.domain.tick.GameEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;

/**
 * Monster lifecycle requests: spawning, going offline, and the recording /
 * autorepeat switches.
 */
final class MonsterService {

    static final int REQUIRED_TRANSFERABLE_SKILLS = 3;

    private final MonsterTypeRegistry monsterTypes;
    private final SkillCatalog skillCatalog;
    private final EconomyService economy;
    private final ZoneBootstrapService bootstrap;

    MonsterService(MonsterTypeRegistry monsterTypes, SkillCatalog skillCatalog,
                   EconomyService economy, ZoneBootstrapService bootstrap) {
        this.monsterTypes = monsterTypes;
        this.skillCatalog = skillCatalog;
        this.economy = economy;
        this.bootstrap = bootstrap;
    }

    // ==========================================================
    // SPAWN
    // ==========================================================
    void spawn(TickContext ctx, Intent.SpawnMonster intent) {
        UUID playerId = intent.playerId();
        MonsterType type = monsterTypes.find(intent.monsterType());
        if (type == null) {
            ctx.emit(GameEvent.error("Unknown monster type: " + intent.monsterType(), playerId));
            return;
        }

        List<String> requested = intent.transferableSkills();
        if (requested == null) {
            ctx.emit(GameEvent.error("Transferable skills must be a list", playerId));
            return;
        }
        if (requested.size() != REQUIRED_TRANSFERABLE_SKILLS) {
            ctx.emit(GameEvent.error("Must select exactly 3 transferable skills", playerId));
            return;
        }

        List<String> chosen = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String skill : requested) {
            String key = JsonFields.normalizeKey(skill);
            if (!key.isEmpty() && skillCatalog.isTransferable(key)) chosen.add(key);
            else invalid.add(skill == null ? "" : skill);
        }
        if (!invalid.isEmpty()) {
            ctx.emit(GameEvent.error("Invalid transferable skills: " + String.join(", ", invalid), playerId));
            return;
        }
        if (new HashSet<>(chosen).size() != chosen.size()) {
            ctx.emit(GameEvent.error("Duplicate transferable skills selected", playerId));
            return;
        }

        EconomyService.Commune commune = economy.ensureCommune(ctx, playerId);
        CommuneView ledger = commune.view();
        int cost = EconomyService.adjustedCost(type.cost(), ledger);
        if (ledger.renown() < cost) {
            ctx.emit(GameEvent.error("Not enough renown (" + ledger.renown() + " < " + cost + ")", playerId));
            return;
        }
        economy.spend(ctx, commune, cost);

        GridPosition spawn = bootstrap.chooseSpawnPoint(ctx);
        JsonObject meta = monsterMetadata(intent.name(), type, chosen, ctx);
        ctx.create(new EntityCreate(spawn.x(), spawn.y(), 1, 1, playerId, meta));
        ctx.emit(GameEvent.message("spawned", "Spawned " + intent.name(), playerId));
    }

    private static JsonObject monsterMetadata(String name, MonsterType type, List<String> transferable, TickContext ctx) {
        JsonObject meta = new JsonObject();
        meta.addProperty("kind", EntityKind.MONSTER.key());
        meta.addProperty("name", name);
        meta.addProperty("monster_type", type.id());
        meta.add("stats", type.stats().serialize());
        meta.addProperty("body_cap", type.bodyCap());
        meta.addProperty("mind_cap", type.mindCap());

        JsonObject equipment = new JsonObject();
        equipment.add("body", new JsonArray());
        equipment.add("mind", new JsonArray());
        meta.add("equipment", equipment);

        JsonObject skills = new JsonObject();
        skills.add("transferable", JsonFields.toJsonArray(transferable));
        skills.add(SkillService.APPLIED, new JsonObject());
        skills.add(SkillService.SPECIFIC, new JsonObject());
        skills.add("last_used", new JsonObject());
        skills.add("last_decay_at", new JsonObject());
        meta.add("skills", skills);
        meta.addProperty("total_forgotten", 0.0);

        JsonObject task = new JsonObject();
        task.addProperty("is_recording", false);
        task.addProperty("is_playing", false);
        task.add("actions", new JsonArray());
        task.addProperty("play_index", 0);
        meta.add("current_task", task);

        meta.addProperty("online", true);
        meta.addProperty("created_at", GameTime.format(ctx.now()));
        return meta;
    }

    // ==========================================================
    // DISCONNECT
    // ==========================================================
    void ownerDisconnect(TickContext ctx, UUID disconnectedPlayer) {
        if (disconnectedPlayer == null) return;
        for (Entity e : ctx.entities()) {
            if (e.is(EntityKind.MONSTER) && disconnectedPlayer.equals(e.getOwnerId())) {
                e.getMetadata().addProperty("online", false);
                ctx.touch(e);
            }
        }
        ctx.emit(GameEvent.message("disconnect", "Player disconnected", disconnectedPlayer));
    }

    // ==========================================================
    // RECORDING / AUTOREPEAT
    // ==========================================================
    void startRecording(TickContext ctx, Entity monster, UUID playerId) {
        JsonObject task = MonsterView.of(monster).currentTask();
        task.addProperty("is_recording", true);
        task.addProperty("is_playing", false);
        task.add("actions", new JsonArray());
        ctx.touch(monster);
        ctx.emit(GameEvent.of("recording_started", playerId));
    }

    void stopRecording(TickContext ctx, Entity monster, UUID playerId) {
        MonsterView.of(monster).currentTask().addProperty("is_recording", false);
        ctx.touch(monster);
        ctx.emit(GameEvent.of("recording_stopped", playerId));
    }

    void startAutorepeat(TickContext ctx, Entity monster, UUID playerId) {
        JsonObject task = MonsterView.of(monster).currentTask();
        JsonArray actions = JsonFields.getArray(task, "actions");
        if (actions == null || actions.size() == 0) {
            ctx.emit(GameEvent.error("No recorded actions to replay", playerId));
            return;
        }
        task.addProperty("is_playing", true);
        task.addProperty("is_recording", false);
        task.addProperty("play_index", 0);
        ctx.touch(monster);
        ctx.emit(GameEvent.of("autorepeat_started", playerId));
    }

    void stopAutorepeat(TickContext ctx, Entity monster, UUID playerId) {
        AutorepeatService.stop(ctx, monster);
        ctx.emit(GameEvent.of("autorepeat_stopped", playerId));
    }
}
