package com.monsterworkshop.core.managers;

import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.intent.Intent;
import com.monsterworkshop.core.domain.tick.GameEvent;

import java.util.List;
import java.util.UUID;

/**
 * Routes parsed intents to the owning service, in arrival order.
 * Requests naming a monster the player does not own are dropped silently.
 */
final class IntentDispatcher {

    private final ZoneGeometry geometry;
    private final MovementService movement;
    private final MonsterService monsters;
    private final CraftingService crafting;
    private final WagonService wagons;

    IntentDispatcher(ZoneGeometry geometry, MovementService movement, MonsterService monsters,
                     CraftingService crafting, WagonService wagons) {
        this.geometry = geometry;
        this.movement = movement;
        this.monsters = monsters;
        this.crafting = crafting;
        this.wagons = wagons;
    }

    void dispatchAll(TickContext ctx, List<Intent> intents) {
        for (Intent intent : intents) dispatch(ctx, intent);
    }

    void dispatch(TickContext ctx, Intent intent) {
        UUID player = intent.playerId();

        if (intent instanceof Intent.Move move) {
            Entity monster = ownedMonster(ctx, player, move.entityId());
            if (monster != null) movement.handleMove(ctx, monster, move.delta(), player);
        } else if (intent instanceof Intent.SpawnMonster spawn) {
            monsters.spawn(ctx, spawn);
        } else if (intent instanceof Intent.OwnerDisconnect disconnect) {
            monsters.ownerDisconnect(ctx, disconnect.disconnectedPlayerId());
        } else if (intent instanceof Intent.RecordingStart r) {
            Entity monster = ownedMonster(ctx, player, r.monsterId());
            if (monster != null) monsters.startRecording(ctx, monster, player);
        } else if (intent instanceof Intent.RecordingStop r) {
            Entity monster = ownedMonster(ctx, player, r.monsterId());
            if (monster != null) monsters.stopRecording(ctx, monster, player);
        } else if (intent instanceof Intent.AutorepeatStart a) {
            Entity monster = ownedMonster(ctx, player, a.monsterId());
            if (monster != null) monsters.startAutorepeat(ctx, monster, player);
        } else if (intent instanceof Intent.AutorepeatStop a) {
            Entity monster = ownedMonster(ctx, player, a.monsterId());
            if (monster != null) monsters.stopAutorepeat(ctx, monster, player);
        } else if (intent instanceof Intent.SelectRecipe select) {
            selectRecipe(ctx, select);
        } else if (intent instanceof Intent.Interact interact) {
            interact(ctx, interact);
        } else if (intent instanceof Intent.HitchWagon h) {
            Entity monster = ownedMonster(ctx, player, h.monsterId());
            if (monster != null) wagons.hitch(ctx, monster, player);
        } else if (intent instanceof Intent.UnhitchWagon u) {
            Entity monster = ownedMonster(ctx, player, u.monsterId());
            if (monster != null) wagons.unhitch(ctx, monster, player);
        } else if (intent instanceof Intent.UnloadWagon u) {
            Entity monster = ownedMonster(ctx, player, u.monsterId());
            if (monster != null) wagons.unload(ctx, monster, player);
        } else if (intent instanceof Intent.Unsupported unsupported) {
            ctx.emit(GameEvent.message("warning", "Unsupported action: " + unsupported.action(), player));
        }
        // Intent.Ignored: no action field, nothing to do
    }

    /**
     * The entity when it is a live monster owned by the player, otherwise null.
     */
    static Entity ownedMonster(TickContext ctx, UUID playerId, UUID monsterId) {
        if (playerId == null || monsterId == null) return null;
        Entity e = ctx.entity(monsterId);
        if (e == null || !e.isOwnedBy(playerId) || !e.is(EntityKind.MONSTER)) return null;
        return e;
    }

    private void selectRecipe(TickContext ctx, Intent.SelectRecipe select) {
        if (select.workshopId() == null) return;
        Entity workshop = ctx.entity(select.workshopId());
        if (workshop == null || workshop.kind() == null || !workshop.kind().isCraftingStation()) return;
        Entity crafter = ownedMonster(ctx, select.playerId(), select.monsterId());
        crafting.selectRecipe(ctx, workshop, select.recipeId(), crafter, select.playerId());
    }

    private void interact(TickContext ctx, Intent.Interact interact) {
        Entity monster = ownedMonster(ctx, interact.playerId(), interact.monsterId());
        if (monster == null) return;

        Entity target = interact.targetId() != null ? ctx.entity(interact.targetId()) : null;
        if (target == null) target = geometry.findAdjacentEntity(ctx, monster);

        if (target == null) {
            ctx.emit(GameEvent.message("message", "Nothing to interact with", interact.playerId()));
            return;
        }
        ctx.emit(GameEvent.of("interact", interact.playerId()).with("entity_id", target.getId()));
    }
}
