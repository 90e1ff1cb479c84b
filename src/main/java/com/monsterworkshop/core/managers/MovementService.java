package com.monsterworkshop.core.managers;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GridPosition;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.entity.MonsterView;
import com.monsterworkshop.core.domain.tick.GameEvent;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Single-cell monster moves and the push resolution that follows when an item
 * is in the way.
 */
final class MovementService {

    static final String ACTION_MOVE = "move";
    static final String ACTION_PUSH = "push";

    private final ZoneGeometry geometry;
    private final ItemRules items;
    private final MonsterAbilities abilities;
    private final ContainerService containers;
    private final WagonService wagons;
    private final EconomyService economy;

    MovementService(ZoneGeometry geometry, ItemRules items, MonsterAbilities abilities,
                    ContainerService containers, WagonService wagons, EconomyService economy) {
        this.geometry = geometry;
        this.items = items;
        this.abilities = abilities;
        this.containers = containers;
        this.wagons = wagons;
        this.economy = economy;
    }

    // ==========================================================
    // MOVE INTENT
    // ==========================================================
    void handleMove(TickContext ctx, Entity monster, GridPosition delta, UUID playerId) {
        if (delta.isZero()) return;

        int newX = monster.getX() + delta.x();
        int newY = monster.getY() + delta.y();
        if (!geometry.inBounds(ctx, monster, newX, newY)) return;
        if (geometry.terrainBlocked(ctx, newX, newY)) return;

        Entity blocker = geometry.findBlocker(ctx, monster, newX, newY);
        if (blocker == null) {
            step(ctx, monster, newX, newY);
            recordAction(ctx, monster, ACTION_MOVE, delta);
            return;
        }

        if (!blocker.is(EntityKind.ITEM)) return;
        if (JsonFields.isTruthy(blocker.getMetadata(), "is_stored")) return;

        if (isClaimedByOther(blocker, monster.getId())) {
            ctx.emit(GameEvent.message("blocked", "Item is already being pushed", playerId));
            return;
        }
        String refusal = pushRefusal(ctx, monster, blocker);
        if (refusal != null) {
            ctx.emit(GameEvent.message("blocked", refusal, playerId));
            return;
        }

        markPush(ctx, blocker, monster);
        boolean pushed = attemptPush(ctx, monster, blocker, delta);
        clearPush(ctx, blocker);
        if (!pushed) return;

        recordAction(ctx, monster, ACTION_PUSH, delta);
        ctx.emit(GameEvent.of("push", playerId).with("entity_id", blocker.getId()));
    }

    /**
     * Moves the monster and drags its hitched wagons behind it.
     */
    void step(TickContext ctx, Entity monster, int newX, int newY) {
        int oldX = monster.getX();
        int oldY = monster.getY();
        ctx.move(monster, newX, newY);
        wagons.dragChain(ctx, monster, oldX, oldY);
    }

    // ==========================================================
    // PUSH RULES
    // ==========================================================

    /**
     * Null when the monster is strong enough, otherwise the player-facing reason.
     */
    String pushRefusal(TickContext ctx, Entity monster, Entity item) {
        int weight = items.weight(item);
        int capacity = abilities.carryCapacity(monster, ctx.now());
        if (weight > capacity) {
            return "Item weight (" + weight + ") exceeds capacity (" + capacity + ")";
        }
        return null;
    }

    static boolean isClaimedByOther(Entity item, UUID pusherId) {
        String current = JsonFields.getString(item.getMetadata(), "being_pushed_by");
        return current != null && !current.equals(pusherId.toString());
    }

    static void markPush(TickContext ctx, Entity item, Entity pusher) {
        item.getMetadata().addProperty("being_pushed_by", pusher.getId().toString());
        ctx.activePushes().put(item.getId(), pusher.getId());
        ctx.touch(item);
    }

    static void clearPush(TickContext ctx, Entity item) {
        ctx.activePushes().remove(item.getId());
        item.getMetadata().remove("being_pushed_by");
    }

    /**
     * Drops every claim still held at the end of the tick.
     */
    static void clearActivePushes(TickContext ctx) {
        for (UUID id : Set.copyOf(ctx.activePushes().keySet())) {
            Entity item = ctx.entity(id);
            if (item != null) clearPush(ctx, item);
        }
        ctx.activePushes().clear();
    }

    /**
     * Resolves where the pushed entity ends up: a workshop slot, a dispenser, a
     * delivery zone, a wagon or plain ground. On success the mover follows one
     * cell. Nothing changes on failure.
     */
    boolean attemptPush(TickContext ctx, Entity mover, Entity pushed, GridPosition delta) {
        int newX = pushed.getX() + delta.x();
        int newY = pushed.getY() + delta.y();
        if (!geometry.inBounds(ctx, pushed, newX, newY)) return false;
        if (geometry.terrainBlocked(ctx, newX, newY)) return false;

        Entity sourceDispenser = geometry.findEntityAtKind(ctx, EntityKind.DISPENSER, pushed.getX(), pushed.getY());

        Entity workshop = geometry.findEntityAtKind(ctx, EntityKind.WORKSHOP, newX, newY);
        if (workshop == null) workshop = geometry.findEntityAtKind(ctx, EntityKind.GATHERING_SPOT, newX, newY);
        Entity dispenser = geometry.findEntityAtKind(ctx, EntityKind.DISPENSER, newX, newY);
        Entity delivery = geometry.findEntityAtKind(ctx, EntityKind.DELIVERY, newX, newY);
        Entity wagon = geometry.findEntityAtKind(ctx, EntityKind.WAGON, newX, newY);

        if (workshop != null) {
            if (!geometry.isInterior(workshop, newX, newY)) return false;
            if (blocked(ctx, pushed, newX, newY, mover, workshop)) return false;
            if (!containers.depositIntoWorkshop(ctx, pushed, workshop, newX, newY)) return false;
            ContainerService.markLastTransporter(ctx, pushed, mover);
        } else if (dispenser != null) {
            if (blocked(ctx, pushed, newX, newY, mover, dispenser)) return false;
            if (!containers.depositIntoDispenser(ctx, pushed, dispenser, newX, newY)) return false;
            ContainerService.markLastTransporter(ctx, pushed, mover);
            ctx.touchedDispensers().add(dispenser.getId());
        } else if (delivery != null) {
            if (blocked(ctx, pushed, newX, newY, mover, delivery)) return false;
            if (!economy.deliver(ctx, pushed, delivery)) return false;
        } else if (wagon != null && pushed.is(EntityKind.ITEM)) {
            if (blocked(ctx, pushed, newX, newY, mover, wagon)) return false;
            if (!wagons.loadItem(ctx, pushed, wagon, newX, newY, mover)) return false;
        } else {
            if (blocked(ctx, pushed, newX, newY, mover, null)) return false;
            if (pushed.is(EntityKind.WAGON)) {
                wagons.moveWithContents(ctx, pushed, newX, newY);
            } else {
                ctx.move(pushed, newX, newY);
                ContainerService.markLastTransporter(ctx, pushed, mover);
            }
        }

        step(ctx, mover, mover.getX() + delta.x(), mover.getY() + delta.y());
        if (sourceDispenser != null) ctx.touchedDispensers().add(sourceDispenser.getId());
        return true;
    }

    private boolean blocked(TickContext ctx, Entity pushed, int x, int y, Entity mover, Entity target) {
        Set<UUID> ignore = new HashSet<>();
        ignore.add(mover.getId());
        ignore.add(pushed.getId());
        if (target != null) ignore.add(target.getId());
        return geometry.findBlocker(ctx, pushed, x, y, ignore) != null;
    }

    // ==========================================================
    // RECORDING
    // ==========================================================
    static void recordAction(TickContext ctx, Entity monster, String action, GridPosition delta) {
        MonsterView view = MonsterView.of(monster);
        if (view == null || !view.isRecording()) return;
        JsonObject entry = new JsonObject();
        entry.addProperty("action", action);
        entry.addProperty("dx", delta.x());
        entry.addProperty("dy", delta.y());
        view.actions().add(entry);
        ctx.touch(monster);
    }
}
