package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GridPosition;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.entity.MonsterView;
import com.monsterworkshop.core.domain.intent.IntentParser;
import com.monsterworkshop.core.domain.tick.GameEvent;


/**
 * Replays recorded action logs, one step per monster per tick.
 * Any step that cannot be carried out stops playback.
 */
final class AutorepeatService {

    private final ZoneGeometry geometry;
    private final MovementService movement;

    AutorepeatService(ZoneGeometry geometry, MovementService movement) {
        this.geometry = geometry;
        this.movement = movement;
    }

    void process(TickContext ctx) {
        for (Entity monster : ctx.snapshot()) {
            if (!monster.is(EntityKind.MONSTER) || !ctx.isLive(monster)) continue;
            MonsterView view = MonsterView.of(monster);
            if (!view.isPlaying()) continue;

            JsonArray actions = JsonFields.getArray(view.currentTask(), "actions");
            if (actions == null || actions.size() == 0) {
                stop(ctx, monster);
                continue;
            }

            int index = view.playIndex();
            if (index < 0 || index >= actions.size()) index = 0;

            JsonElement raw = actions.get(index);
            JsonObject action = raw.isJsonObject() ? raw.getAsJsonObject() : new JsonObject();
            GridPosition delta = IntentParser.parseDelta(action);

            if (!delta.isZero() && !replay(ctx, monster, delta, JsonFields.getString(action, "action"))) {
                stop(ctx, monster);
                continue;
            }

            view.currentTask().addProperty("play_index", (index + 1) % actions.size());
            ctx.touch(monster);
            ctx.emit(GameEvent.of("autorepeat_step", monster.getOwnerId()));
        }
    }

    private boolean replay(TickContext ctx, Entity monster, GridPosition delta, String actionType) {
        int newX = monster.getX() + delta.x();
        int newY = monster.getY() + delta.y();
        if (!geometry.inBounds(ctx, monster, newX, newY)) return false;
        if (geometry.terrainBlocked(ctx, newX, newY)) return false;

        Entity blocker = geometry.findBlocker(ctx, monster, newX, newY);
        if (!MovementService.ACTION_PUSH.equals(actionType)) {
            if (blocker != null) return false;
            movement.step(ctx, monster, newX, newY);
            return true;
        }

        if (blocker == null || !blocker.is(EntityKind.ITEM)) return false;
        if (JsonFields.isTruthy(blocker.getMetadata(), "is_stored")) return false;
        if (MovementService.isClaimedByOther(blocker, monster.getId())) return false;
        if (movement.pushRefusal(ctx, monster, blocker) != null) return false;

        MovementService.markPush(ctx, blocker, monster);
        boolean pushed = movement.attemptPush(ctx, monster, blocker, delta);
        MovementService.clearPush(ctx, blocker);
        return pushed;
    }

    static void stop(TickContext ctx, Entity monster) {
        MonsterView.of(monster).currentTask().addProperty("is_playing", false);
        ctx.touch(monster);
    }
}
