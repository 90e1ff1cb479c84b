package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.GameTime;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.MonsterTypeRegistry;
import com.monsterworkshop.core.domain.entity.CommuneView;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.EntityKind;
import com.monsterworkshop.core.domain.entity.MonsterView;
import com.monsterworkshop.core.domain.entity.ShareRecord;
import com.monsterworkshop.core.domain.tick.EntityCreate;
import com.monsterworkshop.core.domain.tick.GameEvent;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Renown bookkeeping: communes, spawn pricing, delivery payouts and monster upkeep.
 */
final class EconomyService {

    static final int UPKEEP_CYCLE_DAYS = 28;
    static final double MAX_COST_MULTIPLIER = 3.0;

    private static final String[] OVERDUE_KEYS = {"upkeep_overdue", "upkeep_overdue_since", "upkeep_required"};

    private final MonsterTypeRegistry monsterTypes;
    private final ItemRules items;
    private final ShareService shares;

    EconomyService(MonsterTypeRegistry monsterTypes, ItemRules items, ShareService shares) {
        this.monsterTypes = monsterTypes;
        this.items = items;
        this.shares = shares;
    }

    /**
     * A player's commune, stored or created earlier in this tick.
     */
    record Commune(Entity entity, EntityCreate pending) {

        CommuneView view() {
            return new CommuneView(entity != null ? entity.getMetadata() : pending.metadata());
        }
    }

    // ==========================================================
    // COMMUNES
    // ==========================================================
    Commune findCommune(TickContext ctx, UUID ownerId) {
        if (ownerId == null) return null;
        for (Entity e : ctx.entities()) {
            if (e.is(EntityKind.COMMUNE) && ownerId.equals(e.getOwnerId())) return new Commune(e, null);
        }
        for (EntityCreate c : ctx.creates()) {
            if (c.kind() == EntityKind.COMMUNE && ownerId.equals(c.ownerId())) return new Commune(null, c);
        }
        return null;
    }

    /**
     * Existing commune, or a fresh one (starting renown) queued as a create.
     */
    Commune ensureCommune(TickContext ctx, UUID ownerId) {
        if (ownerId == null) return null;
        Commune found = findCommune(ctx, ownerId);
        if (found != null) return found;
        EntityCreate create = new EntityCreate(0, 0, 0, 0, ownerId, CommuneView.freshMetadata());
        ctx.create(create);
        return new Commune(null, create);
    }

    static double costMultiplier(int totalRenownSpent) {
        return Math.min(MAX_COST_MULTIPLIER, 1.0 + (totalRenownSpent / 1000.0) * 0.1);
    }

    static int adjustedCost(int baseCost, CommuneView commune) {
        return (int) (baseCost * costMultiplier(commune.totalRenownSpent()));
    }

    void credit(TickContext ctx, UUID ownerId, int amount) {
        if (amount <= 0 || ownerId == null) return;
        Commune commune = ensureCommune(ctx, ownerId);
        commune.view().credit(amount);
        if (commune.entity() != null) ctx.touch(commune.entity());
    }

    void spend(TickContext ctx, Commune commune, int amount) {
        commune.view().spend(amount);
        if (commune.entity() != null) ctx.touch(commune.entity());
    }

    // ==========================================================
    // DELIVERY
    // ==========================================================
    boolean accepts(Entity delivery, Entity item) {
        JsonObject m = delivery.getMetadata();
        List<String> accepted = JsonFields.getStringList(m, "dropoff_accepted_tags");
        if (accepted.isEmpty()) accepted = JsonFields.getStringList(m, "accepted_tags");
        if (accepted.isEmpty()) return true;

        Set<String> acceptedSet = new HashSet<>();
        for (String tag : accepted) acceptedSet.add(tag.toLowerCase());
        for (String tag : items.itemTags(item.getMetadata())) {
            if (acceptedSet.contains(tag)) return true;
        }
        return false;
    }

    /**
     * Pays out the item's value to its share holders and consumes it.
     * False when the delivery zone does not accept the item.
     */
    boolean deliver(TickContext ctx, Entity item, Entity delivery) {
        if (!accepts(delivery, item)) return false;

        JsonObject itemMeta = item.getMetadata();
        int value = items.storedOrComputedValue(itemMeta);

        List<ShareRecord> records = shares.shares(itemMeta);
        double total = 0;
        for (ShareRecord r : records) total += r.count();
        if (total <= 0) total = 1;

        JsonArray distribution = new JsonArray();
        for (ShareRecord r : records) {
            UUID playerId = JsonFields.parseUuid(r.playerId());
            if (playerId == null && r.monsterId() != null) {
                Entity monster = ctx.entity(JsonFields.parseUuid(r.monsterId()));
                if (monster != null && monster.is(EntityKind.MONSTER)) playerId = monster.getOwnerId();
            }
            if (playerId == null) continue;

            int gain = (int) (value * r.count() / total);
            if (gain <= 0) continue;
            credit(ctx, playerId, gain);

            JsonObject line = new JsonObject();
            line.addProperty("player_id", playerId.toString());
            line.addProperty("monster_id", r.monsterId());
            line.addProperty("shares", r.count());
            line.addProperty("renown", gain);
            line.addProperty("description", r.description());
            distribution.add(line);
        }

        JsonObject deliveryMeta = delivery.getMetadata();
        JsonArray delivered = JsonFields.getArray(deliveryMeta, "delivered_items");
        if (delivered == null) {
            delivered = new JsonArray();
            deliveryMeta.add("delivered_items", delivered);
        }
        JsonObject record = new JsonObject();
        record.addProperty("good_type", JsonFields.getString(itemMeta, "good_type"));
        record.addProperty("timestamp", GameTime.format(ctx.now()));
        record.addProperty("value", value);
        record.add("contributors", distribution.deepCopy());
        delivered.add(record);
        deliveryMeta.addProperty("delivered_count", delivered.size());
        deliveryMeta.add("last_share_distribution", distribution.deepCopy());
        ctx.touch(delivery);

        ctx.delete(item);
        ctx.emit(GameEvent.of("delivery", null)
                .with("entity_id", item.getId())
                .with("delivery_id", delivery.getId())
                .with("value", value)
                .with("contributors", distribution));
        return true;
    }

    // ==========================================================
    // UPKEEP
    // ==========================================================

    /**
     * Charges the monster's type cost once a full upkeep cycle has passed since the
     * last payment, or flags it overdue when the commune cannot pay.
     */
    void processUpkeep(TickContext ctx, Entity monster) {
        if (monster.getOwnerId() == null) return;
        JsonObject m = monster.getMetadata();

        LocalDateTime lastPaid = GameTime.parse(JsonFields.getString(m, "last_upkeep_paid"));
        if (lastPaid == null) lastPaid = GameTime.parse(JsonFields.getString(m, "created_at"));
        if (lastPaid == null) return;

        LocalDateTime now = ctx.now();
        if (GameTime.gameDaysBetween(lastPaid, now) < UPKEEP_CYCLE_DAYS) {
            clearOverdue(ctx, monster);
            return;
        }

        MonsterView view = MonsterView.of(monster);
        int cost = monsterTypes.getOrFallback(view.monsterType()).cost();
        if (cost <= 0) return;

        Commune commune = ensureCommune(ctx, monster.getOwnerId());
        CommuneView ledger = commune.view();
        if (ledger.renown() < cost) {
            if (!JsonFields.isTruthy(m, "upkeep_overdue")) {
                m.addProperty("upkeep_overdue", true);
                if (!JsonFields.isTruthy(m, "upkeep_overdue_since")) {
                    m.addProperty("upkeep_overdue_since", GameTime.format(now));
                }
            }
            m.addProperty("upkeep_required", cost);
            ctx.touch(monster);
            return;
        }

        ledger.debit(cost);
        if (commune.entity() != null) ctx.touch(commune.entity());
        m.addProperty("last_upkeep_paid", GameTime.format(now));
        for (String key : OVERDUE_KEYS) m.remove(key);
        ctx.touch(monster);
    }

    private static void clearOverdue(TickContext ctx, Entity monster) {
        boolean changed = false;
        for (String key : OVERDUE_KEYS) {
            if (monster.getMetadata().remove(key) != null) changed = true;
        }
        if (changed) ctx.touch(monster);
    }
}
