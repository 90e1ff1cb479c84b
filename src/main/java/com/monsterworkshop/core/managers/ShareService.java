package com.monsterworkshop.core.managers;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.catalog.GoodType;
import com.monsterworkshop.core.domain.entity.Entity;
import com.monsterworkshop.core.domain.entity.ShareRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Revenue shares carried by items and how crafting composes them.
 */
final class ShareService {

    static final double WORKSHOP_SHARE_WEIGHT = 8.0;

    private record Contributor(String monsterId, String playerId) {}

    /**
     * Valid share records of an item (or workshop). Without any, the producer
     * (if known) holds a single share.
     */
    List<ShareRecord> shares(JsonObject metadata) {
        List<ShareRecord> out = new ArrayList<>();
        JsonArray arr = JsonFields.getArray(metadata, "shares");
        if (arr != null) {
            for (JsonElement el : arr) {
                if (!el.isJsonObject()) continue;
                ShareRecord r = ShareRecord.fromJson(el.getAsJsonObject());
                if (r != null) out.add(r);
            }
        }
        if (!out.isEmpty()) return out;

        String producerMonster = JsonFields.getString(metadata, "producer_monster_id");
        String producerPlayer = JsonFields.getString(metadata, "producer_player_id");
        if (producerMonster != null || producerPlayer != null) {
            String name = JsonFields.getString(metadata, "name");
            if (name == null) name = JsonFields.getString(metadata, "good_type", "Item");
            out.add(new ShareRecord(producerMonster, producerPlayer, 1.0, "Produced " + name));
        }
        return out;
    }

    /**
     * Adds to an existing line with the same contributor and description, or appends one.
     */
    static void append(List<ShareRecord> shares, String monsterId, String playerId, double count, String description) {
        if (count <= 0 || (monsterId == null && playerId == null)) return;
        for (int i = 0; i < shares.size(); i++) {
            ShareRecord s = shares.get(i);
            if (s.sameContributor(monsterId, playerId) && Objects.equals(s.description(), description)) {
                shares.set(i, s.plus(count));
                return;
            }
        }
        shares.add(new ShareRecord(monsterId, playerId, count, description));
    }

    /**
     * Shares of a freshly crafted item: inputs pass through, each tool adds its
     * recipe weight split among its contributors, the workshop adds a flat 8
     * split the same way, and the crafter adds the recipe's value-added shares.
     */
    List<ShareRecord> buildOutputShares(GoodType recipe, Entity crafter, List<Entity> tools,
                                        List<Entity> inputs, Entity workshop) {
        List<ShareRecord> out = new ArrayList<>();

        for (Entity input : inputs) {
            for (ShareRecord s : shares(input.getMetadata())) {
                append(out, s.monsterId(), s.playerId(), s.count(), s.description());
            }
        }

        for (int i = 0; i < tools.size(); i++) {
            JsonObject m = tools.get(i).getMetadata();
            String toolName = JsonFields.getString(m, "name");
            if (toolName == null) toolName = JsonFields.getString(m, "good_type", "tool");
            distribute(out, shares(m), recipe.toolWeight(i), "Contributed to " + toolName);
        }

        if (workshop != null) {
            JsonObject m = workshop.getMetadata();
            String name = JsonFields.getString(m, "name");
            if (name == null) name = JsonFields.getString(m, "workshop_type", "workshop");
            distribute(out, shares(m), WORKSHOP_SHARE_WEIGHT, "Contributed to " + name);
        }

        if (crafter != null && recipe.valueAddedShares() > 0) {
            append(out,
                    crafter.getId().toString(),
                    crafter.getOwnerId() != null ? crafter.getOwnerId().toString() : null,
                    recipe.valueAddedShares(),
                    "Produced " + (recipe.name() != null ? recipe.name() : "Item"));
        }
        return out;
    }

    private static void distribute(List<ShareRecord> out, List<ShareRecord> source, double weight, String description) {
        if (source.isEmpty()) return;
        Map<Contributor, Double> byContributor = new LinkedHashMap<>();
        for (ShareRecord s : source) {
            byContributor.merge(new Contributor(s.monsterId(), s.playerId()), s.count(), Double::sum);
        }
        double total = byContributor.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total <= 0) return;
        for (Map.Entry<Contributor, Double> e : byContributor.entrySet()) {
            append(out, e.getKey().monsterId(), e.getKey().playerId(), weight * e.getValue() / total, description);
        }
    }

    static JsonArray serialize(List<ShareRecord> shares) {
        JsonArray arr = new JsonArray();
        shares.forEach(s -> arr.add(s.serialize()));
        return arr;
    }
}
