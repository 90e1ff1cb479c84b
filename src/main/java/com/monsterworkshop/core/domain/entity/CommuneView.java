package com.monsterworkshop.core.domain.entity;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;

/**
 * A player's renown ledger. Wraps a bare metadata object so it works for both
 * stored communes and communes created earlier in the same tick.
 */
public final class CommuneView {

    public static final int STARTING_RENOWN = 1000;

    private final JsonObject metadata;

    public CommuneView(JsonObject metadata) {
        this.metadata = metadata;
        if (!JsonFields.has(metadata, "renown")) metadata.addProperty("renown", STARTING_RENOWN);
        if (!JsonFields.has(metadata, "total_renown_spent")) metadata.addProperty("total_renown_spent", 0);
        metadata.addProperty("kind", EntityKind.COMMUNE.key());
    }

    public static JsonObject freshMetadata() {
        JsonObject m = new JsonObject();
        m.addProperty("kind", EntityKind.COMMUNE.key());
        m.addProperty("renown", STARTING_RENOWN);
        m.addProperty("total_renown_spent", 0);
        return m;
    }

    public int renown() {
        return JsonFields.getInt(metadata, "renown", STARTING_RENOWN);
    }

    public int totalRenownSpent() {
        return JsonFields.getInt(metadata, "total_renown_spent", 0);
    }

    public void debit(int amount) {
        metadata.addProperty("renown", renown() - amount);
    }

    public void spend(int amount) {
        debit(amount);
        metadata.addProperty("total_renown_spent", totalRenownSpent() + amount);
    }

    public void credit(int amount) {
        metadata.addProperty("renown", renown() + amount);
    }
}
