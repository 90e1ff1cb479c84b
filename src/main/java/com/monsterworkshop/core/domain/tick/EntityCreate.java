package com.monsterworkshop.core.domain.tick;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;
import com.monsterworkshop.core.domain.entity.EntityKind;

import java.util.UUID;

/**
 * A new entity emitted by a tick. The host assigns the id when applying it.
 * Metadata stays mutable until the tick returns (a commune created for a spawn
 * can still be credited by a later delivery in the same tick).
 */
public record EntityCreate(int x, int y, int width, int height, UUID ownerId, JsonObject metadata) {

    public EntityCreate {
        if (metadata == null) metadata = new JsonObject();
    }

    public EntityKind kind() {
        return EntityKind.fromKey(JsonFields.getString(metadata, "kind"));
    }
}
