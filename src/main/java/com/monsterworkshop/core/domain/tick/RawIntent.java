package com.monsterworkshop.core.domain.tick;

import com.google.gson.JsonObject;

import java.util.UUID;

/**
 * An intent exactly as received from the transport: player id plus the free-form data map.
 */
public record RawIntent(UUID playerId, JsonObject data) {

    public RawIntent {
        if (data == null) data = new JsonObject();
    }
}
