package com.monsterworkshop.core.ports;

import com.google.gson.JsonObject;

import java.util.UUID;

/**
 * A zone as persisted by the hosting framework.
 */
public record ZoneRecord(UUID id, String name, int width, int height, JsonObject metadata) {

    public ZoneRecord {
        if (metadata == null) metadata = new JsonObject();
    }
}
