package com.monsterworkshop.core.domain.tick;

import com.google.gson.JsonObject;

import java.util.UUID;

/**
 * Change set for one existing entity. Null fields are unchanged; metadata,
 * when present, replaces the stored bag entirely.
 */
public record EntityUpdate(UUID id, Integer x, Integer y, Integer width, Integer height, JsonObject metadata) {

    public boolean hasPosition() {
        return x != null && y != null;
    }

    public boolean hasMetadata() {
        return metadata != null;
    }
}
