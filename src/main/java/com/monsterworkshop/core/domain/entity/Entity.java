package com.monsterworkshop.core.domain.entity;

import com.google.gson.JsonObject;
import com.monsterworkshop.core.common.JsonFields;

import java.util.UUID;

/**
 * A positioned object on a zone grid.
 *
 * The engine only ever works on copies (see {@link #copy()}): position and
 * metadata are mutated in place while a tick runs, the diff is computed from
 * what was touched.
 */
public class Entity {

    private final UUID id;
    private final UUID zoneId;
    private final UUID ownerId;

    private int x;
    private int y;
    private int width;
    private int height;

    private JsonObject metadata;

    public Entity(UUID id, UUID zoneId, int x, int y, int width, int height, UUID ownerId, JsonObject metadata) {
        this.id = id;
        this.zoneId = zoneId;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.ownerId = ownerId;
        this.metadata = metadata != null ? metadata : new JsonObject();
    }

    public Entity(UUID id, int x, int y, int width, int height, UUID ownerId, JsonObject metadata) {
        this(id, null, x, y, width, height, ownerId, metadata);
    }

    public UUID getId() { return id; }
    public UUID getZoneId() { return zoneId; }
    public UUID getOwnerId() { return ownerId; }

    public int getX() { return x; }
    public int getY() { return y; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    public void setPosition(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public void setSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public JsonObject getMetadata() {
        return metadata;
    }

    public void setMetadata(JsonObject metadata) {
        this.metadata = metadata != null ? metadata : new JsonObject();
    }

    public EntityKind kind() {
        return EntityKind.fromKey(JsonFields.getString(metadata, "kind"));
    }

    public boolean is(EntityKind kind) {
        return kind() == kind;
    }

    public boolean isOwnedBy(UUID playerId) {
        return ownerId != null && ownerId.equals(playerId);
    }

    public Entity copy() {
        return new Entity(id, zoneId, x, y, width, height, ownerId, metadata.deepCopy());
    }

    @Override
    public String toString() {
        return "Entity{" + id + " " + JsonFields.getString(metadata, "kind") + " @" + x + "," + y + "}";
    }
}
