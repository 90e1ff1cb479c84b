package com.monsterworkshop.core.domain.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Discriminator stored under the "kind" metadata key.
 */
public enum EntityKind {
    WORLD_MARKER("world_marker"),
    COMMUNE("commune"),
    MONSTER("monster"),
    ITEM("item"),
    WORKSHOP("workshop"),
    GATHERING_SPOT("gathering_spot"),
    DISPENSER("dispenser"),
    WAGON("wagon"),
    TERRAIN_BLOCK("terrain_block"),
    SIGNPOST("signpost"),
    DELIVERY("delivery");

    private static final Set<EntityKind> BLOCKING = EnumSet.of(
            MONSTER, ITEM, WORKSHOP, GATHERING_SPOT, DISPENSER, WAGON, TERRAIN_BLOCK, DELIVERY
    );

    private final String key;

    EntityKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean blocksByDefault() {
        return BLOCKING.contains(this);
    }

    public boolean isCraftingStation() {
        return this == WORKSHOP || this == GATHERING_SPOT;
    }

    public static EntityKind fromKey(String key) {
        if (key == null) return null;
        for (EntityKind k : values()) {
            if (k.key.equals(key)) return k;
        }
        return null;
    }
}
