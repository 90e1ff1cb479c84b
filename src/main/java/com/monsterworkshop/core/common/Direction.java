package com.monsterworkshop.core.common;

/**
 * The four cardinal steps a monster can take on the zone grid.
 * Screen coordinates: y grows downwards.
 */
public enum Direction {
    UP("up", 0, -1),
    DOWN("down", 0, 1),
    LEFT("left", -1, 0),
    RIGHT("right", 1, 0);

    private final String key;
    private final int dx, dy;

    Direction(String key, int dx, int dy) {
        this.key = key;
        this.dx = dx;
        this.dy = dy;
    }

    public String key() { return key; }
    public int dx() { return dx; }
    public int dy() { return dy; }

    public GridPosition toDelta() {
        return new GridPosition(dx, dy);
    }

    /**
     * Lookup by wire name ("up", "down", "left", "right"). Null when unknown.
     */
    public static Direction fromKey(String key) {
        if (key == null) return null;
        for (Direction d : values()) {
            if (d.key.equals(key)) return d;
        }
        return null;
    }
}
