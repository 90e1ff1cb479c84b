package com.monsterworkshop.core.common;

/**
 * Axis-aligned footprint: top-left cell plus width/height in cells.
 */
public record GridRect(int x, int y, int width, int height) {

    public static GridRect cell(int x, int y) {
        return new GridRect(x, y, 1, 1);
    }

    public boolean overlaps(GridRect other) {
        return x < other.x + other.width
                && x + width > other.x
                && y < other.y + other.height
                && y + height > other.y;
    }

    public boolean containsCell(int cx, int cy) {
        return cx >= x && cx < x + width && cy >= y && cy < y + height;
    }
}
