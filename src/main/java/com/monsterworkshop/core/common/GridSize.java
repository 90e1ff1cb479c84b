package com.monsterworkshop.core.common;

public record GridSize(int width, int height) {

    // Items without an explicit size occupy two cells side by side.
    public static final GridSize DEFAULT_ITEM = new GridSize(2, 1);

    public static GridSize of(int width, int height) {
        return new GridSize(Math.max(1, width), Math.max(1, height));
    }

    public boolean fitsWithin(GridSize max) {
        return width <= max.width && height <= max.height;
    }

    public GridSize max(GridSize other) {
        return new GridSize(Math.max(width, other.width), Math.max(height, other.height));
    }
}
