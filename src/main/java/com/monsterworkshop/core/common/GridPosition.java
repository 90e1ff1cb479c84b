package com.monsterworkshop.core.common;

/**
 * Immutable cell coordinate on a zone grid.
 * Also used as a delta (dx, dy) for single-step moves.
 */
public record GridPosition(int x, int y) {

    public boolean isZero() {
        return x == 0 && y == 0;
    }
}
