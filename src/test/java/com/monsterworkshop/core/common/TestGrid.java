package com.monsterworkshop.core.common;

import org.junit.Assert;
import org.junit.Test;

public class TestGrid {

    @Test
    public void directionsFollowScreenCoordinates() {
        Assert.assertEquals(new GridPosition(0, -1), Direction.UP.toDelta());
        Assert.assertEquals(new GridPosition(0, 1), Direction.DOWN.toDelta());
        Assert.assertEquals(new GridPosition(-1, 0), Direction.LEFT.toDelta());
        Assert.assertEquals(Direction.RIGHT, Direction.fromKey("right"));
        Assert.assertNull(Direction.fromKey("north"));
        Assert.assertNull(Direction.fromKey(null));
    }

    @Test
    public void rectOverlapExcludesTouchingEdges() {
        GridRect a = new GridRect(0, 0, 2, 1);
        Assert.assertTrue(a.overlaps(GridRect.cell(1, 0)));
        Assert.assertFalse(a.overlaps(GridRect.cell(2, 0)));
        Assert.assertFalse(a.overlaps(GridRect.cell(0, 1)));
        Assert.assertFalse(a.overlaps(new GridRect(5, 5, 0, 0)));
        Assert.assertTrue(a.containsCell(1, 0));
        Assert.assertFalse(a.containsCell(2, 0));
    }

    @Test
    public void sizes() {
        Assert.assertEquals(new GridSize(1, 1), GridSize.of(0, -3));
        Assert.assertTrue(new GridSize(1, 1).fitsWithin(GridSize.DEFAULT_ITEM));
        Assert.assertFalse(new GridSize(1, 2).fitsWithin(GridSize.DEFAULT_ITEM));
        Assert.assertEquals(new GridSize(2, 3), new GridSize(1, 3).max(GridSize.DEFAULT_ITEM));
        Assert.assertTrue(new GridPosition(0, 0).isZero());
        Assert.assertFalse(new GridPosition(0, 1).isZero());
    }
}
