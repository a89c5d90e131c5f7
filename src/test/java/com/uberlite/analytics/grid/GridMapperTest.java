package com.uberlite.analytics.grid;

import com.uberlite.analytics.config.BoundingBox;
import com.uberlite.analytics.config.CellSize;
import com.uberlite.analytics.model.GridCell;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridMapperTest {

    private final GridMapper grid = new GridMapper(
        new BoundingBox(40.70, 40.85, -74.05, -73.90),
        new CellSize(0.01, 0.01));

    @Test
    void lattice_hasFifteenByFifteenCells() {
        assertEquals(15, grid.rows());
        assertEquals(15, grid.cols());
    }

    @Test
    void southWestCorner_isCellZeroZero() {
        assertEquals(new GridCell(0, 0), grid.cellOf(40.70, -74.05));
    }

    @Test
    void cellBoundaries_areHalfOpen() {
        assertEquals(new GridCell(0, 0), grid.cellOf(40.7099, -74.0401));
        assertEquals(new GridCell(1, 1), grid.cellOf(40.71, -74.04));
    }

    @Test
    void northEastEdge_fallsInLastCell() {
        assertEquals(new GridCell(14, 14), grid.cellOf(40.85, -73.90));
    }

    @Test
    void cellOf_isDeterministic() {
        var first = grid.cellOf(40.7580, -73.9855);
        for (int i = 0; i < 100; i++) {
            assertEquals(first, grid.cellOf(40.7580, -73.9855));
        }
    }

    @Test
    void outsideBox_mapsToSentinel() {
        assertEquals(GridCell.OUT_OF_BOUNDS, grid.cellOf(41.0, -73.95));
        assertEquals(GridCell.OUT_OF_BOUNDS, grid.cellOf(40.75, -74.10));
        assertEquals(GridCell.OUT_OF_BOUNDS, grid.cellOf(-90.0, 180.0));
        assertTrue(grid.cellOf(40.6999, -74.0).isOutOfBounds());
    }

    @Test
    void nonFiniteCoordinates_mapToSentinel() {
        assertEquals(GridCell.OUT_OF_BOUNDS, grid.cellOf(Double.NaN, -73.95));
        assertEquals(GridCell.OUT_OF_BOUNDS, grid.cellOf(40.75, Double.POSITIVE_INFINITY));
    }

    @Test
    void centerOf_returnsMidpointAndNullForSentinel() {
        double[] center = grid.centerOf(new GridCell(0, 0));
        assertEquals(40.705, center[0], 1e-9);
        assertEquals(-74.045, center[1], 1e-9);
        assertNull(grid.centerOf(GridCell.OUT_OF_BOUNDS));
    }

    @Test
    void partition_isStableAndInRange() {
        var cell = grid.cellOf(40.71, -74.00);
        int p = cell.partition(12);
        assertTrue(p >= 0 && p < 12);
        assertEquals(p, cell.partition(12));
        assertTrue(GridCell.OUT_OF_BOUNDS.partition(4) >= 0);
    }
}
