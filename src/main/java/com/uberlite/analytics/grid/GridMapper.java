package com.uberlite.analytics.grid;

import com.uberlite.analytics.config.BoundingBox;
import com.uberlite.analytics.config.CellSize;
import com.uberlite.analytics.model.GridCell;

/**
 * Maps WGS84 coordinates onto a fixed lat/lon lattice over the service area.
 *
 * Cell (row, col) covers latitudes [minLat + row*latStep, minLat + (row+1)*latStep)
 * and the matching longitude band. Points on the north/east edge of the box fall in
 * the last row/col. Anything outside the box, or non-finite, maps to
 * {@link GridCell#OUT_OF_BOUNDS}.
 *
 * Immutable; one instance can be shared by every worker thread.
 */
public final class GridMapper {

    // Absorbs binary rounding so 40.71 lands in row 1 of a box starting at 40.70
    private static final double EPSILON = 1e-9;

    private final BoundingBox box;
    private final CellSize    size;
    private final int         rows;
    private final int         cols;

    public GridMapper(BoundingBox box, CellSize size) {
        this.box  = box;
        this.size = size;
        this.rows = Math.max(1, (int) Math.ceil((box.maxLat() - box.minLat()) / size.latStep() - EPSILON));
        this.cols = Math.max(1, (int) Math.ceil((box.maxLon() - box.minLon()) / size.lonStep() - EPSILON));
    }

    public GridCell cellOf(double lat, double lon) {
        if (!Double.isFinite(lat) || !Double.isFinite(lon) || !box.contains(lat, lon)) {
            return GridCell.OUT_OF_BOUNDS;
        }
        int row = (int) Math.floor((lat - box.minLat()) / size.latStep() + EPSILON);
        int col = (int) Math.floor((lon - box.minLon()) / size.lonStep() + EPSILON);
        return new GridCell(Math.min(row, rows - 1), Math.min(col, cols - 1));
    }

    /** Centre of a cell, clipped to the box. Null for the out-of-bounds sentinel. */
    public double[] centerOf(GridCell cell) {
        if (cell.isOutOfBounds()) return null;
        double lat = Math.min(box.minLat() + (cell.row() + 0.5) * size.latStep(), box.maxLat());
        double lon = Math.min(box.minLon() + (cell.col() + 0.5) * size.lonStep(), box.maxLon());
        return new double[]{lat, lon};
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }
}
