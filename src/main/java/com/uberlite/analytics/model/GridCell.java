package com.uberlite.analytics.model;

/**
 * Discrete spatial bucket: row counts latitude bands from the south edge of the
 * bounding box, col counts longitude bands from the west edge.
 */
public record GridCell(int row, int col) {

    /** Every coordinate outside the configured bounding box lands here. */
    public static final GridCell OUT_OF_BOUNDS = new GridCell(-1, -1);

    public boolean isOutOfBounds() {
        return row < 0 || col < 0;
    }

    /**
     * Worker shard for this cell. Same XOR-fold idea as the H3 partitioners:
     * deterministic across JVMs for the same cell.
     */
    public int partition(int numPartitions) {
        long packed = ((long) row << 32) | (col & 0xffffffffL);
        int hash = (int) (packed ^ (packed >>> 32));
        return Math.floorMod(hash, numPartitions);
    }

    @Override
    public String toString() {
        return isOutOfBounds() ? "OOB" : row + ":" + col;
    }
}
