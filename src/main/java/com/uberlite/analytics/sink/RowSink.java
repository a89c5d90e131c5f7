package com.uberlite.analytics.sink;

import com.uberlite.analytics.model.OutputRow;
import com.uberlite.analytics.pipeline.TransientIOException;

import java.util.List;

/**
 * Destination for emitted rows. Rows are upserts on their window key, so a
 * sink that sees the same row twice after a retry stays correct.
 */
public interface RowSink extends AutoCloseable {

    /** Writes every row or throws; partial writes are retried as a whole. */
    void write(List<OutputRow> rows) throws TransientIOException;

    String name();

    @Override
    default void close() {}
}
