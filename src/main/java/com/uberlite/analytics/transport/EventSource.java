package com.uberlite.analytics.transport;

import com.uberlite.analytics.model.RawEvent;
import com.uberlite.analytics.pipeline.TransientIOException;

import java.time.Duration;
import java.util.List;

/**
 * Pull-based source of decoded ride events. Delivery is at-least-once: a batch
 * that was polled but not committed may be seen again after a restart.
 */
public interface EventSource extends AutoCloseable {

    /** Next batch, possibly empty once {@code timeout} elapses. */
    List<RawEvent> poll(Duration timeout) throws TransientIOException;

    /** Acknowledges everything returned by previous polls. */
    void commit() throws TransientIOException;

    @Override
    void close();
}
