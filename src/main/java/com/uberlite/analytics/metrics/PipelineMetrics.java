package com.uberlite.analytics.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uberlite.analytics.model.RejectionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.InstanceAlreadyExistsException;
import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters for the aggregation pipeline. LongAdder for anything
 * incremented from worker threads; volatile gauges for values only the
 * driving loop writes.
 */
public class PipelineMetrics implements PipelineMetricsMBean {

    private static final Logger log = LoggerFactory.getLogger(PipelineMetrics.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    public static final String OBJECT_NAME = "com.uberlite.analytics:type=PipelineMetrics";

    private final Clock clock;

    private final LongAdder eventsIn           = new LongAdder();
    private final LongAdder eventsNormalized   = new LongAdder();
    private final LongAdder decodeFailures     = new LongAdder();
    private final LongAdder duplicates         = new LongAdder();
    private final LongAdder lateDropped        = new LongAdder();
    private final LongAdder outOfBoundsDropped = new LongAdder();
    private final LongAdder windowsFinalized   = new LongAdder();
    private final LongAdder windowsEvicted     = new LongAdder();
    private final LongAdder rowsEmitted        = new LongAdder();
    private final LongAdder transportRetries   = new LongAdder();
    private final LongAdder sinkRetries        = new LongAdder();
    private final LongAdder batches            = new LongAdder();
    private final Map<RejectionReason, LongAdder> rejected = new EnumMap<>(RejectionReason.class);

    private volatile long   watermark = Long.MIN_VALUE;
    private volatile long   openWindows = 0;
    private volatile String haltReason = null;

    public PipelineMetrics() {
        this(Clock.systemUTC());
    }

    public PipelineMetrics(Clock clock) {
        this.clock = clock;
        for (RejectionReason reason : RejectionReason.values()) {
            rejected.put(reason, new LongAdder());
        }
    }

    public void recordEventsIn(long n)            { eventsIn.add(n); }
    public void recordNormalized()                { eventsNormalized.increment(); }
    public void recordRejected(RejectionReason r) { rejected.get(r).increment(); }
    public void recordDecodeFailure()             { decodeFailures.increment(); }
    public void recordDuplicates(long n)          { duplicates.add(n); }
    public void recordLateDropped(long n)         { lateDropped.add(n); }
    public void recordOutOfBoundsDropped(long n)  { outOfBoundsDropped.add(n); }
    public void recordWindowsFinalized(long n)    { windowsFinalized.add(n); }
    public void recordWindowsEvicted(long n)      { windowsEvicted.add(n); }
    public void recordRowsEmitted(long n)         { rowsEmitted.add(n); }
    public void recordTransportRetry()            { transportRetries.increment(); }
    public void recordSinkRetry()                 { sinkRetries.increment(); }
    public void recordBatch()                     { batches.increment(); }

    public void setWatermark(long watermark)      { this.watermark = watermark; }
    public void setOpenWindows(long openWindows)  { this.openWindows = openWindows; }
    public void setHaltReason(String reason)      { this.haltReason = reason; }

    public long getRejected(RejectionReason reason) {
        return rejected.get(reason).sum();
    }

    @Override public long getEventsIn()           { return eventsIn.sum(); }
    @Override public long getEventsNormalized()   { return eventsNormalized.sum(); }
    @Override public long getDecodeFailures()     { return decodeFailures.sum(); }
    @Override public long getDuplicates()         { return duplicates.sum(); }
    @Override public long getLateDropped()        { return lateDropped.sum(); }
    @Override public long getOutOfBoundsDropped() { return outOfBoundsDropped.sum(); }
    @Override public long getWindowsFinalized()   { return windowsFinalized.sum(); }
    @Override public long getWindowsEvicted()     { return windowsEvicted.sum(); }
    @Override public long getRowsEmitted()        { return rowsEmitted.sum(); }
    @Override public long getTransportRetries()   { return transportRetries.sum(); }
    @Override public long getSinkRetries()        { return sinkRetries.sum(); }
    @Override public long getBatches()            { return batches.sum(); }
    @Override public long getOpenWindows()        { return openWindows; }
    @Override public long getWatermark()          { return watermark; }
    @Override public String getHaltReason()       { return haltReason; }

    @Override
    public long getEventsRejected() {
        return rejected.values().stream().mapToLong(LongAdder::sum).sum();
    }

    /** Wall clock minus watermark; -1 until the first watermark advance. */
    @Override
    public long getWatermarkLagMs() {
        long wm = watermark;
        if (wm == Long.MIN_VALUE) return -1L;
        return Math.max(0L, clock.millis() - wm);
    }

    public Map<String, Object> snapshot() {
        var rejectedByReason = new LinkedHashMap<String, Long>();
        rejected.forEach((reason, count) -> rejectedByReason.put(reason.name().toLowerCase(Locale.ROOT), count.sum()));

        var m = new LinkedHashMap<String, Object>();
        m.put("events_in", getEventsIn());
        m.put("events_normalized", getEventsNormalized());
        m.put("events_rejected", getEventsRejected());
        m.put("rejected_by_reason", rejectedByReason);
        m.put("decode_failures", getDecodeFailures());
        m.put("duplicates", getDuplicates());
        m.put("late_dropped", getLateDropped());
        m.put("out_of_bounds_dropped", getOutOfBoundsDropped());
        m.put("windows_finalized", getWindowsFinalized());
        m.put("windows_evicted", getWindowsEvicted());
        m.put("open_windows", getOpenWindows());
        m.put("rows_emitted", getRowsEmitted());
        m.put("transport_retries", getTransportRetries());
        m.put("sink_retries", getSinkRetries());
        m.put("batches", getBatches());
        m.put("watermark", watermark == Long.MIN_VALUE ? null : watermark);
        m.put("watermark_lag_ms", getWatermarkLagMs());
        m.put("halt_reason", haltReason);
        return m;
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render metrics", e);
        }
    }

    /** Exposes the counters over JMX. Safe to call twice; the second registration is skipped. */
    public void registerMBean() {
        try {
            MBeanServer server = ManagementFactory.getPlatformMBeanServer();
            server.registerMBean(this, new ObjectName(OBJECT_NAME));
            log.info("Registered JMX MBean {}", OBJECT_NAME);
        } catch (InstanceAlreadyExistsException e) {
            log.warn("JMX MBean {} already registered", OBJECT_NAME);
        } catch (JMException e) {
            throw new IllegalStateException("Failed to register JMX MBean " + OBJECT_NAME, e);
        }
    }
}
