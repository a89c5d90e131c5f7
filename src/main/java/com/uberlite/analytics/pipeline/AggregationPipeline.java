package com.uberlite.analytics.pipeline;

import com.uberlite.analytics.emit.ResultEmitter;
import com.uberlite.analytics.metrics.PipelineMetrics;
import com.uberlite.analytics.model.NormalizedEvent;
import com.uberlite.analytics.model.OutputRow;
import com.uberlite.analytics.model.RawEvent;
import com.uberlite.analytics.normalize.EventNormalizer;
import com.uberlite.analytics.sink.RowSink;
import com.uberlite.analytics.transport.EventSource;
import com.uberlite.analytics.window.BatchAggregator;
import com.uberlite.analytics.window.Watermark;
import com.uberlite.analytics.window.WindowPhase;
import com.uberlite.analytics.window.WindowUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The driving loop: poll → normalize → aggregate → emit → write → commit.
 *
 * This loop is the only sequencing authority. It owns the current watermark
 * and hands it to the aggregator with every batch, keeping the value it gets back.
 * Offsets are committed only after every sink accepted the batch's rows, so a
 * crash replays the batch (at-least-once; rows are upserts and merges dedup by
 * event id).
 */
public class AggregationPipeline {

    private static final Logger log = LoggerFactory.getLogger(AggregationPipeline.class);
    private static final long PROGRESS_INTERVAL_MS = 10_000;

    private final EventSource     source;
    private final EventNormalizer normalizer;
    private final BatchAggregator aggregator;
    private final ResultEmitter   emitter;
    private final List<RowSink>   sinks;
    private final RetryPolicy     retry;
    private final PipelineMetrics metrics;
    private final Duration        batchInterval;
    private final long            allowedLatenessMs;
    private final Clock           clock;

    private Watermark watermark = Watermark.INITIAL;
    private volatile boolean shutdownRequested = false;

    private long lastProgressAt;
    private long eventsSinceProgress;

    public AggregationPipeline(EventSource source,
                               EventNormalizer normalizer,
                               BatchAggregator aggregator,
                               ResultEmitter emitter,
                               List<RowSink> sinks,
                               RetryPolicy retry,
                               PipelineMetrics metrics,
                               Duration batchInterval,
                               long allowedLatenessMs,
                               Clock clock) {
        this.source            = source;
        this.normalizer        = normalizer;
        this.aggregator        = aggregator;
        this.emitter           = emitter;
        this.sinks             = List.copyOf(sinks);
        this.retry             = retry;
        this.metrics           = metrics;
        this.batchInterval     = batchInterval;
        this.allowedLatenessMs = allowedLatenessMs;
        this.clock             = clock;
        this.lastProgressAt    = clock.millis();
    }

    /**
     * Runs until {@link #requestShutdown()} or a fatal error. Either way the
     * current watermark and every unfinalized window are logged and flushed once
     * as provisional rows before returning or rethrowing.
     */
    public void run() {
        log.info("Aggregation pipeline started: batchInterval={}ms sinks={}",
                 batchInterval.toMillis(), sinks.stream().map(RowSink::name).toList());
        try {
            while (!shutdownRequested) {
                runOnce();
                maybeLogProgress();
            }
        } catch (FatalPipelineException e) {
            throw halt(e);
        } catch (RuntimeException e) {
            throw halt(new FatalPipelineException("Unexpected failure in driving loop: " + e, e));
        }
        log.info("Shutdown requested, draining");
        flushOnExit();
    }

    /** Records the halt reason and flushes; the caller rethrows. */
    private FatalPipelineException halt(FatalPipelineException e) {
        metrics.setHaltReason(e.getMessage());
        log.error("Pipeline halted: {}", e.getMessage(), e);
        flushOnExit();
        return e;
    }

    /** Polls and processes exactly one batch. */
    public BatchReport runOnce() {
        List<RawEvent> raw = retry.execute("poll", () -> source.poll(batchInterval), metrics::recordTransportRetry);
        metrics.recordEventsIn(raw.size());

        var accepted = new ArrayList<NormalizedEvent>(raw.size());
        for (RawEvent event : raw) {
            var result = normalizer.normalize(event);
            if (result.isAccepted()) accepted.add(result.event());
        }

        var result = aggregator.processBatch(accepted, watermark);
        watermark = result.watermark();

        List<OutputRow> rows = emitter.formatAll(result.updates());
        write(rows);
        retry.run("commit", source::commit, metrics::recordTransportRetry);

        var stats = result.stats();
        metrics.recordBatch();
        metrics.recordDuplicates(stats.duplicates());
        metrics.recordLateDropped(stats.lateDropped());
        metrics.recordOutOfBoundsDropped(stats.outOfBoundsDropped());
        metrics.recordWindowsFinalized(stats.finalized());
        metrics.recordWindowsEvicted(stats.evicted());
        metrics.recordRowsEmitted(rows.size());
        metrics.setOpenWindows(result.openWindows());
        if (!watermark.isInitial()) metrics.setWatermark(watermark.timestamp());

        if (stats.lateDropped() > 0) {
            log.info("Dropped {} late event assignments at {}", stats.lateDropped(), watermark);
        }
        eventsSinceProgress += raw.size();
        return new BatchReport(raw.size(), accepted.size(), rows.size(), watermark, stats);
    }

    public void requestShutdown() {
        shutdownRequested = true;
    }

    public Watermark watermark() {
        return watermark;
    }

    private void write(List<OutputRow> rows) {
        if (rows.isEmpty()) return;
        for (RowSink sink : sinks) {
            retry.run("write " + sink.name(), () -> sink.write(rows), metrics::recordSinkRetry);
        }
    }

    /**
     * Single-attempt flush of provisional snapshots. Unfinalized windows do not
     * survive a restart; this is what downstream gets to see of them.
     */
    private void flushOnExit() {
        List<WindowUpdate> open;
        try {
            open = aggregator.openWindows();
        } catch (RuntimeException e) {
            log.error("Could not read open windows during shutdown flush", e);
            return;
        }
        long closing = open.stream()
            .filter(u -> WindowPhase.of(u.key(), watermark, allowedLatenessMs) == WindowPhase.CLOSING)
            .count();
        log.info("Final watermark {} with {} unfinalized windows ({} closing)", watermark, open.size(), closing);
        for (WindowUpdate u : open) {
            log.info("  {} {} events={} completed={}",
                     WindowPhase.of(u.key(), watermark, allowedLatenessMs), u.key().asKey(),
                     u.snapshot().eventCount(), u.snapshot().completedRideCount());
        }
        if (open.isEmpty()) return;

        List<OutputRow> rows;
        try {
            rows = emitter.formatAll(open);
        } catch (RuntimeException e) {
            log.error("Could not format open windows during shutdown flush", e);
            return;
        }
        metrics.recordRowsEmitted(rows.size());
        for (RowSink sink : sinks) {
            try {
                sink.write(rows);
            } catch (TransientIOException | RuntimeException e) {
                log.error("Shutdown flush to {} failed, {} provisional rows not delivered", sink.name(), rows.size(), e);
            }
        }
    }

    private void maybeLogProgress() {
        long now = clock.millis();
        long elapsed = now - lastProgressAt;
        if (elapsed < PROGRESS_INTERVAL_MS) return;
        log.info("[PIPELINE] {} events/sec | batches={} | rejected={} | late={} | open={} | watermark={} | lag={}ms",
                 eventsSinceProgress * 1000 / elapsed, metrics.getBatches(), metrics.getEventsRejected(),
                 metrics.getLateDropped(), metrics.getOpenWindows(), watermark, metrics.getWatermarkLagMs());
        lastProgressAt = now;
        eventsSinceProgress = 0;
    }
}
