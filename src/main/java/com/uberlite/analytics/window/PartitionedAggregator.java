package com.uberlite.analytics.window;

import com.uberlite.analytics.config.EmissionMode;
import com.uberlite.analytics.config.WindowSpec;
import com.uberlite.analytics.model.NormalizedEvent;
import com.uberlite.analytics.pipeline.FatalPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits the arena into {@code workers} shards keyed by grid cell, so a window is
 * owned by exactly one shard and no state is shared between threads.
 *
 * Each batch runs in two barriers: every shard merges against the same input
 * watermark, then the global next watermark is derived from all shards' max event
 * time and every shard finalizes against it. Output is therefore identical to a
 * single {@link WindowedAggregator} fed the same batches, modulo the order of
 * provisional rows.
 */
public class PartitionedAggregator implements BatchAggregator {

    private static final Logger log = LoggerFactory.getLogger(PartitionedAggregator.class);

    private final List<WindowedAggregator> shards;
    private final ExecutorService pool;
    private final long allowedLatenessMs;

    public PartitionedAggregator(WindowSpec spec, EmissionMode mode, int maxOpenWindows,
                                 boolean dropOutOfBounds, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.allowedLatenessMs = spec.allowedLatenessMs();
        int perShard = (maxOpenWindows + workers - 1) / workers;
        var list = new ArrayList<WindowedAggregator>(workers);
        for (int i = 0; i < workers; i++) {
            list.add(new WindowedAggregator(spec, mode, perShard, dropOutOfBounds));
        }
        this.shards = List.copyOf(list);

        var counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(workers, r -> {
            var t = new Thread(r, "window-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Partitioned aggregator started: workers={} maxOpenWindowsPerShard={}", workers, perShard);
    }

    @Override
    public BatchResult processBatch(List<NormalizedEvent> events, Watermark watermark) {
        int n = shards.size();
        var perShard = new ArrayList<List<NormalizedEvent>>(n);
        for (int i = 0; i < n; i++) perShard.add(new ArrayList<>());
        for (NormalizedEvent event : events) {
            perShard.get(event.pickupCell().partition(n)).add(event);
        }

        var mergeTasks = new ArrayList<Callable<WindowedAggregator.MergeOutcome>>(n);
        for (int i = 0; i < n; i++) {
            var shard = shards.get(i);
            var slice = perShard.get(i);
            mergeTasks.add(() -> shard.merge(slice, watermark));
        }
        var outcomes = runAll(mergeTasks);

        long maxTs = outcomes.stream()
            .mapToLong(o -> o.stats().maxEventTimestamp())
            .max()
            .orElse(Long.MIN_VALUE);
        var next = watermark.advance(maxTs, allowedLatenessMs);

        var completeTasks = new ArrayList<Callable<BatchResult>>(n);
        for (int i = 0; i < n; i++) {
            var shard = shards.get(i);
            var outcome = outcomes.get(i);
            completeTasks.add(() -> shard.complete(outcome, next));
        }
        return BatchResult.combine(runAll(completeTasks), next);
    }

    @Override
    public BatchResult advanceWatermark(Watermark watermark) {
        var tasks = new ArrayList<Callable<BatchResult>>(shards.size());
        for (WindowedAggregator shard : shards) {
            tasks.add(() -> shard.advanceWatermark(watermark));
        }
        return BatchResult.combine(runAll(tasks), watermark);
    }

    @Override
    public List<WindowUpdate> openWindows() {
        var all = new ArrayList<WindowUpdate>();
        for (WindowedAggregator shard : shards) {
            all.addAll(shard.openWindows());
        }
        all.sort(Comparator.comparing(WindowUpdate::key));
        return all;
    }

    @Override
    public int openWindowCount() {
        return shards.stream().mapToInt(WindowedAggregator::openWindowCount).sum();
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <T> List<T> runAll(List<Callable<T>> tasks) {
        try {
            var futures = pool.invokeAll(tasks);
            var results = new ArrayList<T>(futures.size());
            for (Future<T> f : futures) {
                results.add(f.get());
            }
            return results;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new FatalPipelineException("Window worker failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FatalPipelineException("Interrupted while waiting for window workers", e);
        }
    }
}
