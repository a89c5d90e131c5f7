package com.uberlite.analytics;

import com.uberlite.analytics.config.AnalyticsConfig;
import com.uberlite.analytics.config.KafkaTopicAdmin;
import com.uberlite.analytics.emit.ResultEmitter;
import com.uberlite.analytics.grid.GridMapper;
import com.uberlite.analytics.metrics.MetricsHttpServer;
import com.uberlite.analytics.metrics.PipelineMetrics;
import com.uberlite.analytics.normalize.EventNormalizer;
import com.uberlite.analytics.pipeline.AggregationPipeline;
import com.uberlite.analytics.pipeline.ConfigException;
import com.uberlite.analytics.pipeline.FatalPipelineException;
import com.uberlite.analytics.pipeline.RetryPolicy;
import com.uberlite.analytics.sink.DashboardFeed;
import com.uberlite.analytics.sink.KafkaRowSink;
import com.uberlite.analytics.transport.KafkaEventSource;
import com.uberlite.analytics.window.BatchAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the ride analytics engine.
 *
 * Startup sequence:
 *   1. Load and validate configuration (exit 2 if invalid)
 *   2. Ensure input/output topics exist (AdminClient)
 *   3. Register JMX MBean, start MetricsHttpServer
 *   4. Wire source → normalizer → aggregator → emitter → sinks
 *   5. Run the driving loop on the main thread until shutdown or a fatal halt (exit 1)
 */
public class RideAnalyticsApplication {

    private static final Logger log = LoggerFactory.getLogger(RideAnalyticsApplication.class);

    static final int EXIT_FATAL  = 1;
    static final int EXIT_CONFIG = 2;

    public static void main(String[] args) throws Exception {
        AnalyticsConfig config;
        try {
            config = AnalyticsConfig.load(args.length > 0 ? Path.of(args[0]) : null);
        } catch (ConfigException e) {
            log.error("{}", e.getMessage());
            System.exit(EXIT_CONFIG);
            return;
        }
        log.info("=== Ride Analytics Engine ===");
        log.info("Config: {}", config.describe());

        var clock   = Clock.systemUTC();
        var metrics = new PipelineMetrics(clock);
        metrics.registerMBean();

        KafkaTopicAdmin.ensureTopics(config.kafka());

        var dashboard     = new DashboardFeed(config.dashboardProvisionalOnly(), config.dashboardMaxRows());
        var metricsServer = new MetricsHttpServer(metrics, dashboard, config.metricsPort());
        metricsServer.start();

        var grid       = new GridMapper(config.boundingBox(), config.cellSize());
        var normalizer = new EventNormalizer(grid, config.timestampUnit(), metrics);
        var emitter    = new ResultEmitter(grid, clock);
        var source     = KafkaEventSource.create(config.kafka(), metrics);
        var kafkaSink  = KafkaRowSink.create(config.kafka());
        var aggregator = BatchAggregator.forConfig(config);

        var pipeline = new AggregationPipeline(
            source, normalizer, aggregator, emitter,
            List.of(kafkaSink, dashboard),
            new RetryPolicy(config.retry()),
            metrics,
            config.batchInterval(),
            config.window().allowedLatenessMs(),
            clock);

        var drained = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            pipeline.requestShutdown();
            source.wakeup();
            try {
                if (!drained.await(30, TimeUnit.SECONDS)) {
                    log.warn("Pipeline did not drain within 30s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook"));

        int exitCode = 0;
        try {
            pipeline.run();
        } catch (FatalPipelineException e) {
            exitCode = EXIT_FATAL;
        } finally {
            aggregator.close();
            source.close();
            kafkaSink.close();
            metricsServer.stop();
            log.info("Ride analytics engine stopped");
            drained.countDown();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
