package com.uberlite.analytics.config;

import com.uberlite.analytics.pipeline.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Resolved, validated configuration of one aggregation run.
 *
 * Resolution order (later wins):
 *   1. classpath {@code analytics.properties}
 *   2. optional external properties file
 *   3. JVM system properties with the same keys
 *
 * Every value is validated on construction; a bad value is a {@link ConfigException}
 * naming the offending key.
 */
public record AnalyticsConfig(
    BoundingBox   boundingBox,
    CellSize      cellSize,
    WindowSpec    window,
    EmissionMode  emissionMode,
    TimestampUnit timestampUnit,
    Duration      batchInterval,
    RetrySettings retry,
    int           maxOpenWindows,
    int           workers,
    boolean       dropOutOfBounds,
    boolean       dashboardProvisionalOnly,
    int           dashboardMaxRows,
    int           metricsPort,
    KafkaSettings kafka
) {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfig.class);

    public static final String RESOURCE_NAME = "analytics.properties";

    public AnalyticsConfig {
        Objects.requireNonNull(boundingBox, "boundingBox");
        Objects.requireNonNull(cellSize, "cellSize");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(emissionMode, "emissionMode");
        Objects.requireNonNull(timestampUnit, "timestampUnit");
        Objects.requireNonNull(retry, "retry");
        Objects.requireNonNull(kafka, "kafka");
        if (batchInterval == null || batchInterval.isZero() || batchInterval.isNegative()) {
            throw new ConfigException("analytics.batch-interval-ms", "must be positive, got " + batchInterval);
        }
        if (maxOpenWindows < 1) {
            throw new ConfigException("analytics.retention.max-open-windows", "must be at least 1, got " + maxOpenWindows);
        }
        if (workers < 1) {
            throw new ConfigException("analytics.workers", "must be at least 1, got " + workers);
        }
        if (dashboardMaxRows < 1) {
            throw new ConfigException("analytics.dashboard.max-rows", "must be at least 1, got " + dashboardMaxRows);
        }
        if (metricsPort < 0 || metricsPort > 65_535) {
            throw new ConfigException("analytics.metrics.port", "must be in 0..65535, got " + metricsPort);
        }
    }

    /** Defaults from the classpath resource, overridden by system properties. */
    public static AnalyticsConfig load() {
        return load(null);
    }

    /**
     * @param externalFile optional properties file layered between the classpath
     *                     defaults and the system properties; may be null
     */
    public static AnalyticsConfig load(Path externalFile) {
        var props = new Properties();
        try (InputStream in = AnalyticsConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            } else {
                log.warn("No {} on classpath, relying on explicit properties only", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }

        if (externalFile != null) {
            try (InputStream in = Files.newInputStream(externalFile)) {
                props.load(in);
                log.info("Loaded configuration overrides from {}", externalFile);
            } catch (IOException e) {
                throw new ConfigException("config-file", "cannot read " + externalFile, e);
            }
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("analytics.") || name.startsWith("kafka.")) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    public static AnalyticsConfig fromProperties(Properties p) {
        var bbox = new BoundingBox(
            doubleProp(p, "analytics.bounding-box.min-lat", 40.70),
            doubleProp(p, "analytics.bounding-box.max-lat", 40.85),
            doubleProp(p, "analytics.bounding-box.min-lon", -74.05),
            doubleProp(p, "analytics.bounding-box.max-lon", -73.90));
        var cellSize = new CellSize(
            doubleProp(p, "analytics.cell-size.lat-step", 0.01),
            doubleProp(p, "analytics.cell-size.lon-step", 0.01));

        long length = longProp(p, "analytics.window.length-ms", 60_000L);
        var window = new WindowSpec(
            length,
            longProp(p, "analytics.window.slide-ms", length),
            longProp(p, "analytics.window.allowed-lateness-ms", 10_000L));

        var retry = new RetrySettings(
            intProp(p, "analytics.retry.budget", 5),
            longProp(p, "analytics.retry.initial-backoff-ms", 100L),
            longProp(p, "analytics.retry.max-backoff-ms", 5_000L));

        var kafka = new KafkaSettings(
            p.getProperty("kafka.bootstrap-servers", "localhost:9092").trim(),
            p.getProperty("kafka.input-topic", "ride-events").trim(),
            p.getProperty("kafka.output-topic", "ride-analytics").trim(),
            p.getProperty("kafka.group-id", "ride-analytics-engine").trim(),
            intProp(p, "kafka.partitions", 12));

        return new AnalyticsConfig(
            bbox,
            cellSize,
            window,
            enumProp(p, "analytics.emission-mode", EmissionMode.class, EmissionMode.UPDATE),
            enumProp(p, "analytics.timestamp-unit", TimestampUnit.class, TimestampUnit.SECONDS),
            Duration.ofMillis(longProp(p, "analytics.batch-interval-ms", 1_000L)),
            retry,
            intProp(p, "analytics.retention.max-open-windows", 100_000),
            intProp(p, "analytics.workers", 1),
            boolProp(p, "analytics.drop-out-of-bounds", false),
            boolProp(p, "analytics.dashboard.provisional-only", false),
            intProp(p, "analytics.dashboard.max-rows", 10_000),
            intProp(p, "analytics.metrics.port", 8080),
            kafka);
    }

    /** One-line summary for the startup log. */
    public String describe() {
        return String.format(Locale.ROOT,
            "bbox=[%.4f,%.4f]x[%.4f,%.4f] cell=%.4fx%.4f window=%dms slide=%dms lateness=%dms mode=%s "
            + "batch=%dms retryBudget=%d maxOpenWindows=%d workers=%d input=%s output=%s",
            boundingBox.minLat(), boundingBox.maxLat(), boundingBox.minLon(), boundingBox.maxLon(),
            cellSize.latStep(), cellSize.lonStep(),
            window.lengthMs(), window.slideMs(), window.allowedLatenessMs(), emissionMode,
            batchInterval.toMillis(), retry.budget(), maxOpenWindows, workers,
            kafka.inputTopic(), kafka.outputTopic());
    }

    // ── property parsing ──────────────────────────────────────────────────────

    private static double doubleProp(Properties p, String key, double def) {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            double d = Double.parseDouble(v.trim());
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ConfigException(key, "must be a finite number, got '" + v + "'");
            }
            return d;
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "not a number: '" + v + "'", e);
        }
    }

    private static long longProp(Properties p, String key, long def) {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new ConfigException(key, "not an integer: '" + v + "'", e);
        }
    }

    private static int intProp(Properties p, String key, int def) {
        long value = longProp(p, key, def);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigException(key, "out of int range: " + value);
        }
        return (int) value;
    }

    private static boolean boolProp(Properties p, String key, boolean def) {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) return def;
        return switch (v.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new ConfigException(key, "not a boolean: '" + v + "'");
        };
    }

    private static <E extends Enum<E>> E enumProp(Properties p, String key, Class<E> type, E def) {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Enum.valueOf(type, v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(key, "unknown value '" + v + "'", e);
        }
    }
}
