package com.uberlite.analytics.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.uberlite.analytics.sink.DashboardFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Minimal HTTP endpoint for operators and the live dashboard.
 * GET /metrics                   → JSON counters from PipelineMetrics
 * GET /health                    → 200 OK, or 503 with the halt reason once halted
 * GET /rows[?provisional=true]   → latest rows held by the DashboardFeed
 */
public class MetricsHttpServer {

    private static final Logger log = LoggerFactory.getLogger(MetricsHttpServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PipelineMetrics metrics;
    private final DashboardFeed   dashboard;
    private final int             port;
    private HttpServer      server;
    private ExecutorService executor;

    public MetricsHttpServer(PipelineMetrics metrics, DashboardFeed dashboard, int port) {
        this.metrics   = metrics;
        this.dashboard = dashboard;
        this.port      = port;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", exchange -> {
            if (!"GET".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            respond(exchange, 200, "application/json", metrics.toJson());
        });

        server.createContext("/health", exchange -> {
            String halt = metrics.getHaltReason();
            if (halt == null) {
                respond(exchange, 200, "text/plain; charset=UTF-8", "OK");
            } else {
                respond(exchange, 503, "text/plain; charset=UTF-8", "HALTED: " + halt);
            }
        });

        server.createContext("/rows", exchange -> {
            if (!"GET".equals(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            String query = exchange.getRequestURI().getQuery();
            boolean provisional = query != null && query.contains("provisional=true");
            String body;
            try {
                body = MAPPER.writeValueAsString(dashboard.rows(provisional));
            } catch (JsonProcessingException e) {
                log.error("Failed to render dashboard rows", e);
                exchange.sendResponseHeaders(500, -1);
                return;
            }
            respond(exchange, 200, "application/json", body);
        });

        // Small fixed pool: dashboard polling must not compete with the window workers
        executor = Executors.newFixedThreadPool(2, r -> {
            var t = new Thread(r, "metrics-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        log.info("Metrics server started on http://localhost:{}/metrics", port());
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public void stop() {
        if (server != null) server.stop(0);
        if (executor != null) executor.shutdownNow();
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String text) throws IOException {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (var os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
