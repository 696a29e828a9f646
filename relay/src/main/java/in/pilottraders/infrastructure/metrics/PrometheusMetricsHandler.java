package in.pilottraders.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves a CollectorRegistry in Prometheus text format.
 *
 * Supports the scraper's {@code name[]} query parameter to restrict output to
 * selected metric families, e.g. {@code /metrics?name[]=relay_connections_active}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        Deque<String> requested = exchange.getQueryParameters().get("name[]");
        if (requested != null) {
            names.addAll(requested);
        }

        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage(), StandardCharsets.UTF_8);
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(writer.toString(), StandardCharsets.UTF_8);
    }
}
