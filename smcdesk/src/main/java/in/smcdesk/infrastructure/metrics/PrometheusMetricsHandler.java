package in.smcdesk.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

/**
 * HTTP handler for the Prometheus /metrics endpoint (text format 0.0.4).
 *
 * Example output:
 * <pre>
 * # HELP desk_trades_closed_total Total number of trades closed
 * # TYPE desk_trades_closed_total counter
 * desk_trades_closed_total{reason="TAKE_PROFIT",} 3.0
 * desk_trades_closed_total{reason="STOP_LOSS",} 1.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        try {
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);

            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String metricsOutput = writer.toString();

            exchange.setStatusCode(200);
            exchange.getResponseSender().send(metricsOutput);

            log.debug("[PrometheusMetricsHandler] Served metrics ({} bytes)", metricsOutput.length());
        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
