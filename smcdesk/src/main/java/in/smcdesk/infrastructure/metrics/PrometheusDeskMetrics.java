package in.smcdesk.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of DeskMetrics.
 *
 * Key Metrics:
 * - desk_signals_total{direction, tier}
 * - desk_signal_rejections_total{reason}
 * - desk_trades_opened_total{strategy}
 * - desk_trades_closed_total{reason}
 * - desk_price_lookups_total{outcome}
 * - desk_price_lookup_seconds
 * - desk_open_trades
 */
public class PrometheusDeskMetrics implements DeskMetrics {

    private final CollectorRegistry registry;

    private final Counter signalCounter;
    private final Counter signalRejectionCounter;
    private final Counter tradesOpenedCounter;
    private final Counter tradesClosedCounter;
    private final Counter priceLookupCounter;
    private final Histogram priceLookupLatency;
    private final Gauge openTrades;

    public PrometheusDeskMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusDeskMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signalCounter = Counter.build()
            .name("desk_signals_total")
            .help("Total number of signals generated")
            .labelNames("direction", "tier")
            .register(registry);

        this.signalRejectionCounter = Counter.build()
            .name("desk_signal_rejections_total")
            .help("Signal requests that produced no signal")
            .labelNames("reason")
            .register(registry);

        this.tradesOpenedCounter = Counter.build()
            .name("desk_trades_opened_total")
            .help("Total number of trades opened")
            .labelNames("strategy")
            .register(registry);

        this.tradesClosedCounter = Counter.build()
            .name("desk_trades_closed_total")
            .help("Total number of trades closed")
            .labelNames("reason")
            .register(registry);

        this.priceLookupCounter = Counter.build()
            .name("desk_price_lookups_total")
            .help("Live price lookups by outcome")
            .labelNames("outcome")
            .register(registry);

        this.priceLookupLatency = Histogram.build()
            .name("desk_price_lookup_seconds")
            .help("Live price lookup latency in seconds")
            .buckets(0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.openTrades = Gauge.build()
            .name("desk_open_trades")
            .help("Number of open trades")
            .register(registry);
    }

    @Override
    public void recordSignalGenerated(String direction, String tier) {
        signalCounter.labels(direction, tier).inc();
    }

    @Override
    public void recordSignalRejected(String reason) {
        signalRejectionCounter.labels(reason).inc();
    }

    @Override
    public void recordTradeOpened(String strategy) {
        tradesOpenedCounter.labels(strategy).inc();
    }

    @Override
    public void recordTradeClosed(String reason) {
        tradesClosedCounter.labels(reason).inc();
    }

    @Override
    public void recordPriceLookup(String outcome, Duration latency) {
        priceLookupCounter.labels(outcome).inc();
        priceLookupLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void updateOpenTrades(int count) {
        openTrades.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
