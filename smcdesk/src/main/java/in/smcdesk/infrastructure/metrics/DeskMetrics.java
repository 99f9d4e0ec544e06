package in.smcdesk.infrastructure.metrics;

import java.time.Duration;

/**
 * Desk metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Signals generated and rejected
 * - Trades opened and closed
 * - Live price lookup outcomes and latency
 * - Open trade count
 */
public interface DeskMetrics {

    /**
     * Record a generated signal.
     *
     * @param direction BUY or SELL
     * @param tier      quality tier (A, B, C)
     */
    void recordSignalGenerated(String direction, String tier);

    /**
     * Record a signal request that produced no signal.
     *
     * @param reason error code of the rejection
     */
    void recordSignalRejected(String reason);

    void recordTradeOpened(String strategy);

    void recordTradeClosed(String reason);

    /**
     * Record a live price lookup.
     *
     * @param outcome LIVE, STALE_FALLBACK or UNAVAILABLE
     * @param latency time spent waiting on the price feed
     */
    void recordPriceLookup(String outcome, Duration latency);

    void updateOpenTrades(int count);

    /**
     * Metrics sink that drops everything.
     */
    DeskMetrics NOOP = new DeskMetrics() {
        @Override public void recordSignalGenerated(String direction, String tier) {}
        @Override public void recordSignalRejected(String reason) {}
        @Override public void recordTradeOpened(String strategy) {}
        @Override public void recordTradeClosed(String reason) {}
        @Override public void recordPriceLookup(String outcome, Duration latency) {}
        @Override public void updateOpenTrades(int count) {}
    };
}
