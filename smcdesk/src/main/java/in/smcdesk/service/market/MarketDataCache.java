package in.smcdesk.service.market;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of the last known price per symbol.
 */
public final class MarketDataCache {
    private static final Logger log = LoggerFactory.getLogger(MarketDataCache.class);

    private final ConcurrentHashMap<String, TickData> latestTicks = new ConcurrentHashMap<>();

    /**
     * Store a price unless a newer one is already cached.
     *
     * @return true when the price is now the latest known for the symbol
     */
    public boolean updateTick(String symbol, BigDecimal lastPrice, Instant timestamp) {
        TickData tick = new TickData(lastPrice, timestamp);
        TickData latest = latestTicks.merge(symbol, tick,
            (old, neu) -> neu.timestamp().isBefore(old.timestamp()) ? old : neu);
        if (latest != tick) {
            log.debug("Ignored stale tick: {} = {} @ {} (cached @ {})", symbol, lastPrice, timestamp, latest.timestamp());
            return false;
        }
        log.debug("Updated tick cache: {} = {} @ {}", symbol, lastPrice, timestamp);
        return true;
    }

    public TickData getLatestTick(String symbol) {
        return latestTicks.get(symbol);
    }

    public Map<String, TickData> getAllTicks() {
        return Map.copyOf(latestTicks);
    }

    public void clear() {
        latestTicks.clear();
        log.info("Market data cache cleared");
    }

    public int size() {
        return latestTicks.size();
    }

    public record TickData(BigDecimal lastPrice, Instant timestamp) {
        public TickData {
            if (lastPrice == null || timestamp == null) {
                throw new IllegalArgumentException("lastPrice and timestamp cannot be null");
            }
        }
    }
}
