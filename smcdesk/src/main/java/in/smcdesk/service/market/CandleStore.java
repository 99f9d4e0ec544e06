package in.smcdesk.service.market;

import in.smcdesk.application.port.output.CandleProvider;
import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.data.CandleSeries;
import in.smcdesk.domain.data.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory candle history fed by the market-data ingestion endpoint.
 *
 * Bars are keyed by open time; a bar with an existing open time replaces the
 * stored one. At most {@code maxBars} most recent bars are kept per series.
 */
public final class CandleStore implements CandleProvider {
    private static final Logger log = LoggerFactory.getLogger(CandleStore.class);

    public static final int DEFAULT_MAX_BARS = 1000;

    private final Map<String, NavigableMap<Instant, Candle>> series = new ConcurrentHashMap<>();
    private final int maxBars;

    public CandleStore(int maxBars) {
        if (maxBars <= 0) {
            throw new IllegalArgumentException("maxBars must be positive: " + maxBars);
        }
        this.maxBars = maxBars;
    }

    public CandleStore() {
        this(DEFAULT_MAX_BARS);
    }

    /**
     * Merge bars into the stored series.
     *
     * @return number of bars stored after the merge
     */
    public int append(String symbol, Timeframe timeframe, List<Candle> candles) {
        NavigableMap<Instant, Candle> bars = series.computeIfAbsent(key(symbol, timeframe), k -> new TreeMap<>());
        synchronized (bars) {
            for (Candle c : candles) {
                bars.put(c.openTime(), c);
            }
            while (bars.size() > maxBars) {
                bars.pollFirstEntry();
            }
            log.debug("Stored {} candles for {} {} (total {})", candles.size(), symbol, timeframe.label(), bars.size());
            return bars.size();
        }
    }

    @Override
    public CandleSeries getCandles(String symbol, Timeframe timeframe) {
        NavigableMap<Instant, Candle> bars = series.get(key(symbol, timeframe));
        if (bars == null) {
            return new CandleSeries(symbol, timeframe, List.of());
        }
        synchronized (bars) {
            return new CandleSeries(symbol, timeframe, new ArrayList<>(bars.values()));
        }
    }

    private static String key(String symbol, Timeframe timeframe) {
        return symbol + "|" + timeframe.label();
    }
}
