package in.smcdesk.service.market;

import in.smcdesk.application.port.output.PriceFeed;
import in.smcdesk.domain.error.PriceUnavailableException;
import in.smcdesk.infrastructure.metrics.DeskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Live price lookup with a timeout and a last-known-price fallback.
 *
 * With a feed: ask the feed and wait at most {@code timeout}. On success the
 * price is cached. On failure or timeout the cached price is used when it is
 * younger than {@code freshness}; otherwise PriceUnavailableException.
 *
 * Without a feed, prices come only from pushed ticks held in the cache.
 */
public final class LivePriceService {
    private static final Logger log = LoggerFactory.getLogger(LivePriceService.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_FRESHNESS = Duration.ofSeconds(60);

    private final PriceFeed feed;
    private final MarketDataCache cache;
    private final Duration timeout;
    private final Duration freshness;
    private final Clock clock;
    private final DeskMetrics metrics;
    private final ExecutorService executor;

    public LivePriceService(PriceFeed feed, MarketDataCache cache, Duration timeout, Duration freshness,
                            Clock clock, DeskMetrics metrics) {
        this.feed = feed;
        this.cache = cache;
        this.timeout = timeout;
        this.freshness = freshness;
        this.clock = clock;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread t = new Thread(runnable, "price-lookup");
            t.setDaemon(true);
            return t;
        });
    }

    public LivePriceService(PriceFeed feed, MarketDataCache cache) {
        this(feed, cache, DEFAULT_TIMEOUT, DEFAULT_FRESHNESS, Clock.systemUTC(), DeskMetrics.NOOP);
    }

    /**
     * @throws PriceUnavailableException when neither the feed nor a fresh cached price answers
     */
    public BigDecimal getPrice(String symbol) {
        Instant start = clock.instant();
        if (feed != null) {
            try {
                BigDecimal price = fetchWithTimeout(symbol);
                cache.updateTick(symbol, price, clock.instant());
                metrics.recordPriceLookup("LIVE", Duration.between(start, clock.instant()));
                return price;
            } catch (TimeoutException e) {
                log.warn("[LIVE PRICE] Feed timed out after {}ms for {}, trying cache", timeout.toMillis(), symbol);
            } catch (ExecutionException e) {
                log.warn("[LIVE PRICE] Feed failed for {}: {}, trying cache", symbol, e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PriceUnavailableException(symbol, "interrupted", e);
            }
        }

        Optional<BigDecimal> cached = getFreshCachedPrice(symbol);
        if (cached.isPresent()) {
            metrics.recordPriceLookup(feed != null ? "STALE_FALLBACK" : "CACHED",
                Duration.between(start, clock.instant()));
            return cached.get();
        }

        metrics.recordPriceLookup("UNAVAILABLE", Duration.between(start, clock.instant()));
        throw new PriceUnavailableException(symbol, feed != null
            ? "feed failed and no price within " + freshness.toSeconds() + "s"
            : "no price within " + freshness.toSeconds() + "s");
    }

    /**
     * Non-throwing variant for read-side views.
     */
    public Optional<BigDecimal> tryGetPrice(String symbol) {
        try {
            return Optional.of(getPrice(symbol));
        } catch (PriceUnavailableException e) {
            log.debug("[LIVE PRICE] No price for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Cached price if it is within the freshness window.
     */
    public Optional<BigDecimal> getFreshCachedPrice(String symbol) {
        MarketDataCache.TickData tick = cache.getLatestTick(symbol);
        if (tick == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(tick.timestamp(), clock.instant());
        if (age.compareTo(freshness) > 0) {
            log.debug("[LIVE PRICE] Cached price for {} is stale ({}s old)", symbol, age.toSeconds());
            return Optional.empty();
        }
        return Optional.of(tick.lastPrice());
    }

    private BigDecimal fetchWithTimeout(String symbol)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<BigDecimal> future = CompletableFuture.supplyAsync(() -> {
            try {
                BigDecimal price = feed.fetchPrice(symbol);
                if (price == null || price.signum() <= 0) {
                    throw new IllegalStateException("invalid price " + price);
                }
                return price;
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
