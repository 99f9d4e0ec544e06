package in.smcdesk.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.smcdesk.application.port.output.PriceFeed;
import in.smcdesk.application.port.output.TradeRepository;
import in.smcdesk.application.service.ActiveTradeIndex;
import in.smcdesk.application.service.PortfolioAggregator;
import in.smcdesk.application.service.PositionLedger;
import in.smcdesk.application.service.TradeCoordinator;
import in.smcdesk.config.AnalysisConfig;
import in.smcdesk.infrastructure.market.HttpPriceFeed;
import in.smcdesk.infrastructure.metrics.PrometheusDeskMetrics;
import in.smcdesk.infrastructure.metrics.PrometheusMetricsHandler;
import in.smcdesk.infrastructure.persistence.InMemoryTradeRepository;
import in.smcdesk.infrastructure.persistence.PostgresTradeRepository;
import in.smcdesk.migration.TradeSchemaMigration;
import in.smcdesk.security.InputValidator;
import in.smcdesk.service.admin.BotConfigService;
import in.smcdesk.service.market.CandleStore;
import in.smcdesk.service.market.LivePriceService;
import in.smcdesk.service.market.MarketDataCache;
import in.smcdesk.service.market.MarketDataService;
import in.smcdesk.service.risk.RiskEngine;
import in.smcdesk.service.signal.SignalFactory;
import in.smcdesk.service.signal.SignalService;
import in.smcdesk.service.signal.SignalStore;
import in.smcdesk.service.structure.StructureAnalyzer;
import in.smcdesk.transport.http.AdminConfigHandler;
import in.smcdesk.transport.http.ApiHandlers;
import in.smcdesk.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Entry point: wires the desk and serves the HTTP API on Undertow.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== SMC Desk Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);
        String configDir = Env.get("CONFIG_DIR", "./config");
        String store = Env.get("STORE", "memory");
        Duration priceTimeout = Duration.ofMillis(Env.getLong("PRICE_TIMEOUT_MS", 2000));
        Duration priceFreshness = Duration.ofSeconds(Env.getLong("PRICE_FRESHNESS_SECONDS", 60));
        BigDecimal initialCapital = Env.getDecimal("INITIAL_CAPITAL", new BigDecimal("10000"));
        String priceFeedUrl = Env.get("PRICE_FEED_URL", "");
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusDeskMetrics metrics = new PrometheusDeskMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Repository layer
        // ═══════════════════════════════════════════════════════════════
        TradeRepository tradeRepo = createTradeRepository(store);

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        BotConfigService botConfigService = new BotConfigService(configDir);
        AnalysisConfig analysisConfig = AnalysisConfig.fromEnv();
        if (!analysisConfig.isValid()) {
            log.warn("[CONFIG] Invalid analysis config {}, using defaults", analysisConfig);
            analysisConfig = AnalysisConfig.defaults();
        }

        // ═══════════════════════════════════════════════════════════════
        // Market data
        // ═══════════════════════════════════════════════════════════════
        MarketDataCache marketDataCache = new MarketDataCache();
        CandleStore candleStore = new CandleStore();
        PriceFeed priceFeed = priceFeedUrl.isBlank() ? null : new HttpPriceFeed(priceFeedUrl, priceTimeout);
        log.info("[PRICE FEED] {}", priceFeed == null ? "none (pushed ticks only)" : priceFeedUrl);
        LivePriceService priceService = new LivePriceService(
            priceFeed, marketDataCache, priceTimeout, priceFreshness, clock, metrics);

        // ═══════════════════════════════════════════════════════════════
        // Trade lifecycle
        // ═══════════════════════════════════════════════════════════════
        TradeCoordinator coordinator = new TradeCoordinator();
        ActiveTradeIndex activeIndex = new ActiveTradeIndex();
        PortfolioAggregator portfolio = new PortfolioAggregator(tradeRepo, initialCapital, clock);
        PositionLedger ledger = new PositionLedger(
            tradeRepo, priceService, coordinator, activeIndex, portfolio, botConfigService, metrics, clock);
        log.info("✓ Position ledger ready: {} open trades across {} symbols",
            activeIndex.size(), activeIndex.symbolCount());

        MarketDataService marketDataService = new MarketDataService(candleStore, marketDataCache, ledger);

        // ═══════════════════════════════════════════════════════════════
        // Signals
        // ═══════════════════════════════════════════════════════════════
        SignalFactory signalFactory = new SignalFactory(
            new StructureAnalyzer(analysisConfig), new RiskEngine(), clock);
        SignalService signalService = new SignalService(
            candleStore, signalFactory, new SignalStore(), ledger, botConfigService, metrics);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        ApiHandlers api = new ApiHandlers(
            signalService, ledger, portfolio, marketDataService, new InputValidator(), clock);
        AdminConfigHandler adminConfigHandler = new AdminConfigHandler(botConfigService);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(buildHandler(api, adminConfigHandler, metricsHandler))
            .build();
        server.start();
        log.info("✓ SMC Desk started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Shutting down SMC Desk");
            server.stop();
            coordinator.shutdown();
            priceService.shutdown();
        }, "shutdown"));
    }

    /**
     * Routes with CORS. Handlers run on worker threads since they block on
     * the trade coordinator and the price feed.
     */
    public static HttpHandler buildHandler(ApiHandlers api, AdminConfigHandler adminConfigHandler,
                                           HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/modes", api::modes)
            .post("/api/signals/generate", api::generateSignal)
            .get("/api/signals", api::listSignals)
            .post("/api/signals", api::createSignal)
            .post("/api/trades", api::confirmTrade)
            .get("/api/trades/open", api::openTrades)
            .get("/api/trades/closed", api::closedTrades)
            .post("/api/trades/{tradeId}/close", api::closeTrade)
            .get("/api/portfolio", api::portfolio)
            .get("/api/portfolio/equity-curve", api::equityCurve)
            .get("/api/portfolio/strategies", api::strategyStats)
            .post("/api/market/candles", api::ingestCandles)
            .post("/api/market/ticks", api::ingestTicks)
            .get("/api/bot/config", adminConfigHandler::getBotConfig)
            .post("/api/bot/config", adminConfigHandler::updateBotConfig)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "SMC Desk\n\n" +
                    "Signals:   POST /api/signals/generate, POST /api/signals, GET /api/signals\n" +
                    "Trades:    POST /api/trades, POST /api/trades/{tradeId}/close, GET /api/trades/open|closed\n" +
                    "Portfolio: GET /api/portfolio, /api/portfolio/equity-curve, /api/portfolio/strategies\n" +
                    "Market:    POST /api/market/candles, /api/market/ticks\n" +
                    "Config:    GET/POST /api/bot/config, GET /api/modes\n"
                );
            });

        HttpHandler blocking = new BlockingHandler(routes);

        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                blocking.handleRequest(exchange);
            }
        };
    }

    private static TradeRepository createTradeRepository(String store) {
        if ("postgres".equalsIgnoreCase(store)) {
            DataSource dataSource = createDataSource();
            new TradeSchemaMigration(dataSource).migrate();
            log.info("✓ Trade store: PostgreSQL");
            return new PostgresTradeRepository(dataSource);
        }
        log.info("✓ Trade store: in-memory");
        return new InMemoryTradeRepository();
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/smcdesk");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("smcdesk-hikari");

        log.info("[DB] url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }
}
