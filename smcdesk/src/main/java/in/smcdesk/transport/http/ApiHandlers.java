package in.smcdesk.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.smcdesk.application.service.PortfolioAggregator;
import in.smcdesk.application.service.PositionLedger;
import in.smcdesk.domain.data.Candle;
import in.smcdesk.domain.data.InstrumentClass;
import in.smcdesk.domain.data.Timeframe;
import in.smcdesk.domain.error.DailyTradeLimitException;
import in.smcdesk.domain.error.DeskException;
import in.smcdesk.domain.error.PriceUnavailableException;
import in.smcdesk.domain.error.SignalNotFoundException;
import in.smcdesk.domain.error.TradeAlreadyClosedException;
import in.smcdesk.domain.error.TradeNotFoundException;
import in.smcdesk.domain.portfolio.EquityPoint;
import in.smcdesk.domain.portfolio.OpenPositionView;
import in.smcdesk.domain.portfolio.PortfolioSnapshot;
import in.smcdesk.domain.portfolio.StrategyStats;
import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.ManualSignalRequest;
import in.smcdesk.domain.signal.Signal;
import in.smcdesk.domain.signal.SignalRequest;
import in.smcdesk.domain.signal.TradingMode;
import in.smcdesk.domain.structure.OrderBlock;
import in.smcdesk.domain.structure.StructureSnapshot;
import in.smcdesk.domain.structure.SwingPoint;
import in.smcdesk.domain.trade.CloseReason;
import in.smcdesk.domain.trade.ManualTradeRequest;
import in.smcdesk.domain.trade.Trade;
import in.smcdesk.security.InputValidator;
import in.smcdesk.service.market.MarketDataService;
import in.smcdesk.service.signal.SignalService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * HTTP/JSON API of the desk.
 *
 * Error body: {"success":false,"error":"&lt;code&gt;","message":"..."}.
 * Domain failures map to 404 (not found), 409 (already closed), 422 (no setup,
 * insufficient data), 429 (daily limit) and 503 (price unavailable); malformed
 * requests to 400.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final String JSON_SUCCESS = "success";
    private static final String JSON_ERROR = "error";
    private static final String JSON_MESSAGE = "message";

    private static final int DEFAULT_SIGNAL_LIMIT = 50;

    private final SignalService signalService;
    private final PositionLedger ledger;
    private final PortfolioAggregator portfolio;
    private final MarketDataService marketData;
    private final InputValidator validator;
    private final Clock clock;

    public ApiHandlers(SignalService signalService, PositionLedger ledger, PortfolioAggregator portfolio,
                       MarketDataService marketData, InputValidator validator, Clock clock) {
        this.signalService = signalService;
        this.ledger = ledger;
        this.portfolio = portfolio;
        this.marketData = marketData;
        this.validator = validator;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // Health / reference data
    // ═══════════════════════════════════════════════════════════════

    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", clock.instant().toString());
        sendJson(exchange, StatusCodes.OK, health);
    }

    /**
     * GET /api/modes
     */
    public void modes(HttpServerExchange exchange) {
        ArrayNode modes = MAPPER.createArrayNode();
        for (TradingMode mode : TradingMode.values()) {
            ObjectNode m = modes.addObject();
            m.put("mode", mode.code());
            m.put("stopMultiplier", mode.stopMultiplier());
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.set("modes", modes);
        ArrayNode timeframes = root.putArray("timeframes");
        for (Timeframe tf : Timeframe.values()) {
            timeframes.add(tf.label());
        }
        ArrayNode markets = root.putArray("marketTypes");
        for (InstrumentClass ic : InstrumentClass.values()) {
            ObjectNode m = markets.addObject();
            m.put("code", ic.code());
            m.put("pricePrecision", ic.pricePrecision());
        }
        sendJson(exchange, StatusCodes.OK, root);
    }

    // ═══════════════════════════════════════════════════════════════
    // Signals
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /api/signals/generate
     * {"symbol":"BTC/USD","timeframe":"1h","marketType":"crypto","mode":"intraday","strategy":"smc"}
     */
    public void generateSignal(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode req = parseBody(body);
                SignalRequest request = new SignalRequest(
                    validator.validateSymbol(requiredText(req, "symbol")),
                    Timeframe.fromLabel(textOr(req, "1h", "timeframe")),
                    InstrumentClass.fromCode(requiredText(req, "marketType", "market_type")),
                    TradingMode.fromCode(textOr(req, "intraday", "mode")),
                    validator.validateName(textOr(req, "smc", "strategy"), "strategy"));

                Signal signal = signalService.generate(request);
                sendJson(exch, StatusCodes.CREATED, signalJson(signal));
            } catch (Exception e) {
                handleError(exch, e, "generate signal");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/signals
     * {"symbol":"BTC/USD","direction":"BUY","marketType":"crypto","entryPrice":100,"stopLoss":95,
     *  "takeProfit1":110,"takeProfit2":120,"confidence":70,"strategy":"breakout"}
     */
    public void createSignal(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode req = parseBody(body);
                String timeframe = text(req, "timeframe");
                String mode = text(req, "mode");
                ManualSignalRequest request = new ManualSignalRequest(
                    validator.validateSymbol(requiredText(req, "symbol")),
                    Direction.valueOf(requiredText(req, "direction").toUpperCase(Locale.ROOT)),
                    InstrumentClass.fromCode(requiredText(req, "marketType", "market_type")),
                    timeframe != null ? Timeframe.fromLabel(timeframe) : null,
                    mode != null ? TradingMode.fromCode(mode) : null,
                    validator.validateName(textOr(req, "manual", "strategy"), "strategy"),
                    validPrice(requiredDecimal(req, "entryPrice", "entry_price")),
                    validPrice(requiredDecimal(req, "stopLoss", "stop_loss")),
                    validPrice(requiredDecimal(req, "takeProfit1", "take_profit_1")),
                    validPrice(optionalDecimal(req, "takeProfit2", "take_profit_2")),
                    validPrice(optionalDecimal(req, "takeProfit3", "take_profit_3")),
                    requiredDecimal(req, "confidence").doubleValue());

                Signal signal = signalService.create(request);
                sendJson(exch, StatusCodes.CREATED, signalJson(signal));
            } catch (Exception e) {
                handleError(exch, e, "create signal");
            }
        }, StandardCharsets.UTF_8);
    }

    private BigDecimal validPrice(BigDecimal price) {
        if (price != null) {
            validator.validatePrice(price);
        }
        return price;
    }

    /**
     * GET /api/signals?limit=50
     */
    public void listSignals(HttpServerExchange exchange) {
        try {
            int limit = intParam(exchange, "limit", DEFAULT_SIGNAL_LIMIT);
            validator.validateRange(limit, 1, 500, "limit");
            ArrayNode arr = MAPPER.createArrayNode();
            for (Signal s : signalService.list(limit)) {
                arr.add(signalJson(s));
            }
            ObjectNode root = MAPPER.createObjectNode();
            root.set("signals", arr);
            sendJson(exchange, StatusCodes.OK, root);
        } catch (Exception e) {
            handleError(exchange, e, "list signals");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Trades
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /api/trades
     * {"signalId":"...","quantity":1.5} or an explicit payload
     * {"symbol":"BTC/USD","direction":"BUY","stopLoss":..,"takeProfit":..,"quantity":..}
     */
    public void confirmTrade(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode req = parseBody(body);
                BigDecimal quantity = optionalDecimal(req, "quantity");
                if (quantity != null) {
                    validator.validateQuantity(quantity);
                }

                Trade trade;
                String signalId = text(req, "signalId", "signal_id");
                if (signalId != null) {
                    trade = signalService.confirm(signalId, quantity);
                } else {
                    String mode = text(req, "mode");
                    trade = ledger.open(new ManualTradeRequest(
                        validator.validateSymbol(requiredText(req, "symbol")),
                        Direction.valueOf(requiredText(req, "direction").toUpperCase(Locale.ROOT)),
                        requiredDecimal(req, "stopLoss", "stop_loss"),
                        requiredDecimal(req, "takeProfit", "take_profit"),
                        quantity,
                        validator.validateName(textOr(req, "manual", "strategy"), "strategy"),
                        mode != null ? TradingMode.fromCode(mode) : null));
                }
                sendJson(exch, StatusCodes.CREATED, tradeJson(trade));
            } catch (Exception e) {
                handleError(exch, e, "confirm trade");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/trades/{tradeId}/close
     * {"reason":"MANUAL","price":105.5}; reason defaults to MARKET.
     */
    public void closeTrade(HttpServerExchange exchange) {
        String tradeId = exchange.getQueryParameters().get("tradeId").getFirst();
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode req = parseBody(body);
                CloseReason reason = CloseReason.fromCode(text(req, "reason"));
                BigDecimal price = optionalDecimal(req, "price", "exitPrice", "exit_price");
                if (price != null) {
                    validator.validatePrice(price);
                }
                Trade closed = ledger.close(tradeId, reason, price);
                sendJson(exch, StatusCodes.OK, tradeJson(closed));
            } catch (Exception e) {
                handleError(exch, e, "close trade " + tradeId);
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * GET /api/trades/open, with floating PnL.
     */
    public void openTrades(HttpServerExchange exchange) {
        try {
            ObjectNode root = MAPPER.createObjectNode();
            root.set("trades", openPositionsJson(ledger.getOpenPositions()));
            sendJson(exchange, StatusCodes.OK, root);
        } catch (Exception e) {
            handleError(exchange, e, "list open trades");
        }
    }

    /**
     * GET /api/trades/closed, most recent close first.
     */
    public void closedTrades(HttpServerExchange exchange) {
        try {
            ArrayNode arr = MAPPER.createArrayNode();
            for (Trade t : ledger.getClosedTrades()) {
                arr.add(tradeJson(t));
            }
            ObjectNode root = MAPPER.createObjectNode();
            root.set("trades", arr);
            sendJson(exchange, StatusCodes.OK, root);
        } catch (Exception e) {
            handleError(exchange, e, "list closed trades");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Portfolio
    // ═══════════════════════════════════════════════════════════════

    public void portfolio(HttpServerExchange exchange) {
        try {
            PortfolioSnapshot snap = portfolio.snapshot();
            ObjectNode root = MAPPER.createObjectNode();
            root.put("balance", snap.balance());
            root.put("totalPnl", snap.totalPnl());
            root.put("winRate", snap.winRate());
            root.put("totalTrades", snap.totalTrades());
            root.put("openTrades", snap.openTrades());
            root.put("closedTrades", snap.closedTrades());
            root.put("initialCapital", snap.initialCapital());
            root.set("openPositions", openPositionsJson(ledger.getOpenPositions()));
            sendJson(exchange, StatusCodes.OK, root);
        } catch (Exception e) {
            handleError(exchange, e, "portfolio snapshot");
        }
    }

    public void equityCurve(HttpServerExchange exchange) {
        try {
            ArrayNode arr = MAPPER.createArrayNode();
            for (EquityPoint p : portfolio.equityCurve()) {
                ObjectNode n = arr.addObject();
                n.put("timestamp", p.timestamp().toString());
                n.put("equity", p.equity());
            }
            ObjectNode root = MAPPER.createObjectNode();
            root.set("equityCurve", arr);
            sendJson(exchange, StatusCodes.OK, root);
        } catch (Exception e) {
            handleError(exchange, e, "equity curve");
        }
    }

    public void strategyStats(HttpServerExchange exchange) {
        try {
            ArrayNode arr = MAPPER.createArrayNode();
            for (StrategyStats s : portfolio.strategyStats()) {
                ObjectNode n = arr.addObject();
                n.put("strategy", s.strategy());
                n.put("trades", s.trades());
                n.put("totalPnl", s.totalPnl());
                n.put("winRate", s.winRate());
                n.put("avgPnl", s.avgPnl());
                n.put("maxWin", s.maxWin());
            }
            ObjectNode root = MAPPER.createObjectNode();
            root.set("strategies", arr);
            sendJson(exchange, StatusCodes.OK, root);
        } catch (Exception e) {
            handleError(exchange, e, "strategy stats");
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Market data ingestion
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /api/market/candles
     * {"symbol":"BTC/USD","timeframe":"1h","candles":[{"openTime":"2024-01-01T00:00:00Z","open":..,"high":..,"low":..,"close":..}]}
     */
    public void ingestCandles(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode req = parseBody(body);
                String symbol = validator.validateSymbol(requiredText(req, "symbol"));
                Timeframe timeframe = Timeframe.fromLabel(requiredText(req, "timeframe"));
                JsonNode arr = req.get("candles");
                if (arr == null || !arr.isArray()) {
                    throw new IllegalArgumentException("candles array is required");
                }

                List<Candle> candles = new ArrayList<>(arr.size());
                for (JsonNode c : arr) {
                    candles.add(new Candle(
                        instant(c, "openTime", "time"),
                        requiredDecimal(c, "open"),
                        requiredDecimal(c, "high"),
                        requiredDecimal(c, "low"),
                        requiredDecimal(c, "close")));
                }

                int stored = marketData.onCandles(symbol, timeframe, candles);
                ObjectNode root = MAPPER.createObjectNode();
                root.put(JSON_SUCCESS, true);
                root.put("received", candles.size());
                root.put("stored", stored);
                sendJson(exch, StatusCodes.OK, root);
            } catch (Exception e) {
                handleError(exch, e, "ingest candles");
            }
        }, StandardCharsets.UTF_8);
    }

    /**
     * POST /api/market/ticks
     * {"symbol":"BTC/USD","price":43000.5} or an array of such objects.
     */
    public void ingestTicks(HttpServerExchange exchange) {
        exchange.getRequestReceiver().receiveFullString((exch, body) -> {
            try {
                JsonNode req = parseBody(body);
                List<JsonNode> ticks = new ArrayList<>();
                if (req.isArray()) {
                    req.forEach(ticks::add);
                } else {
                    ticks.add(req);
                }

                ArrayNode closedIds = MAPPER.createArrayNode();
                for (JsonNode t : ticks) {
                    String symbol = validator.validateSymbol(requiredText(t, "symbol"));
                    BigDecimal price = requiredDecimal(t, "price");
                    validator.validatePrice(price);
                    Instant ts = t.hasNonNull("timestamp") ? instant(t, "timestamp") : clock.instant();
                    for (Trade closed : marketData.onTick(symbol, price, ts)) {
                        closedIds.add(closed.tradeId());
                    }
                }

                ObjectNode root = MAPPER.createObjectNode();
                root.put(JSON_SUCCESS, true);
                root.put("received", ticks.size());
                root.set("closedTrades", closedIds);
                sendJson(exch, StatusCodes.OK, root);
            } catch (Exception e) {
                handleError(exch, e, "ingest ticks");
            }
        }, StandardCharsets.UTF_8);
    }

    // ═══════════════════════════════════════════════════════════════
    // JSON views
    // ═══════════════════════════════════════════════════════════════

    static ObjectNode signalJson(Signal s) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("id", s.signalId());
        n.put("symbol", s.symbol());
        n.put("timeframe", s.timeframe().label());
        n.put("marketType", s.instrumentClass().code());
        n.put("mode", s.mode().code());
        n.put("strategy", s.strategy());
        n.put("direction", s.direction().name());
        n.put("currentPrice", s.currentPrice());
        n.put("optimalEntry", s.optimalEntry());
        n.put("entryType", s.entryType().name());
        n.put("stopLoss", s.stopLoss());
        n.put("takeProfit1", s.takeProfit1());
        n.put("takeProfit2", s.takeProfit2());
        n.put("takeProfit3", s.takeProfit3());
        n.put("rrRatio", s.rrRatio());
        n.put("confidence", s.confidence());
        n.put("qualityTier", s.qualityTier().name());
        n.put("createdAt", s.createdAt().toString());
        if (s.structure() != null) {
            n.set("structure", structureJson(s.structure()));
        } else {
            n.putNull("structure");
        }
        return n;
    }

    static ObjectNode structureJson(StructureSnapshot st) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("trend", st.trend().name());
        n.put("pricePosition", st.pricePosition().name());
        n.put("currentPrice", st.currentPrice());
        n.put("nearestSupport", st.nearestSupport());
        n.put("nearestResistance", st.nearestResistance());
        n.put("atr", st.atr());
        n.put("rangeHigh", st.rangeHigh());
        n.put("rangeLow", st.rangeLow());

        ArrayNode swings = n.putArray("swingPoints");
        for (SwingPoint p : st.swingPoints()) {
            ObjectNode sp = swings.addObject();
            sp.put("index", p.index());
            sp.put("price", p.price());
            sp.put("kind", p.kind().name());
        }
        ArrayNode obs = n.putArray("orderBlocks");
        for (OrderBlock ob : st.orderBlocks()) {
            ObjectNode o = obs.addObject();
            o.put("entryZone", ob.entryZone());
            o.put("direction", ob.direction().name());
            o.put("originIndex", ob.originIndex());
            o.put("zoneHigh", ob.zoneHigh());
            o.put("zoneLow", ob.zoneLow());
        }
        if (st.lastBos() != null) {
            ObjectNode bos = n.putObject("lastBos");
            bos.put("level", st.lastBos().level());
            bos.put("direction", st.lastBos().direction().name());
            bos.put("index", st.lastBos().index());
        } else {
            n.putNull("lastBos");
        }
        return n;
    }

    static ObjectNode tradeJson(Trade t) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("id", t.tradeId());
        n.put("signalId", t.signalId());
        n.put("symbol", t.symbol());
        n.put("direction", t.direction().name());
        n.put("entryPrice", t.entryPrice());
        n.put("quantity", t.quantity());
        n.put("stopLoss", t.stopLoss());
        n.put("takeProfit", t.takeProfit());
        n.put("strategy", t.strategy());
        n.put("mode", t.mode().code());
        n.put("status", t.status().name());
        n.put("createdAt", t.createdAt().toString());
        n.put("exitPrice", t.exitPrice());
        n.put("pnl", t.pnl());
        n.put("closedAt", t.closedAt() != null ? t.closedAt().toString() : null);
        n.put("closeReason", t.closeReason() != null ? t.closeReason().name() : null);
        return n;
    }

    private static ArrayNode openPositionsJson(List<OpenPositionView> views) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (OpenPositionView v : views) {
            ObjectNode n = tradeJson(v.trade());
            n.put("currentPrice", v.currentPrice());
            n.put("floatingPnl", v.floatingPnl());
            arr.add(n);
        }
        return arr;
    }

    // ═══════════════════════════════════════════════════════════════
    // Request helpers
    // ═══════════════════════════════════════════════════════════════

    private static JsonNode parseBody(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return MAPPER.createObjectNode();
        }
        return MAPPER.readTree(body);
    }

    /**
     * First non-null textual value among the given field names.
     */
    private static String text(JsonNode node, String... fields) {
        for (String f : fields) {
            if (node.hasNonNull(f)) {
                String v = node.get(f).asText();
                if (!v.isBlank()) {
                    return v.trim();
                }
            }
        }
        return null;
    }

    private static String textOr(JsonNode node, String defaultValue, String... fields) {
        String v = text(node, fields);
        return v != null ? v : defaultValue;
    }

    private static String requiredText(JsonNode node, String... fields) {
        String v = text(node, fields);
        if (v == null) {
            throw new IllegalArgumentException(fields[0] + " is required");
        }
        return v;
    }

    private static BigDecimal optionalDecimal(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v == null || v.isNull()) continue;
            if (v.isNumber()) return v.decimalValue();
            if (v.isTextual() && !v.asText().isBlank()) {
                try {
                    return new BigDecimal(v.asText().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(f + " is not a number: " + v.asText());
                }
            }
        }
        return null;
    }

    private static BigDecimal requiredDecimal(JsonNode node, String... fields) {
        BigDecimal v = optionalDecimal(node, fields);
        if (v == null) {
            throw new IllegalArgumentException(fields[0] + " is required");
        }
        return v;
    }

    /**
     * ISO-8601 string or epoch milliseconds.
     */
    private static Instant instant(JsonNode node, String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v == null || v.isNull()) continue;
            if (v.isNumber()) return Instant.ofEpochMilli(v.asLong());
            return Instant.parse(v.asText().trim());
        }
        throw new IllegalArgumentException(fields[0] + " is required");
    }

    private static int intParam(HttpServerExchange exchange, String name, int defaultValue) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(values.getFirst());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + values.getFirst());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Responses
    // ═══════════════════════════════════════════════════════════════

    static int statusFor(DeskException e) {
        if (e instanceof TradeNotFoundException || e instanceof SignalNotFoundException) {
            return StatusCodes.NOT_FOUND;
        }
        if (e instanceof TradeAlreadyClosedException) {
            return StatusCodes.CONFLICT;
        }
        if (e instanceof DailyTradeLimitException) {
            return StatusCodes.TOO_MANY_REQUESTS;
        }
        if (e instanceof PriceUnavailableException) {
            return StatusCodes.SERVICE_UNAVAILABLE;
        }
        return StatusCodes.UNPROCESSABLE_ENTITY;
    }

    private void handleError(HttpServerExchange exchange, Exception e, String operation) {
        if (e instanceof DeskException de) {
            int status = statusFor(de);
            log.info("[API] {} → {} {}: {}", operation, status, de.getErrorCode(), de.getMessage());
            sendError(exchange, status, de.getErrorCode(), de.getMessage());
        } else if (e instanceof JsonProcessingException) {
            log.warn("[API] {} → 400 malformed JSON: {}", operation, e.getMessage());
            sendError(exchange, StatusCodes.BAD_REQUEST, "MALFORMED_JSON", "Request body is not valid JSON");
        } else if (e instanceof IllegalArgumentException
                || e instanceof SecurityException
                || e instanceof java.time.format.DateTimeParseException) {
            log.warn("[API] {} → 400: {}", operation, e.getMessage());
            sendError(exchange, StatusCodes.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
        } else {
            log.error("[API] {} failed: {}", operation, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal error");
        }
    }

    static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        try {
            exchange.getResponseSender().send(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }

    static void sendError(HttpServerExchange exchange, int status, String code, String message) {
        ObjectNode err = MAPPER.createObjectNode();
        err.put(JSON_SUCCESS, false);
        err.put(JSON_ERROR, code);
        err.put(JSON_MESSAGE, message);
        sendJson(exchange, status, err);
    }
}
