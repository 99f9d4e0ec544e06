package in.smcdesk.application.service;

import in.smcdesk.application.port.output.TradeRepository;
import in.smcdesk.domain.portfolio.EquityPoint;
import in.smcdesk.domain.portfolio.PortfolioSnapshot;
import in.smcdesk.domain.portfolio.StrategyStats;
import in.smcdesk.domain.trade.Trade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portfolio views derived from the trade history. Nothing here is stored;
 * every call recomputes from the repository.
 */
public final class PortfolioAggregator {

    private static final int PNL_SCALE = 8;

    private final TradeRepository repository;
    private final BigDecimal initialCapital;
    private final Clock clock;

    public PortfolioAggregator(TradeRepository repository, BigDecimal initialCapital, Clock clock) {
        if (initialCapital == null || initialCapital.signum() < 0) {
            throw new IllegalArgumentException("Initial capital must be >= 0: " + initialCapital);
        }
        this.repository = repository;
        this.initialCapital = initialCapital;
        this.clock = clock;
    }

    public PortfolioSnapshot snapshot() {
        List<Trade> all = repository.findAll();
        List<Trade> closed = all.stream().filter(Trade::isClosed).toList();

        BigDecimal totalPnl = sumPnl(closed);
        int open = all.size() - closed.size();

        return new PortfolioSnapshot(
            initialCapital.add(totalPnl),
            totalPnl,
            winRate(closed),
            all.size(),
            open,
            closed.size(),
            initialCapital);
    }

    /**
     * initialCapital + realized PnL of closed trades.
     */
    public BigDecimal balance() {
        return initialCapital.add(sumPnl(repository.findClosed()));
    }

    /**
     * Equity after each close, ordered by close time and prefixed with the
     * initial capital. The last point equals initialCapital + totalPnl.
     */
    public List<EquityPoint> equityCurve() {
        List<Trade> closed = new ArrayList<>(repository.findClosed());
        closed.sort(Comparator.comparing(Trade::closedAt));

        Instant start = closed.stream()
            .map(Trade::createdAt)
            .min(Comparator.naturalOrder())
            .orElse(clock.instant());

        List<EquityPoint> curve = new ArrayList<>(closed.size() + 1);
        curve.add(new EquityPoint(start, initialCapital));

        BigDecimal equity = initialCapital;
        for (Trade t : closed) {
            equity = equity.add(t.pnl());
            curve.add(new EquityPoint(t.closedAt(), equity));
        }
        return curve;
    }

    /**
     * Per-strategy stats over closed trades, best total PnL first.
     */
    public List<StrategyStats> strategyStats() {
        Map<String, List<Trade>> byStrategy = new LinkedHashMap<>();
        for (Trade t : repository.findClosed()) {
            byStrategy.computeIfAbsent(t.strategy(), k -> new ArrayList<>()).add(t);
        }

        List<StrategyStats> stats = new ArrayList<>(byStrategy.size());
        for (Map.Entry<String, List<Trade>> e : byStrategy.entrySet()) {
            List<Trade> trades = e.getValue();
            BigDecimal total = sumPnl(trades);
            BigDecimal maxWin = trades.stream()
                .map(Trade::pnl)
                .filter(p -> p.signum() > 0)
                .max(Comparator.naturalOrder())
                .orElse(BigDecimal.ZERO);
            stats.add(new StrategyStats(
                e.getKey(),
                trades.size(),
                total,
                winRate(trades),
                total.divide(BigDecimal.valueOf(trades.size()), PNL_SCALE, RoundingMode.HALF_UP),
                maxWin));
        }
        stats.sort(Comparator.comparing(StrategyStats::totalPnl).reversed());
        return stats;
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    private static BigDecimal sumPnl(List<Trade> closed) {
        return closed.stream().map(Trade::pnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Percentage of closed trades with positive PnL, two decimals; 0 when none.
     */
    static double winRate(List<Trade> closed) {
        if (closed.isEmpty()) {
            return 0.0;
        }
        long wins = closed.stream().filter(Trade::isWin).count();
        return BigDecimal.valueOf(wins * 100L)
            .divide(BigDecimal.valueOf(closed.size()), 2, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
