package in.smcdesk.domain.portfolio;

import java.math.BigDecimal;

/**
 * Closed-trade performance of one strategy.
 */
public record StrategyStats(
    String strategy,
    int trades,
    BigDecimal totalPnl,
    double winRate,
    BigDecimal avgPnl,
    BigDecimal maxWin
) {
}
