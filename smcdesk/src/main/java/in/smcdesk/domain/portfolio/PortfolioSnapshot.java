package in.smcdesk.domain.portfolio;

import java.math.BigDecimal;

/**
 * Derived account view. balance = initialCapital + totalPnl.
 *
 * @param winRate percentage in [0, 100]; 0 when no trade has closed
 */
public record PortfolioSnapshot(
    BigDecimal balance,
    BigDecimal totalPnl,
    double winRate,
    int totalTrades,
    int openTrades,
    int closedTrades,
    BigDecimal initialCapital
) {
}
