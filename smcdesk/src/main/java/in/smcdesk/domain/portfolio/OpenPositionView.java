package in.smcdesk.domain.portfolio;

import in.smcdesk.domain.trade.Trade;

import java.math.BigDecimal;

/**
 * Open trade with its floating PnL against the latest live price.
 * currentPrice and floatingPnl are null when no price is available.
 */
public record OpenPositionView(Trade trade, BigDecimal currentPrice, BigDecimal floatingPnl) {
}
