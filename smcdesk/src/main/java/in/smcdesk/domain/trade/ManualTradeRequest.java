package in.smcdesk.domain.trade;

import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.TradingMode;

import java.math.BigDecimal;

/**
 * Trade confirmation payload that does not reference a stored signal.
 *
 * @param quantity null to size from the bot's risk per trade
 */
public record ManualTradeRequest(
    String symbol,
    Direction direction,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    BigDecimal quantity,
    String strategy,
    TradingMode mode
) {
    public ManualTradeRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be blank");
        }
        if (direction == null || !direction.isTradable()) {
            throw new IllegalArgumentException("Direction must be BUY or SELL");
        }
        if (stopLoss == null || takeProfit == null) {
            throw new IllegalArgumentException("stopLoss and takeProfit are required");
        }
        if (quantity != null && quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (strategy == null || strategy.isBlank()) {
            strategy = "manual";
        }
        if (mode == null) {
            mode = TradingMode.INTRADAY;
        }
    }
}
