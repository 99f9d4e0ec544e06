package in.smcdesk.domain.trade;

import in.smcdesk.domain.signal.Direction;
import in.smcdesk.domain.signal.TradingMode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Position record.
 *
 * Append-only: a CLOSED trade is never mutated again. The only transition is
 * OPEN → CLOSED, which fills exitPrice, pnl, closedAt and closeReason together
 * (see {@link #withClose}).
 */
public record Trade(
    String tradeId,
    String signalId,        // null for trades confirmed from an ad-hoc payload
    String symbol,
    Direction direction,
    BigDecimal entryPrice,
    BigDecimal quantity,
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    String strategy,
    TradingMode mode,
    TradeStatus status,
    Instant createdAt,

    // Set once on close
    BigDecimal exitPrice,
    BigDecimal pnl,
    Instant closedAt,
    CloseReason closeReason
) {
    public Trade {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("tradeId cannot be blank");
        }
        if (direction == null || !direction.isTradable()) {
            throw new IllegalArgumentException("Trade direction must be BUY or SELL");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (status == TradeStatus.CLOSED && (exitPrice == null || pnl == null || closedAt == null)) {
            throw new IllegalArgumentException("Closed trade " + tradeId + " requires exitPrice, pnl and closedAt");
        }
    }

    public static Trade open(String tradeId, String signalId, String symbol, Direction direction,
                             BigDecimal entryPrice, BigDecimal quantity, BigDecimal stopLoss,
                             BigDecimal takeProfit, String strategy, TradingMode mode, Instant createdAt) {
        return new Trade(tradeId, signalId, symbol, direction, entryPrice, quantity, stopLoss, takeProfit,
            strategy, mode, TradeStatus.OPEN, createdAt, null, null, null, null);
    }

    public boolean isOpen() {
        return status == TradeStatus.OPEN;
    }

    public boolean isClosed() {
        return status == TradeStatus.CLOSED;
    }

    /**
     * (exit − entry) × quantity × sign, sign = +1 for BUY, −1 for SELL.
     */
    public BigDecimal pnlAt(BigDecimal price) {
        return price.subtract(entryPrice).multiply(quantity).multiply(direction.sign());
    }

    /**
     * Unrealized PnL against a live price. Read-side only.
     */
    public BigDecimal floatingPnl(BigDecimal livePrice) {
        if (!isOpen() || livePrice == null) {
            return null;
        }
        return pnlAt(livePrice);
    }

    /**
     * Closed copy of this trade.
     */
    public Trade withClose(BigDecimal exit, CloseReason reason, Instant at) {
        if (!isOpen()) {
            throw new IllegalStateException("Trade " + tradeId + " is already closed");
        }
        return new Trade(tradeId, signalId, symbol, direction, entryPrice, quantity, stopLoss, takeProfit,
            strategy, mode, TradeStatus.CLOSED, createdAt, exit, pnlAt(exit), at, reason);
    }

    public boolean isWin() {
        return pnl != null && pnl.signum() > 0;
    }

    /**
     * True when price has reached the stop (BUY: at or below, SELL: at or above).
     */
    public boolean isStopTouched(BigDecimal price) {
        return direction == Direction.BUY
            ? price.compareTo(stopLoss) <= 0
            : price.compareTo(stopLoss) >= 0;
    }

    public boolean isTargetTouched(BigDecimal price) {
        return direction == Direction.BUY
            ? price.compareTo(takeProfit) >= 0
            : price.compareTo(takeProfit) <= 0;
    }
}
