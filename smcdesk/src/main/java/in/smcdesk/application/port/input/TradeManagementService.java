package in.smcdesk.application.port.input;

import in.smcdesk.domain.portfolio.OpenPositionView;
import in.smcdesk.domain.signal.Signal;
import in.smcdesk.domain.trade.CloseReason;
import in.smcdesk.domain.trade.ManualTradeRequest;
import in.smcdesk.domain.trade.Trade;

import java.math.BigDecimal;
import java.util.List;

/**
 * TradeManagementService - single owner of the trade lifecycle.
 *
 * Only this service creates trades and performs the OPEN → CLOSED
 * transition. Close transitions for one trade are serialized on that
 * trade's coordinator partition.
 */
public interface TradeManagementService {

    /**
     * Open a trade from a generated signal at the live price.
     *
     * @param quantity null to size from the bot's risk per trade
     */
    Trade open(Signal signal, BigDecimal quantity);

    /**
     * Open a trade from an explicit payload at the live price.
     */
    Trade open(ManualTradeRequest request);

    /**
     * Close an open trade.
     *
     * Exit price by reason: MANUAL uses {@code manualPrice}, MARKET the live
     * price, STOP_LOSS and TAKE_PROFIT the trade's own levels. The exit price
     * is resolved before any state change.
     */
    Trade close(String tradeId, CloseReason reason, BigDecimal manualPrice);

    /**
     * Close open trades on the symbol whose stop or target the price touched.
     * The stop wins when both are touched.
     *
     * @return trades closed by this update
     */
    List<Trade> onPriceUpdate(String symbol, BigDecimal price);

    List<OpenPositionView> getOpenPositions();

    List<Trade> getClosedTrades();
}
