package in.smcdesk.domain.error;

/**
 * Thrown when a close is requested for a trade that is no longer OPEN.
 * The stored trade is left untouched.
 */
public class TradeAlreadyClosedException extends DeskException {

    private final String tradeId;

    public TradeAlreadyClosedException(String tradeId) {
        super("TRADE_ALREADY_CLOSED", "Trade already closed: " + tradeId);
        this.tradeId = tradeId;
    }

    public String getTradeId() {
        return tradeId;
    }
}
