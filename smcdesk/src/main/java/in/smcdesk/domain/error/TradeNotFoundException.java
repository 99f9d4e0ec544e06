package in.smcdesk.domain.error;

public class TradeNotFoundException extends DeskException {

    private final String tradeId;

    public TradeNotFoundException(String tradeId) {
        super("TRADE_NOT_FOUND", "Trade not found: " + tradeId);
        this.tradeId = tradeId;
    }

    public String getTradeId() {
        return tradeId;
    }
}
