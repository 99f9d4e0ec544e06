package in.smcdesk.domain.trade;

public enum TradeStatus {
    OPEN,
    CLOSED
}
