package in.smcdesk.domain.error;

public class DailyTradeLimitException extends DeskException {

    private final int limit;

    public DailyTradeLimitException(int limit) {
        super("DAILY_TRADE_LIMIT", "Daily trade limit reached: " + limit);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
