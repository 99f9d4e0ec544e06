package in.smcdesk.domain.error;

public class PriceUnavailableException extends DeskException {

    private final String symbol;

    public PriceUnavailableException(String symbol, String message) {
        super("PRICE_UNAVAILABLE", String.format("[%s] Live price unavailable: %s", symbol, message));
        this.symbol = symbol;
    }

    public PriceUnavailableException(String symbol, String message, Throwable cause) {
        super("PRICE_UNAVAILABLE", String.format("[%s] Live price unavailable: %s", symbol, message), cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
