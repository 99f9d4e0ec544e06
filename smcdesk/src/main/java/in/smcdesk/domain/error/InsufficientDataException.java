package in.smcdesk.domain.error;

/**
 * Thrown when a candle series is too short for structure analysis.
 */
public class InsufficientDataException extends DeskException {

    private final int available;
    private final int required;

    public InsufficientDataException(String symbol, int available, int required) {
        super("INSUFFICIENT_DATA", String.format(
            "[%s] Insufficient data: %d candles, need at least %d", symbol, available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
