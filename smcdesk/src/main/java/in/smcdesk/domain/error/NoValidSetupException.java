package in.smcdesk.domain.error;

/**
 * Thrown when structure yields no tradable direction or no valid levels.
 */
public class NoValidSetupException extends DeskException {

    private final String reason;

    public NoValidSetupException(String symbol, String reason) {
        super("NO_VALID_SETUP", String.format("[%s] No valid setup: %s", symbol, reason));
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
