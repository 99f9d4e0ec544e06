package in.smcdesk.domain.error;

public class SignalNotFoundException extends DeskException {

    private final String signalId;

    public SignalNotFoundException(String signalId) {
        super("SIGNAL_NOT_FOUND", "Signal not found: " + signalId);
        this.signalId = signalId;
    }

    public String getSignalId() {
        return signalId;
    }
}
