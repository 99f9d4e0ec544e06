package in.smcdesk.domain.error;

/**
 * Base class of domain failures. Each subclass carries a stable error code
 * that the HTTP layer returns to clients.
 */
public abstract class DeskException extends RuntimeException {

    private final String errorCode;

    protected DeskException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DeskException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
