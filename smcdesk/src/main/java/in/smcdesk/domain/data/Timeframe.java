package in.smcdesk.domain.data;

/**
 * Chart timeframes supported for signal generation.
 */
public enum Timeframe {
    M5("5min", 5),
    M15("15min", 15),
    H1("1h", 60),
    H4("4h", 240),
    D1("1d", 1440);

    private final String label;
    private final int minutes;

    Timeframe(String label, int minutes) {
        this.label = label;
        this.minutes = minutes;
    }

    public String label() {
        return label;
    }

    public int minutes() {
        return minutes;
    }

    /**
     * Resolve from a label ("15min", "1h") or an enum name ("M15").
     */
    public static Timeframe fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timeframe cannot be blank");
        }
        for (Timeframe tf : values()) {
            if (tf.label.equalsIgnoreCase(value) || tf.name().equalsIgnoreCase(value)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + value);
    }
}
