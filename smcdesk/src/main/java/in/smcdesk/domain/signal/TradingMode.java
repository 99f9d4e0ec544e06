package in.smcdesk.domain.signal;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Holding horizon. The stop multiplier scales ATR into a stop distance and is
 * strictly increasing with the horizon.
 */
public enum TradingMode {
    SCALPING("scalping", new BigDecimal("0.5")),
    INTRADAY("intraday", new BigDecimal("1.0")),
    SWING("swing", new BigDecimal("1.5"));

    private final String code;
    private final BigDecimal stopMultiplier;

    TradingMode(String code, BigDecimal stopMultiplier) {
        this.code = code;
        this.stopMultiplier = stopMultiplier;
    }

    public String code() {
        return code;
    }

    public BigDecimal stopMultiplier() {
        return stopMultiplier;
    }

    public static TradingMode fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Trading mode cannot be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TradingMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown trading mode: " + value);
    }
}
