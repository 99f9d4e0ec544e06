package in.smcdesk.domain.data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Market type of an instrument, with its price display precision.
 *
 * Resolved once when a signal is created; everything downstream reads the
 * precision from here instead of branching on market-type strings.
 */
public enum InstrumentClass {
    CRYPTO("crypto", 2),
    FOREX("forex", 5),
    INDICES("indices", 1),
    METALS("metals", 2),
    FUTURES("futures", 2),
    STOCKS("stocks", 2);

    private final String code;
    private final int pricePrecision;

    InstrumentClass(String code, int pricePrecision) {
        this.code = code;
        this.pricePrecision = pricePrecision;
    }

    public String code() {
        return code;
    }

    public int pricePrecision() {
        return pricePrecision;
    }

    /**
     * Round a price to this class's display precision.
     */
    public BigDecimal round(BigDecimal price) {
        return price == null ? null : price.setScale(pricePrecision, RoundingMode.HALF_UP);
    }

    public String format(BigDecimal price) {
        return price == null ? "-" : round(price).toPlainString();
    }

    public static InstrumentClass fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Market type cannot be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InstrumentClass ic : values()) {
            if (ic.code.equals(normalized) || ic.name().equalsIgnoreCase(normalized)) {
                return ic;
            }
        }
        throw new IllegalArgumentException("Unknown market type: " + value);
    }
}
