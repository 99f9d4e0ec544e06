package in.smcdesk.domain.signal;

import java.math.BigDecimal;

public enum Direction {
    BUY,
    SELL,
    NEUTRAL;

    /**
     * +1 for BUY, -1 for SELL. NEUTRAL has no sign.
     */
    public BigDecimal sign() {
        return switch (this) {
            case BUY -> BigDecimal.ONE;
            case SELL -> BigDecimal.ONE.negate();
            case NEUTRAL -> throw new IllegalStateException("NEUTRAL direction has no sign");
        };
    }

    public boolean isTradable() {
        return this != NEUTRAL;
    }
}
