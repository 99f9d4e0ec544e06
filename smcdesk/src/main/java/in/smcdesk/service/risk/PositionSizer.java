package in.smcdesk.service.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-fractional sizing: quantity = riskPerTrade × balance / stop distance.
 */
public final class PositionSizer {

    static final int QUANTITY_SCALE = 6;

    public static BigDecimal size(BigDecimal riskPerTrade, BigDecimal balance, BigDecimal stopDistance) {
        if (stopDistance == null || stopDistance.signum() <= 0) {
            throw new IllegalArgumentException("Stop distance must be positive: " + stopDistance);
        }
        if (balance == null || balance.signum() <= 0) {
            throw new IllegalArgumentException("Balance must be positive to size a position: " + balance);
        }
        BigDecimal quantity = riskPerTrade.multiply(balance)
            .divide(stopDistance.abs(), QUANTITY_SCALE, RoundingMode.DOWN);
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Sized quantity rounds to zero (balance=" + balance
                + ", stopDistance=" + stopDistance + ")");
        }
        return quantity;
    }

    private PositionSizer() {}
}
