package in.smcdesk.domain.trade;

import java.util.Locale;

/**
 * Exit price policy for a close.
 */
public enum CloseReason {
    MANUAL,      // price supplied by the caller
    MARKET,      // current live price
    STOP_LOSS,   // the trade's stop price
    TAKE_PROFIT; // the trade's target price

    public static CloseReason fromCode(String value) {
        if (value == null || value.isBlank()) {
            return MARKET;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
