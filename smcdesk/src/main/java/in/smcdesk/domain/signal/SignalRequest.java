package in.smcdesk.domain.signal;

import in.smcdesk.domain.data.InstrumentClass;
import in.smcdesk.domain.data.Timeframe;

/**
 * Parameters of a signal-generation request.
 */
public record SignalRequest(
    String symbol,
    Timeframe timeframe,
    InstrumentClass instrumentClass,
    TradingMode mode,
    String strategy
) {
    public SignalRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be blank");
        }
        if (timeframe == null || instrumentClass == null || mode == null) {
            throw new IllegalArgumentException("Timeframe, market type and mode are required");
        }
        if (strategy == null || strategy.isBlank()) {
            strategy = "smc";
        }
    }
}
