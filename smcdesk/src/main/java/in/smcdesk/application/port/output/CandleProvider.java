package in.smcdesk.application.port.output;

import in.smcdesk.domain.data.CandleSeries;
import in.smcdesk.domain.data.Timeframe;

/**
 * Normalized candle source (market-data collaborator).
 */
public interface CandleProvider {

    /**
     * Candles for the symbol and timeframe, oldest first. Empty series when
     * nothing is known.
     */
    CandleSeries getCandles(String symbol, Timeframe timeframe);
}
