package in.smcdesk.application.port.output;

import java.math.BigDecimal;

/**
 * Live price source (market-data collaborator).
 */
public interface PriceFeed {

    /**
     * Fetch the current price. May block; callers apply their own timeout.
     *
     * @throws Exception when the source cannot provide a price
     */
    BigDecimal fetchPrice(String symbol) throws Exception;
}
