package in.smcdesk.domain.signal;

public enum EntryType {
    MARKET, // enter at current price
    LIMIT   // wait for a retracement to the optimal entry
}
