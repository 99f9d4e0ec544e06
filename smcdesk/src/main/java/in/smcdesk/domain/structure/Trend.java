package in.smcdesk.domain.structure;

public enum Trend {
    BULLISH,
    BEARISH,
    RANGING
}
