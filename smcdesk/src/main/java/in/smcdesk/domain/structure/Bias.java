package in.smcdesk.domain.structure;

/**
 * Direction of an impulse or a structure break.
 */
public enum Bias {
    BULLISH,
    BEARISH
}
