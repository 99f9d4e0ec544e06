package in.smcdesk.domain.structure;

/**
 * Where price sits inside the most recent swing range.
 */
public enum PricePosition {
    DISCOUNT,     // lower 38.2%
    EQUILIBRIUM,
    PREMIUM       // upper 38.2%
}
