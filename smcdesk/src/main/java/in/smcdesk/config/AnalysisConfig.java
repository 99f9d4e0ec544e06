package in.smcdesk.config;

import in.smcdesk.util.Env;

/**
 * Parameters of structure analysis.
 */
public record AnalysisConfig(
    int swingWindow,   // bars on each side of a swing candidate
    int atrPeriod,     // Wilder period
    int minBars        // below this, analysis is refused
) {
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(2, 14, 30);
    }

    public static AnalysisConfig fromEnv() {
        AnalysisConfig d = defaults();
        return new AnalysisConfig(
            Env.getInt("SWING_WINDOW", d.swingWindow()),
            Env.getInt("ATR_PERIOD", d.atrPeriod()),
            Env.getInt("MIN_BARS", d.minBars()));
    }

    public boolean isValid() {
        return swingWindow >= 1
            && atrPeriod >= 1
            && minBars >= 2 * swingWindow + 1;
    }
}
