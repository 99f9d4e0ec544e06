package in.smcdesk.domain.signal;

/**
 * Signal grade derived from the confidence score.
 */
public enum QualityTier {
    A, // confidence >= 80
    B, // confidence >= 65
    C;

    public static QualityTier of(double confidence) {
        if (confidence >= 80) return A;
        if (confidence >= 65) return B;
        return C;
    }
}
