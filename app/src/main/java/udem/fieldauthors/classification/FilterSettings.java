package udem.fieldauthors.classification;

/**
 * Thresholds of the relevance filter. Scores are on the OpenAlex 0..100 scale.
 */
public record FilterSettings(
        double minAbsoluteScore,      // best in-field concept must reach this
        int topK,                     // an in-field concept must rank in the top K; 0 disables
        Double relativeThreshold,     // best in-field >= relative * top score; null disables
        double borderlineThreshold,   // below this the works share decides
        double minShare,              // in-field works / total works for borderline authors
        boolean skipShareIfTopInField
) {
    public static final FilterSettings DEFAULTS = new FilterSettings(20, 5, 0.6, 45, 0.40, true);

    public FilterSettings {
        if (topK < 0) throw new IllegalArgumentException("topK must be >= 0");
        if (minShare < 0 || minShare > 1) throw new IllegalArgumentException("minShare must be in [0, 1]");
    }

    @Override
    public String toString() {
        return "min_score=" + minAbsoluteScore + ", top_k=" + topK + ", rel>=" + relativeThreshold
                + ", borderline<" + borderlineThreshold + "->share>=" + minShare;
    }
}
