package udem.fieldauthors.classification;

import udem.fieldauthors.dto.TopicScore;

/**
 * Outcome of {@link RelevanceFilter#evaluate}. Detail fields are only set on acceptance.
 */
public record FilterDecision(
        boolean accepted,
        TopicScore topPrimary,
        TopicScore bestInField,
        double bestInFieldScore,
        boolean primaryInField
) {
    private static final FilterDecision REJECTED = new FilterDecision(false, null, null, 0.0, false);

    public static FilterDecision rejected() {
        return REJECTED;
    }

    public static FilterDecision accepted(TopicScore top, TopicScore best, boolean primaryInField) {
        return new FilterDecision(true, top, best, best.score(), primaryInField);
    }
}
