package udem.fieldauthors.classification;

import udem.fieldauthors.dto.AuthorCandidate;
import udem.fieldauthors.dto.ConceptSet;
import udem.fieldauthors.dto.TopicScore;
import udem.fieldauthors.openalex.WorksCounter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides whether an author belongs to a field, given the field's concept subtree.
 * <p>
 * Gates, in order: an in-field concept in the top K, an in-field concept above the
 * absolute floor, enough strength relative to the top concept, and for borderline
 * scores a minimum share of in-field works. Only the last gate touches the network.
 */
public class RelevanceFilter {
    private static final Comparator<TopicScore> BY_SCORE_DESC =
            Comparator.comparingDouble(TopicScore::score).reversed();

    private final FilterSettings settings;
    private final WorksCounter counter;

    public RelevanceFilter(FilterSettings settings, WorksCounter counter) {
        this.settings = settings;
        this.counter = counter;
    }

    public FilterDecision evaluate(AuthorCandidate author, ConceptSet field) {
        if (author.topics().isEmpty()) return FilterDecision.rejected();

        List<TopicScore> concepts = sortByScore(author.topics());
        TopicScore top = concepts.get(0);

        int k = settings.topK();
        if (k > 0 && concepts.stream().limit(k).noneMatch(field::contains)) {
            return FilterDecision.rejected();
        }

        TopicScore best = null;
        for (TopicScore c : concepts) {
            if (field.contains(c) && c.score() >= settings.minAbsoluteScore()
                    && (best == null || c.score() > best.score())) {
                best = c;
            }
        }
        if (best == null) return FilterDecision.rejected();

        Double rel = settings.relativeThreshold();
        if (rel != null && best.score() < rel * Math.max(0.0, top.score())) {
            return FilterDecision.rejected();
        }

        boolean topInField = field.contains(top);
        if (best.score() < settings.borderlineThreshold()
                && !(settings.skipShareIfTopInField() && topInField)
                && !counter.shareInField(author.id(), field.rootId(), settings.minShare())) {
            return FilterDecision.rejected();
        }

        return FilterDecision.accepted(top, best, topInField);
    }

    public FilterSettings settings() {
        return settings;
    }

    /**
     * Descending by score; equal scores keep their original order.
     */
    static List<TopicScore> sortByScore(List<TopicScore> topics) {
        List<TopicScore> sorted = new ArrayList<>(topics);
        sorted.sort(BY_SCORE_DESC);
        return sorted;
    }
}
