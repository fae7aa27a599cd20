package udem.fieldauthors.collection;

import java.time.Duration;

/**
 * What to collect and how big the pages are.
 */
public record CollectorSettings(
        String rootId,
        String fieldName,
        int perPage,
        int flushEveryPages,
        Duration pageTimeout
) {
    public static final String AUTHOR_FIELDS =
            "id,display_name,orcid,last_known_institutions,works_count,cited_by_count,x_concepts";

    public CollectorSettings {
        if (rootId == null || rootId.isBlank()) throw new IllegalArgumentException("rootId is required");
        if (perPage < 1 || perPage > 200) throw new IllegalArgumentException("perPage must be in [1, 200]");
        if (flushEveryPages < 1) throw new IllegalArgumentException("flushEveryPages must be >= 1");
    }
}
