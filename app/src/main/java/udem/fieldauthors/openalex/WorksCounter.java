package udem.fieldauthors.openalex;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.fieldauthors.dto.TopicScore;
import udem.fieldauthors.parsers.OpenAlexParsers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers "how many works match this filter" through {@code meta.count} of a
 * one-record page. Lookups never fail: an unanswered query counts as zero.
 * <p>
 * Results are kept for the lifetime of the instance, so use one instance per run;
 * remote counts drift over time.
 */
public class WorksCounter {
    private static final Logger log = LoggerFactory.getLogger(WorksCounter.class);

    private final OpenAlexClient client;
    private final Duration timeout;
    private final Duration courtesyDelay;
    private final Sleeper sleeper;
    private final Cache<String, Long> counts = Caffeine.newBuilder().build();

    public WorksCounter(OpenAlexClient client, Duration timeout, Duration courtesyDelay, Sleeper sleeper) {
        this.client = client;
        this.timeout = timeout;
        this.courtesyDelay = courtesyDelay;
        this.sleeper = sleeper;
    }

    public long countMatching(String filter) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filter", filter);
        params.put("per-page", "1");
        params.put("select", "id");
        try {
            return client.tryFetchOnce("/works", params, timeout)
                    .map(OpenAlexParsers::count)
                    .orElse(0L);
        } catch (RuntimeException e) {
            log.debug("Count query '{}' failed, counting as 0: {}", filter, e.toString());
            return 0L;
        }
    }

    public long totalWorks(String authorId) {
        String aid = TopicScore.trimId(authorId);
        if (aid.isBlank()) return 0L;
        return counts.get("total|" + aid, k -> countThenPause("authorships.author.id:" + aid));
    }

    public long fieldWorks(String authorId, String conceptId) {
        String aid = TopicScore.trimId(authorId);
        if (aid.isBlank() || conceptId == null || conceptId.isBlank()) return 0L;
        return counts.get("field|" + aid + "|" + conceptId,
                k -> countThenPause("authorships.author.id:" + aid + ",concepts.id:" + conceptId));
    }

    /**
     * True when at least {@code minShare} of the author's works are tagged with the concept.
     * An author with no counted works never passes.
     */
    public boolean shareInField(String authorId, String conceptId, double minShare) {
        long total = totalWorks(authorId);
        if (total <= 0) return false;
        double share = (double) fieldWorks(authorId, conceptId) / total;
        log.debug("Share of {} in {}: {}", authorId, conceptId, share);
        return share >= minShare;
    }

    long cachedEntries() {
        return counts.estimatedSize();
    }

    private long countThenPause(String filter) {
        long c = countMatching(filter);
        try {
            sleeper.sleep(courtesyDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return c;
    }
}
