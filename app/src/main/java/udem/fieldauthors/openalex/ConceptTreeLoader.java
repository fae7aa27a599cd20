package udem.fieldauthors.openalex;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.fieldauthors.dto.ConceptSet;
import udem.fieldauthors.parsers.OpenAlexParsers;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Preloads every descendant of a root concept so that author evaluation needs no
 * per-author lookups. Always starts from the first page; there is no partial result.
 */
public class ConceptTreeLoader {
    private static final Logger log = LoggerFactory.getLogger(ConceptTreeLoader.class);

    static final int PAGE_SIZE = 200;

    private final OpenAlexClient client;
    private final Duration timeout;
    private final Duration pageDelay;
    private final Sleeper sleeper;

    public ConceptTreeLoader(OpenAlexClient client, Duration timeout, Duration pageDelay, Sleeper sleeper) {
        this.client = client;
        this.timeout = timeout;
        this.pageDelay = pageDelay;
        this.sleeper = sleeper;
    }

    /**
     * @throws OpenAlexException when any page fails for good
     */
    public ConceptSet loadDescendants(String rootId) {
        Set<String> ids = new HashSet<>();
        String cursor = "*";
        int pages = 0;
        log.info("Preloading subtree of {} (concept ids)...", rootId);

        while (true) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("filter", "ancestors.id:" + rootId);
            params.put("per-page", String.valueOf(PAGE_SIZE));
            params.put("cursor", cursor);
            params.put("select", "id");

            JsonNode page = client.fetchUnpaced("/concepts", params, timeout);
            pages++;
            var pageIds = OpenAlexParsers.ids(page);
            if (pageIds.isEmpty()) break;
            ids.addAll(pageIds);

            var next = OpenAlexParsers.nextCursor(page);
            if (next.isEmpty()) break;
            cursor = next.get();
            pause();
        }

        var set = new ConceptSet(rootId, ids);
        log.info("Loaded {} concept ids for {} in {} page(s)", set.size(), rootId, pages);
        return set;
    }

    private void pause() {
        try {
            sleeper.sleep(pageDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OpenAlexException("Interrupted while preloading concepts", e);
        }
    }
}
