package udem.fieldauthors.collection;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.fieldauthors.classification.FilterDecision;
import udem.fieldauthors.classification.RelevanceFilter;
import udem.fieldauthors.dto.AuthorCandidate;
import udem.fieldauthors.dto.AuthorRecord;
import udem.fieldauthors.dto.ConceptSet;
import udem.fieldauthors.openalex.ConceptTreeLoader;
import udem.fieldauthors.openalex.OpenAlexClient;
import udem.fieldauthors.parsers.OpenAlexParsers;
import udem.fieldauthors.utils.AuthorSink;
import udem.fieldauthors.utils.CursorStore;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pages through the authors tagged with a field, keeps those the {@link RelevanceFilter}
 * accepts and checkpoints the cursor after every page.
 * <p>
 * A stop request is honoured between pages only: the page in progress is written and
 * its cursor saved first. Reaching the end of the sequence clears the checkpoint.
 * The sink is closed on every exit path.
 */
public class AuthorCollector {
    private static final Logger log = LoggerFactory.getLogger(AuthorCollector.class);

    private final OpenAlexClient client;
    private final ConceptTreeLoader treeLoader;
    private final RelevanceFilter filter;
    private final CursorStore cursors;
    private final SinkOpener sinkOpener;
    private final CollectorSettings settings;
    private final StopSignal stop;
    private volatile RunState state = RunState.STOPPED;

    public AuthorCollector(OpenAlexClient client, ConceptTreeLoader treeLoader, RelevanceFilter filter,
                           CursorStore cursors, SinkOpener sinkOpener, CollectorSettings settings, StopSignal stop) {
        this.client = client;
        this.treeLoader = treeLoader;
        this.filter = filter;
        this.cursors = cursors;
        this.sinkOpener = sinkOpener;
        this.settings = settings;
        this.stop = stop;
    }

    /**
     * @throws udem.fieldauthors.openalex.OpenAlexException when preloading or a page fails for good
     * @throws IOException                                  when the sink cannot be opened or written
     */
    public RunSummary run() throws IOException {
        try {
            state = RunState.PRELOADING;
            ConceptSet field = preload();

            String cursor = cursors.load();
            log.info("Starting: {} ({})", settings.fieldName(), filter.settings());
            if (!CursorStore.START.equals(cursor)) {
                log.info("Resuming from saved cursor");
            }

            state = RunState.RUNNING;
            try (AuthorSink sink = sinkOpener.open()) {
                return collect(field, cursor, sink);
            } finally {
                log.info("Output closed for {}", settings.fieldName());
            }
        } finally {
            state = RunState.STOPPED;
        }
    }

    public RunState state() {
        return state;
    }

    private ConceptSet preload() {
        try {
            return treeLoader.loadDescendants(settings.rootId());
        } catch (RuntimeException e) {
            log.error("Could not preload the concept subtree of {}, aborting before any output", settings.rootId(), e);
            throw e;
        }
    }

    private RunSummary collect(ConceptSet field, String cursor, AuthorSink sink) throws IOException {
        int pages = 0;
        long scanned = 0;
        long kept = 0;
        long flushEvery = (long) settings.perPage() * settings.flushEveryPages();

        while (true) {
            if (stop.isRequested()) {
                state = RunState.DRAINING;
                log.info("Graceful stop - checkpoint saved.");
                return new RunSummary(settings.fieldName(), pages, scanned, kept, cursor, true);
            }

            JsonNode page = client.fetch("/authors", pageParams(cursor), settings.pageTimeout());
            pages++;
            if (pages == 1) {
                log.info("Total available = {}", OpenAlexParsers.count(page));
            }

            var results = OpenAlexParsers.results(page);
            if (results.isEmpty()) {
                state = RunState.DRAINING;
                log.info("Empty page, {} is exhausted", settings.fieldName());
                cursors.clear();
                return new RunSummary(settings.fieldName(), pages, scanned, kept, null, false);
            }

            int keptThisPage = 0;
            for (JsonNode r : results) {
                AuthorCandidate author = OpenAlexParsers.parseAuthor(r);
                FilterDecision decision = filter.evaluate(author, field);
                if (!decision.accepted()) continue;
                sink.write(AuthorRecord.of(author, decision, settings.fieldName()));
                keptThisPage++;
            }
            scanned += results.size();
            kept += keptThisPage;
            log.info("Scanned {} | kept {} (+{}) | sleep {}", scanned, kept, keptThisPage, client.pace());

            var next = OpenAlexParsers.nextCursor(page);
            if (next.isEmpty()) {
                state = RunState.DRAINING;
                log.info("No next cursor, {} is complete", settings.fieldName());
                cursors.clear();
                return new RunSummary(settings.fieldName(), pages, scanned, kept, null, false);
            }
            cursor = next.get();
            cursors.save(cursor);

            if (scanned % flushEvery == 0) sink.flush();
        }
    }

    private Map<String, String> pageParams(String cursor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filter", "x_concepts.id:" + settings.rootId());
        params.put("per-page", String.valueOf(settings.perPage()));
        params.put("cursor", cursor);
        params.put("select", CollectorSettings.AUTHOR_FIELDS);
        return params;
    }
}
