package udem.fieldauthors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.fieldauthors.classification.RelevanceFilter;
import udem.fieldauthors.collection.AuthorCollector;
import udem.fieldauthors.collection.CollectorSettings;
import udem.fieldauthors.collection.RunSummary;
import udem.fieldauthors.collection.StopSignal;
import udem.fieldauthors.config.CollectorConfig;
import udem.fieldauthors.config.FieldConfig;
import udem.fieldauthors.openalex.ConceptTreeLoader;
import udem.fieldauthors.openalex.OpenAlexClient;
import udem.fieldauthors.openalex.OpenAlexException;
import udem.fieldauthors.openalex.Sleeper;
import udem.fieldauthors.openalex.WorksCounter;
import udem.fieldauthors.utils.CsvAuthorSink;
import udem.fieldauthors.utils.CursorStore;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Usage: {@code Main [config.json] [field name]}. Collects the authors of one configured field.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_CONFIG = "config/fields.json";
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

    public static void main(String[] args) {
        Path configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        String fieldName = args.length > 1 ? args[1] : null;

        CollectorConfig config;
        try {
            config = CollectorConfig.load(configPath);
        } catch (IOException e) {
            log.error("Failed to read configuration {}: {}", configPath, e.getMessage());
            System.exit(2);
            return;
        }
        var field = config.selectField(fieldName).orElse(null);
        if (field == null) {
            log.error("Field '{}' not found in {}", fieldName == null ? "<first>" : fieldName, configPath);
            System.exit(2);
            return;
        }

        var stop = new StopSignal();
        var done = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (stop.request()) {
                log.warn("Interrupt received - finishing current page and checkpointing...");
            }
            try {
                if (!done.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Collector did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "stop-on-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int exitCode = 0;
        try {
            RunSummary summary = newCollector(config, field, stop).run();
            log.info("{} {}: {} page(s), scanned {}, kept {}",
                    summary.interrupted() ? "Stopped" : "Completed",
                    summary.fieldName(), summary.pages(), summary.scanned(), summary.kept());
        } catch (OpenAlexException | IOException e) {
            log.error("Collection of {} failed: {}", field.name(), e.getMessage(), e);
            exitCode = 1;
        } finally {
            done.countDown();
        }

        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            log.debug("JVM is already shutting down");
            return;
        }
        if (exitCode != 0) System.exit(exitCode);
    }

    static AuthorCollector newCollector(CollectorConfig config, FieldConfig field, StopSignal stop) {
        var client = new OpenAlexClient(config.baseUrl(), config.mailto(), config.userAgent(),
                config.pacing().newState(), config.maxAttempts());
        var timeouts = config.timeouts();
        var treeLoader = new ConceptTreeLoader(client, Duration.ofSeconds(timeouts.concepts()),
                config.conceptPageDelayDuration(), Sleeper.SYSTEM);
        var counter = new WorksCounter(client, Duration.ofSeconds(timeouts.works()),
                config.countDelayDuration(), Sleeper.SYSTEM);
        var filter = new RelevanceFilter(field.filterSettings(), counter);

        Path outputDir = config.outputDirPath();
        Path output = field.outputPath(outputDir);
        var settings = new CollectorSettings(field.id(), field.name(), config.perPage(),
                config.flushEveryPages(), Duration.ofSeconds(timeouts.authors()));
        return new AuthorCollector(client, treeLoader, filter,
                new CursorStore(field.cursorPath(outputDir)),
                () -> CsvAuthorSink.open(output),
                settings, stop);
    }
}
