package udem.fieldauthors.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import udem.fieldauthors.openalex.OpenAlexClient;
import udem.fieldauthors.openalex.PaceState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run configuration, read from a JSON file. Every setting except the field list has a default.
 * <p>
 * {@code OPENALEX_MAILTO} in the environment overrides {@code mailto}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CollectorConfig(
        String baseUrl,
        String mailto,
        String userAgent,
        Integer perPage,
        Integer flushEveryPages,
        Integer maxAttempts,        // 0 = retry transient failures forever
        Pacing pacing,
        Timeouts timeouts,
        Double conceptPageDelay,    // seconds between concept pages
        Double countDelay,          // seconds after each works count
        String outputDir,
        List<FieldConfig> fields
) {
    private static final Logger log = LoggerFactory.getLogger(CollectorConfig.class);
    private static final ObjectMapper M = new ObjectMapper();

    public static final String ENV_MAILTO = "OPENALEX_MAILTO";

    public CollectorConfig {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? OpenAlexClient.DEFAULT_BASE_URL : baseUrl;
        userAgent = userAgent == null || userAgent.isBlank() ? "field-authors/1.0" : userAgent;
        perPage = perPage == null ? 200 : perPage;
        flushEveryPages = flushEveryPages == null ? 5 : flushEveryPages;
        maxAttempts = maxAttempts == null ? 0 : maxAttempts;
        pacing = pacing == null ? Pacing.DEFAULTS : pacing;
        timeouts = timeouts == null ? Timeouts.DEFAULTS : timeouts;
        conceptPageDelay = conceptPageDelay == null ? 0.2 : conceptPageDelay;
        countDelay = countDelay == null ? 0.1 : countDelay;
        outputDir = outputDir == null || outputDir.isBlank() ? "openalex_field_outputs" : outputDir;
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Pacing(Double sleep, Double min, Double max, Double backoff, Double cooldown) {
        static final Pacing DEFAULTS = new Pacing(0.15, 0.05, 1.25, 1.5, 0.9);

        public Pacing {
            sleep = sleep == null ? 0.15 : sleep;
            min = min == null ? 0.05 : min;
            max = max == null ? 1.25 : max;
            backoff = backoff == null ? 1.5 : backoff;
            cooldown = cooldown == null ? 0.9 : cooldown;
        }

        public PaceState newState() {
            return new PaceState(sleep, min, max, backoff, cooldown);
        }
    }

    /**
     * Request timeouts in seconds.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Timeouts(Integer authors, Integer concepts, Integer works) {
        static final Timeouts DEFAULTS = new Timeouts(20, 20, 25);

        public Timeouts {
            authors = authors == null ? 20 : authors;
            concepts = concepts == null ? 20 : concepts;
            works = works == null ? 25 : works;
        }
    }

    public static CollectorConfig load(Path file) throws IOException {
        return load(file, System.getenv());
    }

    static CollectorConfig load(Path file, Map<String, String> env) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file.toAbsolutePath());
        }
        CollectorConfig config = M.readValue(file.toFile(), CollectorConfig.class);
        String envMailto = env.get(ENV_MAILTO);
        if (envMailto != null && !envMailto.isBlank()) {
            config = config.withMailto(envMailto);
        }
        log.info("Configuration loaded from {}: {} field(s), baseUrl={}", file, config.fields().size(), config.baseUrl());
        return config;
    }

    /**
     * The field whose name matches (case-insensitive), or the first configured field when {@code name} is null.
     */
    public Optional<FieldConfig> selectField(String name) {
        if (name == null || name.isBlank()) return fields.stream().findFirst();
        return fields.stream().filter(f -> f.name().equalsIgnoreCase(name.trim())).findFirst();
    }

    public CollectorConfig withMailto(String value) {
        return new CollectorConfig(baseUrl, value, userAgent, perPage, flushEveryPages, maxAttempts,
                pacing, timeouts, conceptPageDelay, countDelay, outputDir, fields);
    }

    public Path outputDirPath() {
        return Path.of(outputDir);
    }

    public Duration conceptPageDelayDuration() {
        return seconds(conceptPageDelay);
    }

    public Duration countDelayDuration() {
        return seconds(countDelay);
    }

    private static Duration seconds(double s) {
        return Duration.ofMillis(Math.round(s * 1000));
    }
}
