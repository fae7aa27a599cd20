package udem.fieldauthors.openalex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.afterburner.AfterburnerModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Synchronous OpenAlex client. One request in flight at a time.
 * <p>
 * Paced requests honour {@link PaceState} between calls and retry on 429, 5xx and
 * transport failures until they succeed or the attempt budget runs out. After a 429
 * the retry waits for {@code Retry-After} only; the backed-off pace applies from the next call.
 * Unpaced requests follow the same retry rules without touching the pace.
 */
public class OpenAlexClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAlexClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.openalex.org";
    static final Duration UNPACED_ERROR_DELAY = Duration.ofSeconds(2);

    private final HttpClient http;
    private final ObjectMapper M = new ObjectMapper();
    private final String baseUrl;
    private final String mailto;
    private final String userAgent;
    private final PaceState pace;
    private final int maxAttempts; // 0 = unbounded
    private final Sleeper sleeper;
    private final Clock clock;
    private boolean pacedCallMade;

    public OpenAlexClient(String baseUrl, String mailto, String userAgent, PaceState pace, int maxAttempts) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_2)
                        .connectTimeout(Duration.ofSeconds(10))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                baseUrl, mailto, userAgent, pace, maxAttempts, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public OpenAlexClient(HttpClient http, String baseUrl, String mailto, String userAgent,
                          PaceState pace, int maxAttempts, Sleeper sleeper, Clock clock) {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        this.http = http;
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
        this.mailto = mailto;
        this.userAgent = userAgent;
        this.pace = pace;
        this.maxAttempts = maxAttempts;
        this.sleeper = sleeper;
        this.clock = clock;
        M.registerModule(new AfterburnerModule());
    }

    /**
     * Paced GET with unbounded (or budgeted) retry on transient failures.
     *
     * @throws OpenAlexException on a non-retryable status, an unreadable body or an exhausted budget
     */
    public JsonNode fetch(String endpoint, Map<String, String> params, Duration timeout) {
        return execute(endpoint, params, timeout, true);
    }

    /**
     * Same retry rules as {@link #fetch}, but never waits on or adjusts the shared pace.
     */
    public JsonNode fetchUnpaced(String endpoint, Map<String, String> params, Duration timeout) {
        return execute(endpoint, params, timeout, false);
    }

    /**
     * Single attempt, no retry. Empty on any failure.
     */
    public Optional<JsonNode> tryFetchOnce(String endpoint, Map<String, String> params, Duration timeout) {
        URI uri = buildUri(endpoint, params);
        try {
            var res = send(uri, timeout);
            if (res.statusCode() != 200) {
                log.debug("GET {} -> {}", uri, res.statusCode());
                return Optional.empty();
            }
            return Optional.of(M.readTree(res.body()));
        } catch (IOException e) {
            log.debug("GET {} failed: {}", uri, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    public PaceState pace() {
        return pace;
    }

    private JsonNode execute(String endpoint, Map<String, String> params, Duration timeout, boolean paced) {
        URI uri = buildUri(endpoint, params);
        int attempt = 0;
        boolean waitedRetryAfter = false;
        while (true) {
            attempt++;
            if (paced) {
                // a Retry-After wait replaces the pace sleep for the retry that follows it
                if (pacedCallMade && !waitedRetryAfter) sleep(pace.current());
                pacedCallMade = true;
            }
            waitedRetryAfter = false;

            HttpResponse<String> res;
            try {
                res = send(uri, timeout);
            } catch (IOException e) {
                giveUpIfExhausted(attempt, uri, -1, e);
                log.warn("Request to {} failed ({}), backing off", endpoint, e.toString());
                if (paced) pace.backoff();
                else sleep(UNPACED_ERROR_DELAY);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OpenAlexException("Interrupted while requesting " + uri, e);
            }

            int sc = res.statusCode();
            if (sc >= 200 && sc < 300) {
                if (paced) pace.cooldown();
                return parse(res.body(), uri, sc);
            }
            if (sc == 429) {
                giveUpIfExhausted(attempt, uri, sc, null);
                Duration wait = RetryAfter.parse(res.headers().firstValue("Retry-After").orElse(null), clock);
                log.warn("Rate limited on {}. Sleeping for {}s", endpoint, wait.toSeconds());
                sleep(wait);
                if (paced) pace.backoff();
                waitedRetryAfter = true;
                continue;
            }
            if (sc >= 500) {
                giveUpIfExhausted(attempt, uri, sc, null);
                log.warn("Server error {} on {}, backing off", sc, endpoint);
                if (paced) pace.backoff();
                else sleep(UNPACED_ERROR_DELAY);
                continue;
            }
            throw new OpenAlexException("Unexpected HTTP " + sc + " from " + uri, sc, null);
        }
    }

    private HttpResponse<String> send(URI uri, Duration timeout) throws IOException, InterruptedException {
        var builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json");
        if (userAgent != null && !userAgent.isBlank()) builder.header("User-Agent", userAgent);
        return http.send(builder.GET().build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private JsonNode parse(String body, URI uri, int sc) {
        try {
            JsonNode root = M.readTree(body);
            if (root == null || !root.isObject()) {
                throw new OpenAlexException("Expected a JSON object from " + uri, sc, null);
            }
            return root;
        } catch (IOException e) {
            throw new OpenAlexException("Failed to parse response from " + uri + ". Preview: " + preview(body, 200), sc, e);
        }
    }

    private void giveUpIfExhausted(int attempt, URI uri, int sc, Throwable cause) {
        if (maxAttempts > 0 && attempt >= maxAttempts) {
            throw new OpenAlexException("Giving up on " + uri + " after " + attempt + " attempts", sc, cause);
        }
    }

    private void sleep(Duration d) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OpenAlexException("Interrupted while sleeping between requests", e);
        }
    }

    URI buildUri(String endpoint, Map<String, String> params) {
        StringBuilder q = new StringBuilder(baseUrl);
        q.append(endpoint.startsWith("/") ? endpoint : "/" + endpoint);
        char sep = '?';
        for (var e : params.entrySet()) {
            if (e.getValue() == null) continue;
            q.append(sep).append(e.getKey()).append('=').append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
            sep = '&';
        }
        if (mailto != null && !mailto.isBlank()) {
            q.append(sep).append("mailto=").append(URLEncoder.encode(mailto, StandardCharsets.UTF_8));
        }
        return URI.create(q.toString());
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String preview(String s, int max) {
        if (s == null) return "null";
        s = s.replaceAll("\\s+", " ").trim();
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
