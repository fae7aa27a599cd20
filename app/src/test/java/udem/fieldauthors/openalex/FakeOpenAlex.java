package udem.fieldauthors.openalex;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-process stand-in for the OpenAlex API. Replies are queued per path; when a path's
 * queue is empty its responder (if any) answers, otherwise 404.
 */
public final class FakeOpenAlex implements AutoCloseable {
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    public record Reply(int status, String body, Map<String, String> headers) {
        public static Reply ok(String body) {
            return new Reply(200, body, Map.of());
        }

        public static Reply status(int status) {
            return new Reply(status, "{\"error\":\"status " + status + "\"}", Map.of());
        }
    }

    private final HttpServer server;
    private final Map<String, Deque<Reply>> queues = new ConcurrentHashMap<>();
    private final Map<String, Function<URI, Reply>> responders = new ConcurrentHashMap<>();
    private final List<URI> requests = new ArrayList<>();

    private FakeOpenAlex(HttpServer server) {
        this.server = server;
    }

    public static FakeOpenAlex start() throws IOException {
        var server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        var fake = new FakeOpenAlex(server);
        server.createContext("/", fake::handle);
        server.start();
        return fake;
    }

    public FakeOpenAlex enqueue(String path, Reply reply) {
        queues.computeIfAbsent(path, p -> new ArrayDeque<>()).add(reply);
        return this;
    }

    public FakeOpenAlex enqueue(String path, String okBody) {
        return enqueue(path, Reply.ok(okBody));
    }

    public FakeOpenAlex respond(String path, Function<URI, Reply> responder) {
        responders.put(path, responder);
        return this;
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public synchronized List<URI> requests(String path) {
        return requests.stream().filter(u -> u.getPath().equals(path)).toList();
    }

    public static Map<String, String> query(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null) return out;
        for (String kv : raw.split("&")) {
            int eq = kv.indexOf('=');
            out.put(URLDecoder.decode(kv.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(kv.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return out;
    }

    /**
     * A client pointed at this server, with HTTP/1.1 and the fixed test clock.
     */
    public OpenAlexClient client(PaceState pace, int maxAttempts, Sleeper sleeper) {
        var http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        return new OpenAlexClient(http, baseUrl(), null, "field-authors-test", pace, maxAttempts, sleeper, CLOCK);
    }

    private void handle(HttpExchange ex) throws IOException {
        URI uri = ex.getRequestURI();
        String path = uri.getPath();
        synchronized (this) {
            requests.add(uri);
        }
        Reply reply = null;
        Deque<Reply> q = queues.get(path);
        if (q != null) {
            synchronized (q) {
                reply = q.poll();
            }
        }
        if (reply == null && responders.containsKey(path)) {
            reply = responders.get(path).apply(uri);
        }
        if (reply == null) {
            reply = Reply.status(404);
        }

        byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        reply.headers().forEach((k, v) -> ex.getResponseHeaders().add(k, v));
        ex.sendResponseHeaders(reply.status(), body.length == 0 ? -1 : body.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
