package udem.fieldauthors.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import udem.fieldauthors.dto.AuthorCandidate;
import udem.fieldauthors.dto.Institution;
import udem.fieldauthors.dto.TopicScore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the parts of OpenAlex list responses the collector needs:
 * {@code meta.count}, {@code meta.next_cursor} and {@code results[]}.
 */
public class OpenAlexParsers {

    private OpenAlexParsers() {
    }

    public static Optional<String> nextCursor(JsonNode page) {
        String c = asText(page.path("meta").get("next_cursor"));
        return (c == null || c.isBlank()) ? Optional.empty() : Optional.of(c);
    }

    public static long count(JsonNode page) {
        JsonNode c = page.path("meta").get("count");
        return (c == null || !c.isNumber()) ? 0L : c.asLong();
    }

    public static List<JsonNode> results(JsonNode page) {
        JsonNode results = page.get("results");
        if (results == null || !results.isArray()) return List.of();
        List<JsonNode> out = new ArrayList<>(results.size());
        results.forEach(out::add);
        return out;
    }

    public static List<String> ids(JsonNode page) {
        List<String> out = new ArrayList<>();
        for (JsonNode r : results(page)) {
            String id = TopicScore.trimId(asText(r.get("id")));
            if (!id.isBlank()) out.add(id);
        }
        return out;
    }

    public static AuthorCandidate parseAuthor(JsonNode a) {
        List<Institution> institutions = new ArrayList<>();
        JsonNode lki = a.get("last_known_institutions");
        if (lki != null && lki.isArray()) {
            for (JsonNode i : lki) {
                institutions.add(new Institution(asText(i.get("id")), asText(i.get("display_name")), asText(i.get("country_code"))));
            }
        }

        List<TopicScore> topics = new ArrayList<>();
        JsonNode xcs = a.get("x_concepts");
        if (xcs != null && xcs.isArray()) {
            for (JsonNode c : xcs) {
                JsonNode score = c.get("score");
                topics.add(TopicScore.of(
                        asText(c.get("id")),
                        asText(c.get("display_name")),
                        (score == null || score.isNull()) ? null : score.asDouble()));
            }
        }

        return new AuthorCandidate(
                asText(a.get("id")),
                asText(a.get("display_name")),
                asText(a.get("orcid")),
                institutions,
                a.path("works_count").asLong(0),
                a.path("cited_by_count").asLong(0),
                topics
        );
    }

    private static String asText(JsonNode n) {
        return (n == null || n.isNull()) ? null : n.asText();
    }
}
