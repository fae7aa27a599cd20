package udem.fieldauthors.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import udem.fieldauthors.dto.TopicScore;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OpenAlexParsers")
class OpenAlexParsersTest {

    private static final ObjectMapper M = new ObjectMapper();

    private static JsonNode json(String s) throws Exception {
        return M.readTree(s);
    }

    @Test
    @DisplayName("Should parse author")
    void shouldParseAuthor() throws Exception {
        var node = json("""
                {
                  "id": "https://openalex.org/A5023888391",
                  "display_name": "Jane Doe",
                  "orcid": "https://orcid.org/0000-0001-2345-6789",
                  "works_count": 88,
                  "cited_by_count": 4096,
                  "last_known_institutions": [
                    {"id": "https://openalex.org/I136199984", "display_name": "Harvard University", "country_code": "US"}
                  ],
                  "x_concepts": [
                    {"id": "https://openalex.org/C162324750", "display_name": "Economics", "score": 71.5},
                    {"id": "https://openalex.org/C175444787", "display_name": "Microeconomics", "score": null},
                    {"id": "C41008148", "display_name": "Computer science"}
                  ]
                }
                """);

        var a = OpenAlexParsers.parseAuthor(node);

        assertThat(a.id()).isEqualTo("https://openalex.org/A5023888391");
        assertThat(a.shortId()).isEqualTo("A5023888391");
        assertThat(a.displayName()).isEqualTo("Jane Doe");
        assertThat(a.worksCount()).isEqualTo(88);
        assertThat(a.citedByCount()).isEqualTo(4096);
        assertThat(a.institutions()).singleElement()
                .satisfies(i -> assertThat(i.countryCode()).isEqualTo("US"));
        assertThat(a.topics()).containsExactly(
                new TopicScore("C162324750", "Economics", 71.5),
                new TopicScore("C175444787", "Microeconomics", 0.0),
                new TopicScore("C41008148", "Computer science", 0.0));
    }

    @Test
    @DisplayName("Should tolerate missing sections")
    void shouldTolerateMissingSections() throws Exception {
        var a = OpenAlexParsers.parseAuthor(json("{\"id\":\"https://openalex.org/A1\",\"last_known_institutions\":null}"));

        assertThat(a.institutions()).isEmpty();
        assertThat(a.topics()).isEmpty();
        assertThat(a.orcid()).isNull();
        assertThat(a.worksCount()).isZero();
    }

    @Test
    @DisplayName("Should read page meta")
    void shouldReadPageMeta() throws Exception {
        var page = json("{\"meta\":{\"count\":1200,\"next_cursor\":\"IlsxNjA5\"},\"results\":[{\"id\":\"https://openalex.org/C1\"},{\"id\":null}]}");

        assertThat(OpenAlexParsers.count(page)).isEqualTo(1200);
        assertThat(OpenAlexParsers.nextCursor(page)).contains("IlsxNjA5");
        assertThat(OpenAlexParsers.results(page)).hasSize(2);
        assertThat(OpenAlexParsers.ids(page)).containsExactly("C1");
    }

    @Test
    @DisplayName("Should treat null or blank cursor as absent")
    void shouldTreatNullOrBlankCursorAsAbsent() throws Exception {
        assertThat(OpenAlexParsers.nextCursor(json("{\"meta\":{\"next_cursor\":null}}"))).isEmpty();
        assertThat(OpenAlexParsers.nextCursor(json("{\"meta\":{\"next_cursor\":\"\"}}"))).isEmpty();
        assertThat(OpenAlexParsers.nextCursor(json("{}"))).isEmpty();
        assertThat(OpenAlexParsers.results(json("{}"))).isEmpty();
        assertThat(OpenAlexParsers.count(json("{}"))).isZero();
    }
}
