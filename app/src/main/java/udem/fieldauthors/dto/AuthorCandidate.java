package udem.fieldauthors.dto;

import java.util.List;

/**
 * An author as returned by one page of {@code /authors}. Topics keep the API order.
 */
public record AuthorCandidate(
        String id,                      // full URL form, ex: "https://openalex.org/A5023888391"
        String displayName,
        String orcid,
        List<Institution> institutions, // last known institutions, most recent first
        long worksCount,
        long citedByCount,
        List<TopicScore> topics
) {
    public AuthorCandidate {
        institutions = institutions == null ? List.of() : List.copyOf(institutions);
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public String shortId() {
        return TopicScore.trimId(id);
    }
}
