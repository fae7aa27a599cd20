package udem.fieldauthors.dto;

/**
 * One concept attached to an author, with the id already trimmed from its URL form.
 */
public record TopicScore(
        String id,            // ex: "C162324750" (from "https://openalex.org/C162324750")
        String displayName,
        double score          // 0..100
) {
    public static TopicScore of(String rawId, String displayName, Double score) {
        return new TopicScore(trimId(rawId), displayName, score == null ? 0.0 : score);
    }

    public static String trimId(String idUrl) {
        if (idUrl == null) return "";
        int idx = idUrl.lastIndexOf('/');
        return idx >= 0 ? idUrl.substring(idx + 1) : idUrl;
    }
}
