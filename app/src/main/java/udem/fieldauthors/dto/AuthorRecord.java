package udem.fieldauthors.dto;

import udem.fieldauthors.classification.FilterDecision;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One output row for an accepted author.
 */
public record AuthorRecord(
        String authorId,
        String name,
        String orcid,
        String institutionId,
        String affiliation,
        String country,
        long worksCount,
        long citedByCount,
        String fields,               // "; "-joined concept names, API order
        String fieldGroup,           // label of the target field
        String primaryConceptId,
        String primaryConceptName,
        double primaryConceptScore,
        double bestInFieldScore,
        String bestInFieldId,
        String bestInFieldName,
        boolean primaryInField
) {
    public static final List<String> COLUMNS = List.of(
            "author_id", "name", "orcid",
            "institution_id", "affiliation", "country",
            "works_count", "cited_by_count",
            "fields", "field_group",
            "primary_concept_id", "primary_concept_name", "primary_concept_score",
            "best_in_field_score", "best_in_field_id", "best_in_field_name",
            "is_primary_in_field"
    );

    static final String MISSING = "N/A";

    public static AuthorRecord of(AuthorCandidate a, FilterDecision d, String fieldLabel) {
        if (!d.accepted()) {
            throw new IllegalArgumentException("Only accepted authors are written: " + a.id());
        }
        Institution inst = a.institutions().isEmpty() ? null : a.institutions().get(0);
        return new AuthorRecord(
                a.id(),
                a.displayName(),
                a.orcid(),
                orMissing(inst == null ? null : inst.id()),
                orMissing(inst == null ? null : inst.displayName()),
                orMissing(inst == null ? null : inst.countryCode()),
                a.worksCount(),
                a.citedByCount(),
                a.topics().stream()
                        .map(t -> t.displayName() == null ? "" : t.displayName())
                        .collect(Collectors.joining("; ")),
                fieldLabel,
                d.topPrimary().id(),
                d.topPrimary().displayName(),
                d.topPrimary().score(),
                d.bestInFieldScore(),
                d.bestInField().id(),
                d.bestInField().displayName(),
                d.primaryInField()
        );
    }

    public List<String> values() {
        return List.of(
                str(authorId), str(name), str(orcid),
                institutionId, affiliation, country,
                String.valueOf(worksCount), String.valueOf(citedByCount),
                fields, str(fieldGroup),
                str(primaryConceptId), str(primaryConceptName), String.valueOf(primaryConceptScore),
                String.valueOf(bestInFieldScore), str(bestInFieldId), str(bestInFieldName),
                primaryInField ? "True" : "False"
        );
    }

    private static String orMissing(String s) {
        return s == null ? MISSING : s;
    }

    private static String str(String s) {
        return s == null ? "" : s;
    }
}
