package udem.fieldauthors.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import udem.fieldauthors.classification.FilterSettings;

/**
 * Per-field filter overrides. Absent values fall back to the defaults.
 * {@code minRelative: 0} effectively disables the relative-strength gate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilterParams(
        Double minScore,
        Integer topK,
        Double minRelative,
        Double borderlineScore,
        Double minShare,
        Boolean skipShareIfTopInField
) {
    public FilterSettings applyTo(FilterSettings base) {
        return new FilterSettings(
                minScore != null ? minScore : base.minAbsoluteScore(),
                topK != null ? topK : base.topK(),
                minRelative != null ? minRelative : base.relativeThreshold(),
                borderlineScore != null ? borderlineScore : base.borderlineThreshold(),
                minShare != null ? minShare : base.minShare(),
                skipShareIfTopInField != null ? skipShareIfTopInField : base.skipShareIfTopInField()
        );
    }
}
