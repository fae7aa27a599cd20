package udem.fieldauthors.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import udem.fieldauthors.classification.FilterSettings;

import java.nio.file.Path;
import java.util.Locale;

/**
 * One target field: a root concept and where its results and cursor live.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldConfig(
        String id,          // root concept id, ex: "C162324750"
        String name,        // label written to the field_group column
        String safeName,    // file-name friendly form of the name
        String output,
        String cursor,
        FilterParams filter
) {
    public FieldConfig {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Field id is required");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Field name is required for " + id);
        if (safeName == null || safeName.isBlank()) {
            safeName = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        }
    }

    public Path outputPath(Path outputDir) {
        return outputDir.resolve(output != null && !output.isBlank() ? output : safeName + "_authors.csv");
    }

    public Path cursorPath(Path outputDir) {
        return outputDir.resolve(cursor != null && !cursor.isBlank() ? cursor : safeName + "_cursor.txt");
    }

    public FilterSettings filterSettings() {
        return filter == null ? FilterSettings.DEFAULTS : filter.applyTo(FilterSettings.DEFAULTS);
    }
}
