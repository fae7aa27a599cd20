package udem.fieldauthors.dto;

public record Institution(
        String id,
        String displayName,
        String countryCode
) {
}
