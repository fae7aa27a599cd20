package udem.fieldauthors.openalex;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses the {@code Retry-After} header: delta-seconds or an HTTP-date.
 */
public final class RetryAfter {
    public static final Duration FALLBACK = Duration.ofSeconds(2);
    private static final Duration FLOOR = Duration.ofSeconds(1);
    private static final Pattern DELTA_SECONDS = Pattern.compile("-?\\d{1,12}");

    private RetryAfter() {
    }

    public static Duration parse(String header, Clock clock) {
        if (header == null || header.isBlank()) return FALLBACK;
        String v = header.trim();
        if (DELTA_SECONDS.matcher(v).matches()) {
            return atLeastFloor(Duration.ofSeconds(Long.parseLong(v)));
        }
        try {
            var at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME);
            // whole seconds, like the header itself
            long seconds = Duration.between(clock.instant(), at.toInstant()).getSeconds();
            return atLeastFloor(Duration.ofSeconds(seconds));
        } catch (DateTimeParseException e) {
            return FALLBACK;
        }
    }

    private static Duration atLeastFloor(Duration d) {
        return d.compareTo(FLOOR) < 0 ? FLOOR : d;
    }
}
