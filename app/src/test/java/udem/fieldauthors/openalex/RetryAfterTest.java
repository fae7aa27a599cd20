package udem.fieldauthors.openalex;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Retry-After parsing")
class RetryAfterTest {

    @Test
    @DisplayName("Should read delta seconds")
    void shouldReadDeltaSeconds() {
        assertThat(RetryAfter.parse("5", FakeOpenAlex.CLOCK)).isEqualTo(Duration.ofSeconds(5));
        assertThat(RetryAfter.parse(" 12 ", FakeOpenAlex.CLOCK)).isEqualTo(Duration.ofSeconds(12));
    }

    @Test
    @DisplayName("Should floor at one second")
    void shouldFloorAtOneSecond() {
        assertThat(RetryAfter.parse("0", FakeOpenAlex.CLOCK)).isEqualTo(Duration.ofSeconds(1));
        assertThat(RetryAfter.parse("-3", FakeOpenAlex.CLOCK)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should read an HTTP-date")
    void shouldReadHttpDate() {
        // clock is 2024-05-01T12:00:00Z
        assertThat(RetryAfter.parse("Wed, 01 May 2024 12:00:10 GMT", FakeOpenAlex.CLOCK))
                .isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Should floor an HTTP-date in the past")
    void shouldFloorPastHttpDate() {
        assertThat(RetryAfter.parse("Wed, 01 May 2024 11:00:00 GMT", FakeOpenAlex.CLOCK))
                .isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should fall back when missing or garbled")
    void shouldFallBackWhenMissingOrGarbled() {
        assertThat(RetryAfter.parse(null, FakeOpenAlex.CLOCK)).isEqualTo(RetryAfter.FALLBACK);
        assertThat(RetryAfter.parse("", FakeOpenAlex.CLOCK)).isEqualTo(RetryAfter.FALLBACK);
        assertThat(RetryAfter.parse("soon", FakeOpenAlex.CLOCK)).isEqualTo(Duration.ofSeconds(2));
    }
}
