package udem.fieldauthors.collection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StopSignal")
class StopSignalTest {

    @Test
    @DisplayName("Should report only the first request")
    void shouldReportOnlyTheFirstRequest() {
        var stop = new StopSignal();
        assertThat(stop.isRequested()).isFalse();

        assertThat(stop.request()).isTrue();
        assertThat(stop.request()).isFalse();
        assertThat(stop.isRequested()).isTrue();
    }
}
