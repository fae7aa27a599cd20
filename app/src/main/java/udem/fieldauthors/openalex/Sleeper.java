package udem.fieldauthors.openalex;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = d -> {
        if (!d.isNegative() && !d.isZero()) Thread.sleep(d.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
