package udem.fieldauthors.openalex;

import java.time.Duration;
import java.util.Locale;

/**
 * Adaptive delay between paced requests. Grows on throttling or server errors,
 * shrinks on success, always within [min, max].
 */
public final class PaceState {
    private final double min;
    private final double max;
    private final double backoffMultiplier;
    private final double cooldownMultiplier;
    private double sleepSeconds;

    public PaceState(double sleepSeconds, double min, double max, double backoffMultiplier, double cooldownMultiplier) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid pace bounds [" + min + ", " + max + "]");
        }
        if (backoffMultiplier < 1.0 || cooldownMultiplier <= 0 || cooldownMultiplier > 1.0) {
            throw new IllegalArgumentException("backoff must be >= 1 and cooldown in (0, 1]");
        }
        this.min = min;
        this.max = max;
        this.backoffMultiplier = backoffMultiplier;
        this.cooldownMultiplier = cooldownMultiplier;
        this.sleepSeconds = clamp(sleepSeconds);
    }

    public void backoff() {
        sleepSeconds = clamp(sleepSeconds * backoffMultiplier);
    }

    public void cooldown() {
        sleepSeconds = clamp(sleepSeconds * cooldownMultiplier);
    }

    public double sleepSeconds() {
        return sleepSeconds;
    }

    public Duration current() {
        return Duration.ofMillis(Math.round(sleepSeconds * 1000));
    }

    private double clamp(double v) {
        return Math.max(min, Math.min(max, v));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.2fs", sleepSeconds);
    }
}
