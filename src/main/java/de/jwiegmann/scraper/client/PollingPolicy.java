package de.jwiegmann.scraper.client;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Abfrageintervall und maximale Anzahl an Versuchen.
 */
@Getter
@ToString
public class PollingPolicy {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);
    public static final int DEFAULT_MAX_ATTEMPTS = 50;

    private final Duration interval;
    private final int maxAttempts;

    private PollingPolicy(Duration interval, int maxAttempts) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.interval = interval;
        this.maxAttempts = maxAttempts;
    }

    public static PollingPolicy of(Duration interval, int maxAttempts) {
        return new PollingPolicy(interval, maxAttempts);
    }

    public static PollingPolicy defaults() {
        return new PollingPolicy(DEFAULT_INTERVAL, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Obergrenze der reinen Wartezeit (ohne Antwortzeiten der Abfragen).
     */
    public Duration budget() {
        return interval.multipliedBy(maxAttempts - 1L);
    }
}
