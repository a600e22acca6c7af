package co.deferworks.lode.core;

import java.util.Locale;

/**
 * How the delay between retries grows with the number of failed attempts.
 */
public enum BackoffStrategy {
    // base * 2^(attempts - 1)
    EXPONENTIAL,

    // base * attempts
    LINEAR,

    // base, every time
    FIXED;

    /**
     * Parses a strategy name case-insensitively, e.g. {@code "exponential"}.
     *
     * @throws IllegalArgumentException if the name matches no strategy
     */
    public static BackoffStrategy parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backoff strategy name must not be blank");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
