package de.jwiegmann.ultraupload.client.transport;

import java.time.Duration;

/**
 * Exponentielles Backoff: vor Versuch k (k &gt; 1) wird 2^(k-2) * base gewartet.
 * Mit base = 1s ergibt das 1s, 2s, 4s, ...
 */
public class BackoffPolicy {

    private final Duration base;

    public BackoffPolicy() {
        this(Duration.ofSeconds(1));
    }

    public BackoffPolicy(Duration base) {
        this.base = base;
    }

    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        return base.multipliedBy(1L << Math.min(attempt - 2, 30));
    }

    public static boolean isRetryable(int status) {
        return status >= 500 || status == 429 || status == 408;
    }
}
