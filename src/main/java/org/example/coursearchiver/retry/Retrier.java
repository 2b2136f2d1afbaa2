package org.example.coursearchiver.retry;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an action with exponential backoff. After the n-th failed attempt the wait is
 * {@code base * 2^n}; rate-limited failures wait twice as long. Failures that are not retryable,
 * and the failure of the last attempt, propagate unchanged.
 */
public class Retrier {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BASE_DELAY_MS = 1000L;
    static final int RATE_LIMIT_FACTOR = 2;

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final Sleeper sleeper;
    private final Logger logger;

    public Retrier() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_MS, Sleeper.SYSTEM, Logger.getLogger(Retrier.class.getName()));
    }

    public Retrier(int maxAttempts, long baseDelayMillis, Sleeper sleeper, Logger logger) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts debe ser al menos 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = Math.max(0L, baseDelayMillis);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public <T> T call(String operation, RetryableAction<T> action) throws IOException, InterruptedException {
        int attempt = 1;
        while (true) {
            try {
                return action.run();
            } catch (IOException | RuntimeException e) {
                if (attempt >= maxAttempts || !ErrorClassifier.isRetryable(e)) {
                    throw e;
                }
                long wait = backoffFor(attempt, e);
                int failedAttempt = attempt;
                logger.log(Level.WARNING, String.format("%s falló (intento %d/%d): %s. Reintentando en %d ms",
                        operation, failedAttempt, maxAttempts, e.getMessage(), wait));
                sleeper.sleep(wait);
                attempt++;
            }
        }
    }

    /**
     * Wait after the {@code failedAttempts}-th failure: {@code base * 2^(failedAttempts - 1)}, so the
     * first retry waits exactly the base delay. Rate-limit errors wait twice as long.
     */
    long backoffFor(int failedAttempts, Throwable error) {
        long wait = baseDelayMillis * (1L << Math.min(Math.max(failedAttempts - 1, 0), 20));
        if (ErrorClassifier.isRateLimited(error)) {
            wait *= RATE_LIMIT_FACTOR;
        }
        return wait;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
