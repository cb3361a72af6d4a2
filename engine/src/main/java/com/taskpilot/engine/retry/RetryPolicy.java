package com.taskpilot.engine.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff and jitter.
 *
 * The scheduler asks {@link #shouldRetry} / {@link #delayFor} and does its own
 * waiting, because a task retry spans engine runs. Short store writes use
 * {@link #run} / {@link #call}, which retry inline on the calling thread.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int                  maxRetries;
    private final Duration             baseDelay;
    private final double               backoffMultiplier;
    private final Duration             maxDelay;
    private final Predicate<Throwable> retryable;

    private RetryPolicy(Builder b) {
        this.maxRetries        = b.maxRetries;
        this.baseDelay         = b.baseDelay;
        this.backoffMultiplier = b.backoffMultiplier;
        this.maxDelay          = b.maxDelay;
        this.retryable         = b.retryable;
    }

    public static Builder builder() {
        return new Builder();
    }

    // -------------------------------------------------------------------------
    // Decisions
    // -------------------------------------------------------------------------

    public int maxRetries() { return maxRetries; }

    /** @param retriesSoFar retries already spent on this unit of work */
    public boolean shouldRetry(Throwable error, int retriesSoFar) {
        return retriesSoFar < maxRetries && retryable.test(error);
    }

    /** Delay before retry number {@code retriesSoFar + 1}; up to 10% jitter is added. */
    public Duration delayFor(int retriesSoFar) {
        long delayMs = (long) (baseDelay.toMillis() * Math.pow(backoffMultiplier, retriesSoFar));
        long capped  = Math.min(delayMs, maxDelay.toMillis());
        long jitter  = capped <= 0 ? 0 : (long) (capped * 0.1 * ThreadLocalRandom.current().nextDouble());
        return Duration.ofMillis(capped + jitter);
    }

    // -------------------------------------------------------------------------
    // Inline execution
    // -------------------------------------------------------------------------

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Invoke {@code action}, retrying while the failure is retryable and budget remains.
     * The last failure is rethrown. An interrupt while backing off stops retrying.
     */
    public <T> T call(String operation, Supplier<T> action) {
        int retries = 0;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!shouldRetry(e, retries)) throw e;
                Duration delay = delayFor(retries);
                retries++;
                log.warn("{} failed (retry {}/{} in {} ms): {}",
                        operation, retries, maxRetries, delay.toMillis(), e.getMessage());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private int                  maxRetries        = 3;
        private Duration             baseDelay         = Duration.ofSeconds(5);
        private double               backoffMultiplier = 2.0;
        private Duration             maxDelay          = Duration.ofMinutes(5);
        private Predicate<Throwable> retryable         = FailureClassifier::isRetryable;

        public Builder maxRetries(int maxRetries)                   { this.maxRetries = maxRetries; return this; }
        public Builder baseDelay(Duration baseDelay)                { this.baseDelay = baseDelay; return this; }
        public Builder backoffMultiplier(double backoffMultiplier)  { this.backoffMultiplier = backoffMultiplier; return this; }
        public Builder maxDelay(Duration maxDelay)                  { this.maxDelay = maxDelay; return this; }
        public Builder retryable(Predicate<Throwable> retryable)    { this.retryable = retryable; return this; }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
