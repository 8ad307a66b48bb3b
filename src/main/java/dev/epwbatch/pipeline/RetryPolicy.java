package dev.epwbatch.pipeline;

import dev.epwbatch.config.BatchConfig;
import dev.epwbatch.error.DownloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry with exponential backoff around any {@link StageCall}.
 *
 * <p>The n-th retry waits {@code initialBackoff * multiplier^(n-1)}. Only failures matching
 * {@link #retryOn(Predicate)} are retried; everything else is rethrown immediately.
 */
public final class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private static final Predicate<Throwable> TRANSIENT =
            t -> t instanceof DownloadException || t instanceof IOException;

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    private RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier,
                        Predicate<Throwable> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff cannot be null");
        this.multiplier = multiplier;
        this.retryable = Objects.requireNonNull(retryable, "retryable cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
    }

    /** Retries I/O and download failures. */
    public static RetryPolicy of(int maxAttempts, Duration initialBackoff, double multiplier) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, TRANSIENT, Thread::sleep);
    }

    public static RetryPolicy fromConfig(BatchConfig config) {
        return of(config.getDownloadMaxAttempts(), Duration.ofMillis(config.getRetryBackoffMillis()),
                config.getRetryBackoffMultiplier());
    }

    public static RetryPolicy none() {
        return of(1, Duration.ZERO, 1.0);
    }

    public RetryPolicy retryOn(Predicate<Throwable> predicate) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, predicate, sleeper);
    }

    public RetryPolicy withSleeper(Sleeper s) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, retryable, s);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Backoff before the given retry (1-based). */
    public Duration backoffFor(int retry) {
        double factor = Math.pow(multiplier, Math.max(0, retry - 1));
        return Duration.ofMillis((long) (initialBackoff.toMillis() * factor));
    }

    public <T> T execute(String operation, StageCall<T> call) throws Exception {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (Exception e) {
                last = e;
                if (!retryable.test(e) || attempt == maxAttempts) {
                    if (attempt > 1) {
                        logger.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    }
                    throw e;
                }
                long backoff = backoffFor(attempt).toMillis();
                logger.warn("{} failed, retrying in {}ms (attempt {}/{}): {}",
                        operation, backoff, attempt, maxAttempts, e.getMessage());
                if (backoff > 0) {
                    sleeper.sleep(backoff);
                }
            }
        }
        throw last;
    }

    /** Wraps {@code call} so that every invocation goes through this policy. */
    public <T> StageCall<T> wrap(String operation, StageCall<T> call) {
        return () -> execute(operation, call);
    }
}
