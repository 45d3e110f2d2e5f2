package io.github.byzatic.jobscheduler.retry;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 * <p>
 * For retry number {@code attempt} (1 = first retry) the centre of the delay is
 * {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}; the returned delay is drawn uniformly within
 * &plusmn;20% of that centre and never exceeds {@code maxDelay}. Once {@code attempt > maxRetries} the policy gives up.
 * <p>
 * Holds no state besides the jitter source; safe to share between threads.
 */
public final class RetryPolicy {
    public static final double JITTER_RATIO = 0.2;

    private final DoubleSupplier jitterSource;

    /**
     * Jitter from {@link ThreadLocalRandom}.
     */
    public RetryPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitterSource supplies uniform values in {@code [0, 1)}; {@code 0.5} means no jitter
     */
    public RetryPolicy(@NotNull DoubleSupplier jitterSource) {
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource");
    }

    /**
     * @param attempt    retry number, 1-based
     * @param maxRetries retries allowed for the execution
     * @return delay before the retry, or empty to give up
     */
    public @NotNull Optional<Duration> nextRetryDelay(int attempt, int maxRetries, @NotNull Duration baseDelay, @NotNull Duration maxDelay) {
        if (attempt < 1) throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        if (attempt > maxRetries) {
            return Optional.empty();
        }
        Duration center = backoffCenter(attempt, baseDelay, maxDelay);
        double factor = 1.0 + JITTER_RATIO * (2.0 * jitterSource.getAsDouble() - 1.0);
        long nanos = Math.round(center.toNanos() * factor);
        return Optional.of(Duration.ofNanos(Math.min(maxDelay.toNanos(), Math.max(0L, nanos))));
    }

    /**
     * Un-jittered delay: {@code min(baseDelay * 2^(attempt-1), maxDelay)}.
     */
    public static @NotNull Duration backoffCenter(int attempt, @NotNull Duration baseDelay, @NotNull Duration maxDelay) {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (attempt < 1) throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        int shift = attempt - 1;
        // защита от переполнения: дальше всё равно упираемся в maxDelay
        if (shift >= 62) return maxDelay;
        long baseNanos = baseDelay.toNanos();
        long maxNanos = maxDelay.toNanos();
        if (baseNanos > (maxNanos >> shift)) return maxDelay;
        return Duration.ofNanos(baseNanos << shift);
    }
}
