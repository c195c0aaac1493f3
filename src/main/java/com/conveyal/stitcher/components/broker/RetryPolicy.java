package com.conveyal.stitcher.components.broker;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How long to wait before each retry of a failed dispatch. The delay doubles with each attempt starting from the base
 * delay, up to the maximum delay. A policy may also cap the number of attempts. Dispatch uses an uncapped policy,
 * retrying until a worker accepts the job, because there is nothing else useful to do with a job no worker will take.
 */
public class RetryPolicy {

    /** Value of maxAttempts meaning there is no limit on the number of attempts. */
    public static final int UNLIMITED = 0;

    public final Duration baseDelay;
    public final Duration maxDelay;
    public final int maxAttempts;

    public RetryPolicy (Duration baseDelay, Duration maxDelay, int maxAttempts) {
        checkArgument(!baseDelay.isNegative(), "Base retry delay must not be negative.");
        checkArgument(maxDelay.compareTo(baseDelay) >= 0, "Maximum retry delay must be at least the base delay.");
        checkArgument(maxAttempts >= 0, "Maximum attempts must not be negative.");
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    public static RetryPolicy exponential (Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(baseDelay, maxDelay, UNLIMITED);
    }

    /**
     * The delay to wait after the given failed attempt, numbered from 1, before making the next one:
     * min(base * 2^(attempt - 1), max).
     */
    public Duration delayAfterAttempt (long attempt) {
        checkArgument(attempt >= 1, "Attempts are numbered from 1.");
        // Beyond this many doublings any realistic base delay exceeds any realistic maximum, and shifting further
        // would overflow.
        if (attempt > 32) return maxDelay;
        long delayMillis = baseDelay.toMillis() << (attempt - 1);
        return delayMillis > maxDelay.toMillis() || delayMillis < 0 ? maxDelay : Duration.ofMillis(delayMillis);
    }

    /** @return true if another attempt may be made after the given number of failed attempts. */
    public boolean allowsRetry (long failedAttempts) {
        return maxAttempts == UNLIMITED || failedAttempts < maxAttempts;
    }

    @Override
    public String toString () {
        return String.format("retry after %s doubling up to %s, %s", baseDelay, maxDelay,
                maxAttempts == UNLIMITED ? "unlimited attempts" : maxAttempts + " attempts");
    }

}
