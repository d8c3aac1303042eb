package io.snapshots.retry;

/**
 * Same delay before every retry. Default policy of the retry combinator.
 */
public class FixedDelayRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long delayMillis;

    public FixedDelayRetryPolicy(int maxAttempts, long delayMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.delayMillis = Math.max(0, delayMillis);
    }

    /** Policy allowing {@code maxRetries} retries after the first attempt. */
    public static FixedDelayRetryPolicy retries(int maxRetries, long delayMillis) {
        return new FixedDelayRetryPolicy(Math.max(0, maxRetries) + 1, delayMillis);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts;
    }

    @Override
    public long backoffMillis(int attempt) {
        return delayMillis;
    }

    public int maxAttempts() { return maxAttempts; }
}
