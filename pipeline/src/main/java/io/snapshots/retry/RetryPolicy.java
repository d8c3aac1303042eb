package io.snapshots.retry;

public interface RetryPolicy {
    /** Whether another attempt should follow failed attempt number {@code attempt} (1-based). */
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);
}
