package io.snapshots.jobs;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Registration metadata and last-run state of a job. Immutable; the registry swaps in a new copy on every change.
 */
public record JobDescriptor(String name,
                            String schedule,
                            String description,
                            Duration timeout,
                            int retryCount,
                            Instant lastRun,
                            JobStatus status,
                            String lastError) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofHours(1);

    public static JobDescriptor of(String name, String schedule, String description) {
        return new JobDescriptor(name, schedule, description, DEFAULT_TIMEOUT, 0, null, JobStatus.IDLE, null);
    }

    public JobDescriptor withTimeout(Duration t) {
        return new JobDescriptor(name, schedule, description, t, retryCount, lastRun, status, lastError);
    }

    public JobDescriptor withRetryCount(int n) {
        return new JobDescriptor(name, schedule, description, timeout, n, lastRun, status, lastError);
    }

    JobDescriptor started(Instant at) {
        return new JobDescriptor(name, schedule, description, timeout, retryCount, at, JobStatus.RUNNING, lastError);
    }

    JobDescriptor finished(JobStatus s, String error) {
        return new JobDescriptor(name, schedule, description, timeout, retryCount, lastRun, s, error);
    }

    public Optional<Instant> lastRunTime() { return Optional.ofNullable(lastRun); }
    public Optional<String> lastErrorMessage() { return Optional.ofNullable(lastError); }
}
