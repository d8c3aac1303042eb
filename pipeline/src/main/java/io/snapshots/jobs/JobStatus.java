package io.snapshots.jobs;

public enum JobStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT
}
