package io.snapshots.jobs;

import io.snapshots.error.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Process entrypoints for an external scheduler: exit code 0 on success, 1 on failure.
 */
public class JobCommands {
    private static final Logger log = LoggerFactory.getLogger(JobCommands.class);

    private final JobRegistry registry;

    public JobCommands(JobRegistry registry) {
        this.registry = registry;
    }

    public int runJob(String name) {
        try {
            return registry.run(name) ? 0 : 1;
        } catch (PipelineException e) {
            log.error("Job {} could not run: {}", name, e.getMessage(), e);
            return 1;
        }
    }

    public int backfill(String name, Duration windowSize) {
        return backfill(name, windowSize, Duration.ofDays(1));
    }

    public int backfill(String name, Duration windowSize, Duration step) {
        try {
            return registry.backfill(name, windowSize, step) ? 0 : 1;
        } catch (PipelineException e) {
            log.error("Backfill of {} could not run: {}", name, e.getMessage(), e);
            return 1;
        }
    }
}
