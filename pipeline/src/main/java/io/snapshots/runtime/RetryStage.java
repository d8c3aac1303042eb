package io.snapshots.runtime;

import io.snapshots.core.ErrorKind;
import io.snapshots.core.Stage;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.error.PipelineException;
import io.snapshots.metrics.Metrics;
import io.snapshots.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Re-runs a failed stage while the {@link RetryPolicy} allows it. Configuration failures are not retried.
 */
public class RetryStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(RetryStage.class);

    private final Stage delegate;
    private final RetryPolicy policy;

    public RetryStage(String name, Stage delegate, RetryPolicy policy, Metrics metrics) {
        super(name, metrics);
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    protected StageResult execute(TimeWindow window) {
        int attempt = 0;
        while (true) {
            attempt++;
            StageResult r = runChild(delegate, window);
            if (r.isOk()) {
                if (attempt > 1) log.info("{} succeeded on attempt {}", name(), attempt);
                return r;
            }
            ErrorKind kind = r.errorKind().orElse(ErrorKind.UNKNOWN);
            if (kind == ErrorKind.CONFIGURATION || kind == ErrorKind.INTERRUPTED) return r;
            if (!policy.shouldRetry(attempt, asException(r))) {
                return StageResult.failure(kind, "failed after " + attempt + " attempt(s): " + r.message(), r.cause().orElse(null));
            }
            long backoff = policy.backoffMillis(attempt);
            log.warn("{} attempt {} failed ({}), retrying in {} ms", name(), attempt, r.message(), backoff);
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return StageResult.failure(ErrorKind.INTERRUPTED, name() + " interrupted while waiting to retry", ie);
            }
        }
    }

    private static Exception asException(StageResult r) {
        Throwable t = r.cause().orElse(null);
        if (t instanceof Exception e) return e;
        return new PipelineException(r.errorKind().orElse(ErrorKind.UNKNOWN), r.message(), t);
    }

    public Stage delegate() { return delegate; }
}
