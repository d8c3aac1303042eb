package io.snapshots.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.snapshots.core.Stage;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Uniform timing, logging and failure isolation for every stage: whatever {@link #execute} throws is logged
 * with the stage name and elapsed time and turned into a failed result.
 */
public abstract class AbstractStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(AbstractStage.class);

    private final String name;
    private final Timer timer;
    private final Meter failures;

    protected AbstractStage(String name, Metrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        String key = "stage." + Metrics.sanitize(name);
        this.timer = metrics.timer(key + ".time");
        this.failures = metrics.meter(key + ".failures");
    }

    @Override
    public final StageResult run(TimeWindow window) {
        long t0 = System.nanoTime();
        StageResult result;
        try (Timer.Context ignored = timer.time()) {
            result = execute(window);
            if (result == null) result = StageResult.nothingToDo();
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            result = StageResult.fromException(e);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;
        if (result.isOk()) {
            log.debug("{} completed in {} ms ({} records loaded)", name, ms, result.recordsLoaded());
        } else {
            failures.mark();
            log.error("{} failed after {} ms [{}]: {}", name, ms, result.errorKind().orElse(null), result.message(),
                    result.cause().orElse(null));
        }
        return result;
    }

    protected abstract StageResult execute(TimeWindow window) throws Exception;

    /** Runs a child stage, turning anything it throws despite its contract into a failed result. */
    protected static StageResult runChild(Stage child, TimeWindow window) {
        try {
            StageResult r = child.run(window);
            return r == null ? StageResult.nothingToDo() : r;
        } catch (RuntimeException e) {
            log.error("Stage {} threw instead of returning a result", child.name(), e);
            return StageResult.fromException(e);
        }
    }

    @Override
    public String name() { return name; }

    @Override
    public String toString() { return getClass().getSimpleName() + "[" + name + "]"; }
}
