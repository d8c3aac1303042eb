package io.snapshots.runtime;

import io.snapshots.core.ErrorKind;
import io.snapshots.core.Stage;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs children one after another whatever their outcome. Succeeds only when every child succeeded.
 */
public class SequentialStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(SequentialStage.class);

    private final List<Stage> stages;

    public SequentialStage(String name, List<Stage> stages, Metrics metrics) {
        super(name, metrics);
        this.stages = List.copyOf(stages);
    }

    @Override
    protected StageResult execute(TimeWindow window) {
        log.info("Starting {} with {} sequential stages", name(), stages.size());
        int ok = 0;
        int loaded = 0;
        StageResult firstFailure = null;
        for (int i = 0; i < stages.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                return StageResult.failure(ErrorKind.INTERRUPTED, name() + " interrupted before stage " + (i + 1));
            }
            Stage s = stages.get(i);
            log.debug("Running stage {}/{} ({}) in {}", i + 1, stages.size(), s.name(), name());
            StageResult r = runChild(s, window);
            if (r.isOk()) {
                ok++;
                loaded += r.recordsLoaded();
            } else {
                log.warn("Stage {} ({}) failed in {}", i + 1, s.name(), name());
                if (firstFailure == null) firstFailure = r;
            }
        }
        if (firstFailure == null) return StageResult.ok(loaded);
        return StageResult.failure(firstFailure.errorKind().orElse(ErrorKind.UNKNOWN),
                ok + " of " + stages.size() + " stages succeeded; first failure: " + firstFailure.message(),
                firstFailure.cause().orElse(null));
    }

    public List<Stage> stages() { return stages; }
}
