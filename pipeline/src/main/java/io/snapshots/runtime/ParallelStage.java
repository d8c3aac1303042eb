package io.snapshots.runtime;

import io.snapshots.core.ErrorKind;
import io.snapshots.core.Stage;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts all children together and waits for all of them. Succeeds when at least one child succeeded; a
 * failing or throwing child never aborts its siblings.
 */
public class ParallelStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(ParallelStage.class);

    private final List<Stage> stages;
    private final ExecutorService executor; // null: a pool per run

    public ParallelStage(String name, List<Stage> stages, ExecutorService executor, Metrics metrics) {
        super(name, metrics);
        this.stages = List.copyOf(stages);
        this.executor = executor;
    }

    @Override
    protected StageResult execute(TimeWindow window) {
        if (stages.isEmpty()) return StageResult.nothingToDo();
        log.info("Starting {} with {} parallel stages", name(), stages.size());
        ExecutorService pool = executor != null ? executor : newPool(stages.size());
        List<CompletableFuture<StageResult>> futures = new ArrayList<>(stages.size());
        try {
            for (Stage s : stages) {
                futures.add(CompletableFuture.supplyAsync(() -> runChild(s, window), pool)
                        .exceptionally(StageResult::fromException));
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
            } catch (InterruptedException ie) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                return StageResult.failure(ErrorKind.INTERRUPTED, name() + " interrupted while waiting for children");
            } catch (ExecutionException ignored) {
                // each child future already maps its failure to a result
            }
        } finally {
            if (executor == null) pool.shutdownNow();
        }

        int ok = 0;
        int loaded = 0;
        StageResult firstFailure = null;
        for (CompletableFuture<StageResult> f : futures) {
            StageResult r = f.getNow(StageResult.failure(ErrorKind.UNKNOWN, "stage did not complete"));
            if (r.isOk()) {
                ok++;
                loaded += r.recordsLoaded();
            } else if (firstFailure == null) {
                firstFailure = r;
            }
        }
        int failed = stages.size() - ok;
        if (failed == 0) {
            log.info("All {} stages in {} completed", stages.size(), name());
            return StageResult.ok(loaded);
        }
        log.warn("{} of {} stages failed in {}", failed, stages.size(), name());
        if (ok > 0) return StageResult.ok(loaded);
        return StageResult.failure(firstFailure.errorKind().orElse(ErrorKind.UNKNOWN),
                "all " + stages.size() + " parallel stages failed; first: " + firstFailure.message(),
                firstFailure.cause().orElse(null));
    }

    private ExecutorService newPool(int n) {
        AtomicInteger idx = new AtomicInteger();
        String prefix = "parallel-" + Metrics.sanitize(name()) + "-";
        return Executors.newFixedThreadPool(n, r -> {
            Thread t = new Thread(r, prefix + idx.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public List<Stage> stages() { return stages; }
}
