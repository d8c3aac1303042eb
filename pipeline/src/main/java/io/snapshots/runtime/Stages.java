package io.snapshots.runtime;

import io.snapshots.core.Extractor;
import io.snapshots.core.Loader;
import io.snapshots.core.Stage;
import io.snapshots.core.TimeWindow;
import io.snapshots.core.Transformer;
import io.snapshots.metrics.Metrics;
import io.snapshots.retry.FixedDelayRetryPolicy;
import io.snapshots.retry.RetryPolicy;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.function.Predicate;

/**
 * Factory for stage combinators sharing one metrics registry.
 */
public final class Stages {
    private final Metrics metrics;

    public Stages(Metrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static Stages defaults() { return new Stages(Metrics.noop()); }

    public Stage el(String name, Extractor extractor, Loader loader) {
        return new ExtractLoadStage(name, extractor, null, loader, metrics);
    }

    public Stage etl(String name, Extractor extractor, Transformer transformer, Loader loader) {
        return new ExtractLoadStage(name, extractor, Objects.requireNonNull(transformer, "transformer"), loader, metrics);
    }

    public Stage parallel(String name, Stage... stages) {
        return new ParallelStage(name, List.of(stages), null, metrics);
    }

    public Stage parallel(String name, List<Stage> stages, ExecutorService executor) {
        return new ParallelStage(name, stages, executor, metrics);
    }

    public Stage sequential(String name, Stage... stages) {
        return new SequentialStage(name, List.of(stages), metrics);
    }

    public Stage conditional(String name, Predicate<TimeWindow> condition, Stage whenTrue) {
        return new ConditionalStage(name, condition, whenTrue, null, metrics);
    }

    public Stage conditional(String name, Predicate<TimeWindow> condition, Stage whenTrue, Stage whenFalse) {
        return new ConditionalStage(name, condition, whenTrue, whenFalse, metrics);
    }

    /** At most {@code maxRetries} re-runs after the first attempt, {@code delayMillis} apart. */
    public Stage retry(Stage stage, int maxRetries, long delayMillis) {
        return retry(stage, FixedDelayRetryPolicy.retries(maxRetries, delayMillis));
    }

    public Stage retry(Stage stage, RetryPolicy policy) {
        return new RetryStage("retry(" + stage.name() + ")", stage, policy, metrics);
    }

    public Metrics metrics() { return metrics; }
}
