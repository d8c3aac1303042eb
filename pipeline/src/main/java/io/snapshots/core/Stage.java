package io.snapshots.core;

/**
 * A runnable unit of a pipeline. Implementations never throw: every failure is logged and reported as a
 * failed {@link StageResult}.
 */
public interface Stage {
    StageResult run(TimeWindow window);

    String name();
}
