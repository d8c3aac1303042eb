package io.snapshots.runtime;

import io.snapshots.core.Stage;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Runs one of two branches depending on a predicate over the window. A false predicate with no false
 * branch is a successful no-op.
 */
public class ConditionalStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(ConditionalStage.class);

    private final Predicate<TimeWindow> condition;
    private final Stage whenTrue;
    private final Stage whenFalse;

    public ConditionalStage(String name, Predicate<TimeWindow> condition, Stage whenTrue, Stage whenFalse, Metrics metrics) {
        super(name, metrics);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.whenTrue = Objects.requireNonNull(whenTrue, "whenTrue");
        this.whenFalse = whenFalse;
    }

    @Override
    protected StageResult execute(TimeWindow window) {
        if (condition.test(window)) {
            log.info("{}: condition met, running {}", name(), whenTrue.name());
            return runChild(whenTrue, window);
        }
        if (whenFalse == null) {
            log.info("{}: condition not met and no false branch", name());
            return StageResult.nothingToDo();
        }
        log.info("{}: condition not met, running {}", name(), whenFalse.name());
        return runChild(whenFalse, window);
    }
}
