package io.snapshots.transform;

import io.snapshots.core.Record;
import io.snapshots.core.Transformer;

import java.util.List;

/**
 * Sequentially applies multiple transformers. Stops early once a step leaves nothing to pass on.
 */
public class TransformChain implements Transformer {
    private final List<Transformer> steps;

    public TransformChain(Transformer... steps) {
        this.steps = List.of(steps);
    }

    @Override
    public List<Record> transform(List<Record> records) throws Exception {
        List<Record> current = records;
        for (Transformer step : steps) {
            if (current == null || current.isEmpty()) return List.of();
            current = step.transform(current);
        }
        return current == null ? List.of() : current;
    }

    public int size() { return steps.size(); }
}
