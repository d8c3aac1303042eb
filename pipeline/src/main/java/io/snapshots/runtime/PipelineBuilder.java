package io.snapshots.runtime;

import com.codahale.metrics.MetricRegistry;
import io.snapshots.core.Extractor;
import io.snapshots.core.Loader;
import io.snapshots.core.Stage;
import io.snapshots.core.Transformer;
import io.snapshots.metrics.Metrics;
import io.snapshots.retry.RetryPolicy;
import io.snapshots.transform.TransformChain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a single extract/transform/load stage, optionally wrapped in a retry.
 */
public class PipelineBuilder {
    private String name;
    private Extractor extractor;
    private final List<Transformer> transformers = new ArrayList<>();
    private Loader loader;
    private RetryPolicy retryPolicy;
    private MetricRegistry metricRegistry = new MetricRegistry();

    public PipelineBuilder name(String n) { this.name = n; return this; }
    public PipelineBuilder extract(Extractor e) { this.extractor = e; return this; }
    public PipelineBuilder transform(Transformer t) { this.transformers.add(Objects.requireNonNull(t, "transformer")); return this; }
    public PipelineBuilder load(Loader l) { this.loader = l; return this; }
    public PipelineBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public PipelineBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public Stage build() {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(extractor, "extractor");
        Objects.requireNonNull(loader, "loader");
        Metrics metrics = new Metrics(metricRegistry);
        Transformer transformer = switch (transformers.size()) {
            case 0 -> null;
            case 1 -> transformers.get(0);
            default -> new TransformChain(transformers.toArray(new Transformer[0]));
        };
        Stage stage = new ExtractLoadStage(name, extractor, transformer, loader, metrics);
        return retryPolicy == null ? stage : new RetryStage("retry(" + name + ")", stage, retryPolicy, metrics);
    }
}
