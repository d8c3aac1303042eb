package io.snapshots.runtime;

import io.snapshots.core.ErrorKind;
import io.snapshots.core.Extractor;
import io.snapshots.core.LoadResult;
import io.snapshots.core.Loader;
import io.snapshots.core.Record;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.core.Transformer;
import io.snapshots.error.PipelineException;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Extract, optionally transform, then load. An empty extraction or an empty transform result is a
 * successful no-op and the loader is not called.
 */
public class ExtractLoadStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(ExtractLoadStage.class);

    private final Extractor extractor;
    private final Transformer transformer; // null for EL
    private final Loader loader;

    public ExtractLoadStage(String name, Extractor extractor, Transformer transformer, Loader loader, Metrics metrics) {
        super(name, metrics);
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.transformer = transformer;
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    protected StageResult execute(TimeWindow window) {
        log.info("Starting {} ({}) for {} window {} .. {}", name(), transformer == null ? "EL" : "ETL",
                window.mode(), window.start(), window.end());
        List<Record> records;
        try {
            records = extractor.extract(window);
        } catch (Exception e) {
            return phaseFailure(ErrorKind.EXTRACTION, "extract", e);
        }
        if (records == null || records.isEmpty()) {
            log.info("{}: no data extracted", name());
            return StageResult.nothingToDo();
        }
        log.info("{}: extracted {} records", name(), records.size());

        if (transformer != null) {
            try {
                records = transformer.transform(records);
            } catch (Exception e) {
                return phaseFailure(ErrorKind.TRANSFORMATION, "transform", e);
            }
            if (records == null || records.isEmpty()) {
                log.info("{}: no data after transformation", name());
                return StageResult.nothingToDo();
            }
        }

        LoadResult loaded;
        try {
            loaded = loader.load(records);
        } catch (Exception e) {
            return phaseFailure(ErrorKind.LOADING, "load", e);
        }
        if (loaded == null) loaded = LoadResult.empty();
        log.info("{}: loaded {} records (inserted={}, updated={}, skipped={})", name(), loaded.written(),
                loaded.inserted(), loaded.updated(), loaded.skipped());
        return StageResult.ok(loaded.written());
    }

    private StageResult phaseFailure(ErrorKind defaultKind, String phase, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return StageResult.failure(ErrorKind.INTERRUPTED, phase + " interrupted", e);
        }
        ErrorKind kind = (e instanceof PipelineException pe) ? pe.kind() : defaultKind;
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return StageResult.failure(kind, phase + " failed: " + msg, e);
    }

    public boolean hasTransformer() { return transformer != null; }
}
