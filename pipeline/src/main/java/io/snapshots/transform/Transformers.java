package io.snapshots.transform;

import io.snapshots.core.Record;
import io.snapshots.core.Transformer;
import io.snapshots.core.UpsertKey;
import io.snapshots.error.TransformationException;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ready-made transformers and record functions.
 */
public final class Transformers {
    private static final Logger log = LoggerFactory.getLogger(Transformers.class);

    private Transformers() {}

    public static Transformer perRecord(String name, RecordFunction fn) {
        return new PerRecordTransformer(name, fn, Metrics.noop());
    }

    public static Transformer perRecord(String name, RecordFunction fn, Metrics metrics) {
        return new PerRecordTransformer(name, fn, metrics);
    }

    public static Transformer chain(Transformer... steps) {
        return new TransformChain(steps);
    }

    public static RecordFunction selectFields(List<String> fields) {
        List<String> copy = List.copyOf(fields);
        return r -> r.select(copy);
    }

    /** Renames columns in place; columns not in the mapping keep their name and position. */
    public static RecordFunction renameFields(Map<String, String> mapping) {
        Map<String, String> copy = Map.copyOf(mapping);
        return r -> {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : r.asMap().entrySet()) {
                out.put(copy.getOrDefault(e.getKey(), e.getKey()), e.getValue());
            }
            return Record.of(out);
        };
    }

    /** Fails the record with a {@link TransformationException} when a field is missing or null. */
    public static RecordFunction requireFields(List<String> fields) {
        List<String> copy = List.copyOf(fields);
        return r -> {
            for (String f : copy) {
                if (r.get(f) == null) throw new TransformationException("missing required field '" + f + "'");
            }
            return r;
        };
    }

    public static RecordFunction addProcessedAt(Clock clock) {
        return r -> r.with("_processed_at", clock.instant());
    }

    /** Tags each record with {@code merged_at}, {@code merge_status} and {@code pipeline_name}. */
    public static RecordFunction addMergeMetadata(String pipelineName, Clock clock) {
        return r -> r.with("merged_at", clock.instant())
                .with("merge_status", "success")
                .with("pipeline_name", pipelineName);
    }

    /**
     * Keeps one record per key: the one with the highest {@code versionColumn}; ties keep the later record.
     * Records with an incomplete key are dropped. Output keeps first-seen key order.
     */
    public static Transformer deduplicate(UpsertKey key, String versionColumn) {
        return records -> {
            Map<UpsertKey.KeyValue, Record> best = new LinkedHashMap<>();
            int incomplete = 0;
            for (Record r : records) {
                if (!key.isComplete(r)) { incomplete++; continue; }
                best.merge(key.valuesOf(r), r, (a, b) -> compareVersions(b.get(versionColumn), a.get(versionColumn)) >= 0 ? b : a);
            }
            if (incomplete > 0) log.warn("Deduplicate dropped {} record(s) with incomplete key {}", incomplete, key.columns());
            return new ArrayList<>(best.values());
        };
    }

    /** Orders version values: numbers by value, instants and strings naturally, null lowest. */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareVersions(Object a, Object b) {
        if (a == null && b == null) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        if (a instanceof Number na && b instanceof Number nb) {
            if (isIntegral(na) && isIntegral(nb)) return Long.compare(na.longValue(), nb.longValue());
            return Double.compare(na.doubleValue(), nb.doubleValue());
        }
        if (a instanceof Comparable ca && a.getClass().isInstance(b)) return ca.compareTo(b);
        return a.toString().compareTo(b.toString());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }
}
