package io.snapshots.sink;

import io.snapshots.core.LoadResult;
import io.snapshots.core.Record;
import io.snapshots.core.UpsertKey;
import io.snapshots.metrics.Metrics;
import io.snapshots.retry.RetryPolicy;
import io.snapshots.transform.Transformers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces stored rows for the incoming keys. Per chunk, inside one transaction: look up the stored versions of
 * all keys with a single query, drop incoming rows older than what is stored, delete the stored rows for the
 * remaining keys, insert the new rows.
 *
 * <p>Assumes a single writer per key set. Two loaders racing on the same keys can both pass the version check.
 */
public class DeleteInsertLoader extends JdbcLoaderSupport {
    private static final Logger log = LoggerFactory.getLogger(DeleteInsertLoader.class);

    public DeleteInsertLoader(TableSchema schema, JdbcTarget target) {
        this(schema, target, DEFAULT_BATCH_SIZE, defaultRetryPolicy(), Metrics.noop(), Clock.systemUTC());
    }

    public DeleteInsertLoader(TableSchema schema, JdbcTarget target, int batchSize, RetryPolicy retryPolicy, Metrics metrics, Clock clock) {
        super(schema, target, batchSize, retryPolicy, metrics, clock);
    }

    @Override
    public LoadResult load(List<Record> records) {
        if (records == null || records.isEmpty()) return LoadResult.empty();
        Prepared prepared = prepare(records);

        // highest version per key wins inside the batch
        Map<UpsertKey.KeyValue, Record> latest = new LinkedHashMap<>();
        String version = schema.versionColumn();
        for (Record r : prepared.records()) {
            latest.merge(schema.key().valuesOf(r), r,
                    (a, b) -> Transformers.compareVersions(b.get(version), a.get(version)) >= 0 ? b : a);
        }
        int duplicates = prepared.records().size() - latest.size();

        LoadResult total = new LoadResult(0, 0, prepared.invalidKeys() + duplicates);
        for (List<Record> chunk : chunks(new ArrayList<>(latest.values()))) {
            total = total.plus(inTransaction("delete/insert", c -> writeChunk(c, chunk)));
        }
        count(total.inserted(), total.updated(), total.skipped());
        log.info("{}: {} inserted, {} replaced, {} skipped", schema.table(), total.inserted(), total.updated(), total.skipped());
        return total;
    }

    private LoadResult writeChunk(Connection c, List<Record> chunk) throws SQLException {
        Map<UpsertKey.KeyValue, Object> stored = storedVersions(c, chunk);
        String version = schema.versionColumn();
        List<Record> toWrite = new ArrayList<>(chunk.size());
        List<Record> replacing = new ArrayList<>();
        int stale = 0;
        for (Record r : chunk) {
            UpsertKey.KeyValue k = schema.key().valuesOf(r);
            if (!stored.containsKey(k)) {
                toWrite.add(r);
            } else if (Transformers.compareVersions(r.get(version), stored.get(k)) >= 0) {
                toWrite.add(r);
                replacing.add(r);
            } else {
                stale++;
            }
        }
        if (stale > 0) log.debug("{}: {} incoming row(s) older than stored versions", schema.table(), stale);

        if (!replacing.isEmpty()) {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + schema.table() + " WHERE " + keyPredicate())) {
                for (Record r : replacing) {
                    bindColumns(ps, 1, r, keyColumns());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }
        insertAll(c, toWrite);
        return new LoadResult(toWrite.size() - replacing.size(), replacing.size(), stale);
    }

    private Map<UpsertKey.KeyValue, Object> storedVersions(Connection c, List<Record> chunk) throws SQLException {
        List<ColumnSpec> keyCols = keyColumns();
        List<String> clauses = new ArrayList<>(chunk.size());
        String predicate = "(" + keyPredicate() + ")";
        for (int i = 0; i < chunk.size(); i++) clauses.add(predicate);
        String sql = "SELECT " + String.join(", ", schema.key().columns()) + ", " + schema.versionColumn()
                + " FROM " + schema.table() + " WHERE " + String.join(" OR ", clauses);

        List<ColumnSpec> resultCols = new ArrayList<>(keyCols);
        resultCols.add(schema.column(schema.versionColumn()));
        Map<UpsertKey.KeyValue, Object> out = new HashMap<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            for (Record r : chunk) idx = bindColumns(ps, idx, r, keyCols);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Record row = readRow(rs, resultCols);
                    out.merge(schema.key().valuesOf(row), row.get(schema.versionColumn()),
                            (a, b) -> Transformers.compareVersions(a, b) >= 0 ? a : b);
                }
            }
        }
        return out;
    }
}
