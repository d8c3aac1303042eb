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
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends every record with its version and leaves duplicate keys in place. Readers see one row per key through
 * {@link #readDeduplicated()}; {@link #compact()} physically removes the superseded rows.
 */
public class VersionedAppendLoader extends JdbcLoaderSupport {
    private static final Logger log = LoggerFactory.getLogger(VersionedAppendLoader.class);

    public VersionedAppendLoader(TableSchema schema, JdbcTarget target) {
        this(schema, target, DEFAULT_BATCH_SIZE, defaultRetryPolicy(), Metrics.noop(), Clock.systemUTC());
    }

    public VersionedAppendLoader(TableSchema schema, JdbcTarget target, int batchSize, RetryPolicy retryPolicy, Metrics metrics, Clock clock) {
        super(schema, target, batchSize, retryPolicy, metrics, clock);
    }

    @Override
    public LoadResult load(List<Record> records) {
        if (records == null || records.isEmpty()) return LoadResult.empty();
        Prepared prepared = prepare(records);
        int written = 0;
        for (List<Record> chunk : chunks(prepared.records())) {
            written += inTransaction("append", c -> insertAll(c, chunk));
        }
        count(written, 0, prepared.invalidKeys());
        log.info("{}: appended {} rows, {} skipped", schema.table(), written, prepared.invalidKeys());
        return new LoadResult(written, 0, prepared.invalidKeys());
    }

    /**
     * Keeps only the highest-version row of every key. Among rows sharing the highest version the last one read
     * survives. Safe to run while other writers append.
     *
     * @return number of rows removed
     */
    public int compact() {
        List<Record> duplicatedKeys = withRetry("find duplicates", this::duplicatedKeys);
        if (duplicatedKeys.isEmpty()) {
            log.debug("{}: nothing to compact", schema.table());
            return 0;
        }
        int removed = 0;
        for (List<Record> chunk : chunks(duplicatedKeys)) {
            removed += inTransaction("compact", c -> compactKeys(c, chunk));
        }
        log.info("{}: compaction removed {} superseded rows across {} keys", schema.table(), removed, duplicatedKeys.size());
        return removed;
    }

    /** Highest-version row per key, in first-seen order, without modifying the table. */
    public List<Record> readDeduplicated() {
        return withRetry("read", c -> {
            try (Statement s = c.createStatement();
                 ResultSet rs = s.executeQuery("SELECT " + String.join(", ", schema.columnNames()) + " FROM " + schema.table())) {
                Map<UpsertKey.KeyValue, Record> latest = new LinkedHashMap<>();
                while (rs.next()) keepLatest(latest, readRow(rs, schema.columns()));
                return new ArrayList<>(latest.values());
            }
        });
    }

    /** Row count including superseded rows. */
    public long rawRowCount() {
        return withRetry("count", c -> {
            try (Statement s = c.createStatement(); ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM " + schema.table())) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }

    private List<Record> duplicatedKeys(Connection c) throws SQLException {
        String keys = String.join(", ", schema.key().columns());
        String sql = "SELECT " + keys + " FROM " + schema.table() + " GROUP BY " + keys + " HAVING COUNT(*) > 1";
        List<Record> out = new ArrayList<>();
        try (Statement s = c.createStatement(); ResultSet rs = s.executeQuery(sql)) {
            while (rs.next()) out.add(readRow(rs, keyColumns()));
        }
        return out;
    }

    /*
     * Deletes only rows below the key's current maximum version, evaluated by the database in the same statement,
     * so a row appended concurrently is never removed. Rows tied at the maximum are then collapsed to one.
     */
    private int compactKeys(Connection c, List<Record> keys) throws SQLException {
        String table = schema.table();
        String version = schema.versionColumn();
        String maxVersion = "(SELECT MAX(" + version + ") FROM " + table + " WHERE " + keyPredicate() + ")";
        List<ColumnSpec> keyCols = keyColumns();
        int removed = 0;
        try (PreparedStatement superseded = c.prepareStatement(
                     "DELETE FROM " + table + " WHERE " + keyPredicate() + " AND " + version + " < " + maxVersion);
             PreparedStatement top = c.prepareStatement("SELECT " + String.join(", ", schema.columnNames()) + " FROM "
                     + table + " WHERE " + keyPredicate() + " AND " + version + " = " + maxVersion);
             PreparedStatement ties = c.prepareStatement(
                     "DELETE FROM " + table + " WHERE " + keyPredicate() + " AND " + version + " = ?")) {
            for (Record k : keys) {
                bindColumns(superseded, bindColumns(superseded, 1, k, keyCols), k, keyCols);
                removed += superseded.executeUpdate();

                bindColumns(top, bindColumns(top, 1, k, keyCols), k, keyCols);
                Map<UpsertKey.KeyValue, Record> latest = new LinkedHashMap<>();
                int tied = 0;
                try (ResultSet rs = top.executeQuery()) {
                    while (rs.next()) {
                        keepLatest(latest, readRow(rs, schema.columns()));
                        tied++;
                    }
                }
                if (tied < 2) continue;
                Record keep = latest.values().iterator().next();
                int next = bindColumns(ties, 1, k, keyCols);
                ColumnType.LONG.bind(ties, next, keep.get(version));
                removed += ties.executeUpdate() - insertAll(c, List.of(keep));
            }
        }
        return removed;
    }

    private void keepLatest(Map<UpsertKey.KeyValue, Record> latest, Record row) {
        String version = schema.versionColumn();
        latest.merge(schema.key().valuesOf(row), row,
                (a, b) -> Transformers.compareVersions(b.get(version), a.get(version)) >= 0 ? b : a);
    }
}
