package io.snapshots.sink;

import com.codahale.metrics.Counter;
import io.snapshots.core.ErrorKind;
import io.snapshots.core.Record;
import io.snapshots.error.LoadingException;
import io.snapshots.error.PipelineException;
import io.snapshots.metrics.Metrics;
import io.snapshots.retry.ExponentialBackoffRetryPolicy;
import io.snapshots.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared JDBC plumbing of the idempotent loaders: coercion, key validation, fixed-size chunks written in one
 * transaction each, and retries of transient SQL failures.
 */
public abstract class JdbcLoaderSupport implements IdempotentLoader {
    private static final Logger log = LoggerFactory.getLogger(JdbcLoaderSupport.class);

    public static final int DEFAULT_BATCH_SIZE = 500;

    protected final TableSchema schema;
    protected final JdbcTarget target;
    protected final RecordCoercer coercer;
    protected final int batchSize;
    private final RetryPolicy retryPolicy;
    protected final Counter inserted;
    protected final Counter updated;
    protected final Counter skipped;

    protected JdbcLoaderSupport(TableSchema schema, JdbcTarget target, int batchSize, RetryPolicy retryPolicy, Metrics metrics, Clock clock) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.target = Objects.requireNonNull(target, "target");
        this.coercer = new RecordCoercer(schema, clock);
        this.batchSize = Math.max(1, batchSize);
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        String key = "loader." + Metrics.sanitize(schema.table());
        this.inserted = metrics.counter(key + ".inserted");
        this.updated = metrics.counter(key + ".updated");
        this.skipped = metrics.counter(key + ".skipped");
    }

    /** Three attempts with exponential backoff, transient SQL failures only. */
    public static RetryPolicy defaultRetryPolicy() {
        return new ExponentialBackoffRetryPolicy(3, 200, 5_000, e -> e instanceof SQLException s && SqlErrors.isTransient(s));
    }

    @Override
    public TableSchema schema() { return schema; }

    @Override
    public void createTableIfMissing() {
        withRetry("create table", c -> {
            try (Statement s = c.createStatement()) {
                s.execute(schema.createTableSql());
            }
            return null;
        });
    }

    /** Coerced records with a complete key, plus how many were dropped for an incomplete one. */
    protected Prepared prepare(List<Record> records) {
        List<Record> valid = new ArrayList<>(records.size());
        int invalid = 0;
        for (Record r : records) {
            Record c = coercer.coerce(r);
            if (schema.key().isComplete(c)) {
                valid.add(c);
            } else {
                invalid++;
            }
        }
        if (invalid > 0) log.warn("{}: skipped {} record(s) with a missing key {}", schema.table(), invalid, schema.key().columns());
        return new Prepared(valid, invalid);
    }

    protected record Prepared(List<Record> records, int invalidKeys) {}

    protected <T> List<List<T>> chunks(List<T> items) {
        if (items.isEmpty()) return Collections.emptyList();
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            out.add(items.subList(i, Math.min(items.size(), i + batchSize)));
        }
        return out;
    }

    @FunctionalInterface
    protected interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }

    /** Runs {@code work} on a fresh connection inside one transaction, retrying transient failures. */
    protected <T> T inTransaction(String op, SqlWork<T> work) {
        return withRetry(op, c -> {
            c.setAutoCommit(false);
            try {
                T out = work.apply(c);
                c.commit();
                return out;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        });
    }

    protected <T> T withRetry(String op, SqlWork<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try (Connection c = target.connect()) {
                return work.apply(c);
            } catch (SQLException e) {
                boolean retry = SqlErrors.isTransient(e) && retryPolicy.shouldRetry(attempt, e);
                if (!retry) {
                    String why = SqlErrors.isFatal(e) ? "fatal" : "failed after " + attempt + " attempt(s)";
                    throw new LoadingException(schema.table() + ": " + op + " " + why + ": " + e.getMessage(), e);
                }
                long backoff = retryPolicy.backoffMillis(attempt);
                log.warn("{}: {} attempt {} failed with SQLState {} ({}), retrying in {} ms",
                        schema.table(), op, attempt, e.getSQLState(), e.getMessage(), backoff);
                if (!sleepQuiet(backoff)) {
                    throw new PipelineException(ErrorKind.INTERRUPTED, schema.table() + ": " + op + " interrupted while waiting to retry", e);
                }
            }
        }
    }

    protected String insertSql() {
        List<String> cols = schema.columnNames();
        return "INSERT INTO " + schema.table() + " (" + String.join(", ", cols) + ") VALUES ("
                + String.join(", ", Collections.nCopies(cols.size(), "?")) + ")";
    }

    protected int insertAll(Connection c, List<Record> rows) throws SQLException {
        if (rows.isEmpty()) return 0;
        try (PreparedStatement ps = c.prepareStatement(insertSql())) {
            for (Record r : rows) {
                bindColumns(ps, 1, r, schema.columns());
                ps.addBatch();
            }
            ps.executeBatch();
        }
        return rows.size();
    }

    /** Binds the given columns of {@code r} starting at {@code index}; returns the next free index. */
    protected int bindColumns(PreparedStatement ps, int index, Record r, List<ColumnSpec> cols) throws SQLException {
        for (ColumnSpec col : cols) {
            col.type().bind(ps, index++, r.get(col.name()));
        }
        return index;
    }

    protected List<ColumnSpec> keyColumns() {
        List<ColumnSpec> out = new ArrayList<>();
        for (String k : schema.key().columns()) out.add(schema.column(k));
        return out;
    }

    /** {@code k1 = ? AND k2 = ?} over the upsert key. */
    protected String keyPredicate() {
        List<String> parts = new ArrayList<>();
        for (String k : schema.key().columns()) parts.add(k + " = ?");
        return String.join(" AND ", parts);
    }

    protected Record readRow(ResultSet rs, List<ColumnSpec> cols) throws SQLException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < cols.size(); i++) {
            values.put(cols.get(i).name(), cols.get(i).type().read(rs, i + 1));
        }
        return Record.of(values);
    }

    protected void count(int ins, int upd, int skip) {
        inserted.inc(ins);
        updated.inc(upd);
        skipped.inc(skip);
    }

    private static boolean sleepQuiet(long ms) {
        try { Thread.sleep(ms); return true; } catch (InterruptedException ie) { Thread.currentThread().interrupt(); return false; }
    }
}
