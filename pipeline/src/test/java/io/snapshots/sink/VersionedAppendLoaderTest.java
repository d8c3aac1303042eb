package io.snapshots.sink;

import io.snapshots.core.LoadResult;
import io.snapshots.core.Record;
import io.snapshots.metrics.Metrics;
import org.h2.api.Trigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static io.snapshots.sink.TestTables.quote;
import static org.junit.jupiter.api.Assertions.*;

public class VersionedAppendLoaderTest {
    private final TableSchema schema = TestTables.hourlyPrices(LoadStrategy.VERSIONED_APPEND);
    private JdbcTarget target;
    private VersionedAppendLoader loader;

    /**
     * Appends version 99 of BTC and ETH through a second loader, on its own connection, when the table is queried
     * for the third time after being armed.
     */
    public static final class ConcurrentAppender implements Trigger {
        static final AtomicInteger selects = new AtomicInteger(-1);
        static volatile VersionedAppendLoader writer;

        @Override
        public void init(Connection conn, String schemaName, String triggerName, String tableName, boolean before, int type) {
        }

        @Override
        public void fire(Connection conn, Object[] oldRow, Object[] newRow) {
            if (selects.get() < 0 || selects.incrementAndGet() != 3) return;
            writer.load(List.of(
                    quote("BTC", "99", "2024-05-10T12:05:00Z", 99L),
                    quote("ETH", "99", "2024-05-10T12:05:00Z", 99L)));
        }

        @Override
        public void close() {
        }

        @Override
        public void remove() {
        }
    }

    @AfterEach
    void disarm() {
        ConcurrentAppender.selects.set(-1);
        ConcurrentAppender.writer = null;
    }

    @BeforeEach
    void setup() {
        target = TestTables.freshDatabase("append");
        loader = new VersionedAppendLoader(schema, target, 2, JdbcLoaderSupport.defaultRetryPolicy(), Metrics.noop(), Clock.systemUTC());
        loader.createTableIfMissing();
    }

    @Test
    void reruns_append_but_deduplicated_view_is_stable() {
        List<Record> batch = List.of(
                quote("BTC", "65000", "2024-05-10T12:05:00Z", null),
                quote("ETH", "3000", "2024-05-10T12:05:00Z", null),
                quote("SOL", "150", "2024-05-10T12:05:00Z", null));
        assertEquals(LoadResult.inserted(3), loader.load(batch));
        loader.load(batch);

        assertEquals(6, loader.rawRowCount());
        assertEquals(3, loader.readDeduplicated().size());

        assertEquals(3, loader.compact());
        assertEquals(3, loader.rawRowCount());
        assertEquals(0, loader.compact());
    }

    @Test
    void highest_version_survives_compaction() {
        loader.load(List.of(quote("BTC", "1", "2024-05-10T12:05:00Z", null)));
        loader.load(List.of(quote("BTC", "3", "2024-05-10T12:50:00Z", null)));
        loader.load(List.of(quote("BTC", "2", "2024-05-10T12:20:00Z", null)));

        List<Record> view = loader.readDeduplicated();
        assertEquals(1, view.size());
        assertEquals(0, new BigDecimal("3").compareTo((BigDecimal) view.get(0).get("price")));

        assertEquals(2, loader.compact());
        List<Record> after = loader.readDeduplicated();
        assertEquals(1, loader.rawRowCount());
        assertEquals(view, after);
    }

    @Test
    void equal_versions_collapse_to_the_last_row_read() {
        loader.load(List.of(quote("BTC", "1", "2024-05-10T12:05:00Z", 7L)));
        loader.load(List.of(quote("BTC", "2", "2024-05-10T12:06:00Z", 7L)));
        assertEquals(0, new BigDecimal("2").compareTo((BigDecimal) loader.readDeduplicated().get(0).get("price")));

        assertEquals(1, loader.compact());

        assertEquals(1, loader.rawRowCount());
        assertEquals(7L, loader.readDeduplicated().get(0).get("version"));
        assertEquals(0, new BigDecimal("2").compareTo((BigDecimal) loader.readDeduplicated().get(0).get("price")));
    }

    @Test
    void compaction_keeps_rows_appended_while_it_runs() throws Exception {
        for (long v = 1; v <= 2; v++) {
            loader.load(List.of(
                    quote("BTC", String.valueOf(v), "2024-05-10T12:05:00Z", v),
                    quote("ETH", String.valueOf(v), "2024-05-10T12:05:00Z", v)));
        }
        try (Connection c = target.connect(); Statement s = c.createStatement()) {
            s.execute("CREATE TRIGGER concurrent_append BEFORE SELECT ON " + schema.table()
                    + " CALL '" + ConcurrentAppender.class.getName() + "'");
        }
        ConcurrentAppender.writer = new VersionedAppendLoader(schema, target);
        ConcurrentAppender.selects.set(0);

        loader.compact();

        assertTrue(ConcurrentAppender.selects.get() >= 3, "second writer never ran");
        ConcurrentAppender.selects.set(-1);
        Map<String, Object> versions = loader.readDeduplicated().stream()
                .collect(Collectors.toMap(r -> r.getString("symbol"), r -> r.get("version")));
        assertEquals(Map.of("BTC", 99L, "ETH", 99L), versions);
        assertEquals(0, new BigDecimal("99").compareTo((BigDecimal) loader.readDeduplicated().get(0).get("price")));
    }

    @Test
    void different_buckets_are_different_keys() {
        loader.load(List.of(quote("BTC", "1", "2024-05-10T12:05:00Z", null), quote("BTC", "2", "2024-05-10T13:05:00Z", null)));
        assertEquals(2, loader.readDeduplicated().size());
        assertEquals(0, loader.compact());
    }

    @Test
    void records_without_key_are_skipped() {
        assertEquals(new LoadResult(1, 0, 1), loader.load(List.of(quote(null, "1", null, null), quote("BTC", "1", null, null))));
    }

    @Test
    void compactor_runs_every_table() {
        loader.load(List.of(quote("BTC", "1", "2024-05-10T12:05:00Z", 1L)));
        loader.load(List.of(quote("BTC", "1", "2024-05-10T12:05:00Z", 2L)));
        try (Compactor compactor = new Compactor(List.of(loader))) {
            assertEquals(1, compactor.compactAll());
        }
        assertEquals(1, loader.rawRowCount());
    }

    @Test
    void strategy_selects_loader_type() {
        assertInstanceOf(VersionedAppendLoader.class, IdempotentLoaders.forSchema(schema, target));
        assertInstanceOf(DeleteInsertLoader.class, IdempotentLoaders.forSchema(TestTables.hourlyPrices(LoadStrategy.DELETE_INSERT), target));
    }
}
