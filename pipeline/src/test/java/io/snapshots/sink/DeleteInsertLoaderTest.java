package io.snapshots.sink;

import com.codahale.metrics.MetricRegistry;
import io.snapshots.core.LoadResult;
import io.snapshots.core.Record;
import io.snapshots.error.LoadingException;
import io.snapshots.metrics.Metrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;

import static io.snapshots.sink.TestTables.quote;
import static org.junit.jupiter.api.Assertions.*;

public class DeleteInsertLoaderTest {
    private final TableSchema schema = TestTables.hourlyPrices(LoadStrategy.DELETE_INSERT);
    private final MetricRegistry registry = new MetricRegistry();
    private JdbcTarget target;
    private DeleteInsertLoader loader;

    @BeforeEach
    void setup() {
        target = TestTables.freshDatabase("delins");
        loader = new DeleteInsertLoader(schema, target, 2, JdbcLoaderSupport.defaultRetryPolicy(), new Metrics(registry), Clock.systemUTC());
        loader.createTableIfMissing();
    }

    private BigDecimal storedPrice(String symbol) throws Exception {
        try (Connection c = DriverManager.getConnection(target.jdbcUrl());
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT price FROM prices_hourly WHERE symbol = '" + symbol + "'")) {
            assertTrue(rs.next());
            BigDecimal price = rs.getBigDecimal(1);
            assertFalse(rs.next());
            return price;
        }
    }

    @Test
    void loading_the_same_batch_twice_leaves_one_row_per_key() throws Exception {
        List<Record> batch = List.of(
                quote("BTC", "65000.1", "2024-05-10T12:05:00Z", 1L),
                quote("ETH", "3000", "2024-05-10T12:05:00Z", 1L),
                quote("SOL", "150", "2024-05-10T12:05:00Z", 1L));

        LoadResult first = loader.load(batch);
        assertEquals(new LoadResult(3, 0, 0), first);
        LoadResult second = loader.load(batch);
        assertEquals(new LoadResult(0, 3, 0), second);

        assertEquals(3, TestTables.count(target, "SELECT COUNT(*) FROM prices_hourly"));
        assertEquals(3, registry.counter("loader.prices_hourly.inserted").getCount());
        assertEquals(3, registry.counter("loader.prices_hourly.updated").getCount());
    }

    @Test
    void same_hour_snapshots_replace_each_other() throws Exception {
        loader.load(List.of(quote("BTC", "100", "2024-05-10T12:05:00Z", null)));
        loader.load(List.of(quote("BTC", "101", "2024-05-10T12:40:00Z", null)));
        loader.load(List.of(quote("BTC", "102", "2024-05-10T13:01:00Z", null)));

        assertEquals(2, TestTables.count(target, "SELECT COUNT(*) FROM prices_hourly"));
        assertEquals(1, TestTables.count(target, "SELECT COUNT(*) FROM prices_hourly WHERE price = 101"));
        assertEquals(1, TestTables.count(target, "SELECT COUNT(*) FROM prices_hourly WHERE price = 102"));
    }

    @Test
    void highest_version_wins_within_a_batch() throws Exception {
        LoadResult r = loader.load(List.of(
                quote("BTC", "1", "2024-05-10T12:05:00Z", 5L),
                quote("BTC", "2", "2024-05-10T12:06:00Z", 9L),
                quote("BTC", "3", "2024-05-10T12:07:00Z", 7L)));
        assertEquals(new LoadResult(1, 0, 2), r);
        assertEquals(0, new BigDecimal("2").compareTo(storedPrice("BTC")));
    }

    @Test
    void older_version_does_not_overwrite_stored_row() throws Exception {
        loader.load(List.of(quote("BTC", "2", "2024-05-10T12:05:00Z", 10L)));
        LoadResult r = loader.load(List.of(quote("BTC", "1", "2024-05-10T12:05:00Z", 4L)));
        assertEquals(new LoadResult(0, 0, 1), r);
        assertEquals(0, new BigDecimal("2").compareTo(storedPrice("BTC")));
    }

    @Test
    void records_without_key_are_skipped() throws Exception {
        LoadResult r = loader.load(List.of(quote(null, "1", "2024-05-10T12:05:00Z", 1L), quote("", "1", "2024-05-10T12:05:00Z", 1L),
                quote("BTC", "1", "2024-05-10T12:05:00Z", 1L)));
        assertEquals(new LoadResult(1, 0, 2), r);
        assertEquals(2, registry.counter("loader.prices_hourly.skipped").getCount());
    }

    @Test
    void batches_larger_than_chunk_size_are_fully_written() throws Exception {
        List<Record> batch = List.of(
                quote("A", "1", "2024-05-10T12:05:00Z", 1L), quote("B", "1", "2024-05-10T12:05:00Z", 1L),
                quote("C", "1", "2024-05-10T12:05:00Z", 1L), quote("D", "1", "2024-05-10T12:05:00Z", 1L),
                quote("E", "1", "2024-05-10T12:05:00Z", 1L));
        assertEquals(5, loader.load(batch).inserted());
        assertEquals(5, loader.load(batch).updated());
        assertEquals(5, TestTables.count(target, "SELECT COUNT(*) FROM prices_hourly"));
    }

    @Test
    void empty_input_touches_nothing() {
        assertEquals(LoadResult.empty(), loader.load(List.of()));
    }

    @Test
    void missing_table_fails_fast_with_loading_exception() {
        DeleteInsertLoader other = new DeleteInsertLoader(schema, TestTables.freshDatabase("missing"));
        LoadingException e = assertThrows(LoadingException.class,
                () -> other.load(List.of(quote("BTC", "1", "2024-05-10T12:05:00Z", 1L))));
        assertTrue(e.getMessage().contains("fatal"));
    }

    @Test
    void create_table_is_repeatable_and_keyed() {
        loader.createTableIfMissing();
        assertTrue(schema.createTableSql().contains("PRIMARY KEY (symbol, hour_bucket)"));
    }
}
