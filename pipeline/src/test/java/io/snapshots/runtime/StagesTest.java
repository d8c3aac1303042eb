package io.snapshots.runtime;

import com.codahale.metrics.MetricRegistry;
import io.snapshots.core.ErrorKind;
import io.snapshots.core.Extractor;
import io.snapshots.core.LoadResult;
import io.snapshots.core.Loader;
import io.snapshots.core.Record;
import io.snapshots.core.Stage;
import io.snapshots.core.StageResult;
import io.snapshots.core.TimeWindow;
import io.snapshots.error.ExtractionException;
import io.snapshots.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class StagesTest {
    private static final TimeWindow WINDOW = TimeWindow.incremental(Instant.parse("2024-05-10T11:00:00Z"), Instant.parse("2024-05-10T12:00:00Z"));

    private final MetricRegistry registry = new MetricRegistry();
    private final Stages stages = new Stages(new Metrics(registry));

    static final class RecordingLoader implements Loader {
        final List<List<Record>> calls = new ArrayList<>();

        @Override
        public LoadResult load(List<Record> records) {
            calls.add(records);
            return LoadResult.inserted(records.size());
        }
    }

    private static Stage fixed(String name, StageResult result, AtomicInteger calls) {
        return new Stage() {
            @Override
            public StageResult run(TimeWindow window) {
                calls.incrementAndGet();
                return result;
            }

            @Override
            public String name() { return name; }
        };
    }

    private static Record rec(String symbol) {
        return Record.builder().put("symbol", symbol).build();
    }

    @Test
    void el_with_empty_extraction_succeeds_without_loading() {
        RecordingLoader loader = new RecordingLoader();
        StageResult r = stages.el("empty", w -> List.of(), loader).run(WINDOW);
        assertTrue(r.isOk());
        assertEquals(0, r.recordsLoaded());
        assertTrue(loader.calls.isEmpty());
    }

    @Test
    void el_loads_what_was_extracted() {
        RecordingLoader loader = new RecordingLoader();
        StageResult r = stages.el("two", w -> List.of(rec("BTC"), rec("ETH")), loader).run(WINDOW);
        assertTrue(r.isOk());
        assertEquals(2, r.recordsLoaded());
        assertEquals(1, loader.calls.size());
        assertEquals(1, registry.timer("stage.two.time").getCount());
    }

    @Test
    void etl_with_empty_transform_succeeds_without_loading() {
        RecordingLoader loader = new RecordingLoader();
        StageResult r = stages.etl("filtered", w -> List.of(rec("BTC")), records -> List.of(), loader).run(WINDOW);
        assertTrue(r.isOk());
        assertTrue(loader.calls.isEmpty());
    }

    @Test
    void etl_passes_transformed_records_to_loader() {
        RecordingLoader loader = new RecordingLoader();
        StageResult r = stages.etl("upper", w -> List.of(rec("btc")),
                records -> List.of(records.get(0).with("symbol", "BTC")), loader).run(WINDOW);
        assertTrue(r.isOk());
        assertEquals("BTC", loader.calls.get(0).get(0).get("symbol"));
    }

    @Test
    void extractor_exception_becomes_failure_with_kind() {
        Extractor broken = w -> { throw new IllegalStateException("api down"); };
        StageResult r = stages.el("broken", broken, new RecordingLoader()).run(WINDOW);
        assertFalse(r.isOk());
        assertEquals(ErrorKind.EXTRACTION, r.errorKind().orElseThrow());
        assertTrue(r.message().contains("api down"));
        assertEquals(1, registry.meter("stage.broken.failures").getCount());
    }

    @Test
    void loader_exception_becomes_loading_failure() {
        Loader broken = records -> { throw new java.sql.SQLException("disk full"); };
        StageResult r = stages.el("load", w -> List.of(rec("BTC")), broken).run(WINDOW);
        assertEquals(ErrorKind.LOADING, r.errorKind().orElseThrow());
    }

    @Test
    void pipeline_exception_keeps_its_kind() {
        Extractor broken = w -> { throw new ExtractionException("bad page"); };
        StageResult r = stages.etl("x", broken, records -> records, new RecordingLoader()).run(WINDOW);
        assertEquals(ErrorKind.EXTRACTION, r.errorKind().orElseThrow());
    }

    @Test
    void parallel_succeeds_when_one_child_succeeds() {
        AtomicInteger calls = new AtomicInteger();
        Stage ok = fixed("ok", StageResult.ok(3), calls);
        Stage bad = fixed("bad", StageResult.failure(ErrorKind.EXTRACTION, "nope"), calls);
        Stage throwing = new Stage() {
            @Override
            public StageResult run(TimeWindow window) {
                calls.incrementAndGet();
                throw new IllegalStateException("boom");
            }

            @Override
            public String name() { return "throwing"; }
        };
        StageResult r = stages.parallel("p", ok, bad, throwing).run(WINDOW);
        assertTrue(r.isOk());
        assertEquals(3, r.recordsLoaded());
        assertEquals(3, calls.get());
    }

    @Test
    void parallel_fails_when_all_children_fail() {
        AtomicInteger calls = new AtomicInteger();
        StageResult r = stages.parallel("p",
                fixed("a", StageResult.failure(ErrorKind.LOADING, "a"), calls),
                fixed("b", StageResult.failure(ErrorKind.LOADING, "b"), calls)).run(WINDOW);
        assertFalse(r.isOk());
        assertEquals(ErrorKind.LOADING, r.errorKind().orElseThrow());
        assertEquals(2, calls.get());
    }

    @Test
    void parallel_children_run_concurrently() {
        CountDownLatch latch = new CountDownLatch(2);
        Stage waiter = new Stage() {
            @Override
            public StageResult run(TimeWindow window) {
                latch.countDown();
                try {
                    return latch.await(5, TimeUnit.SECONDS) ? StageResult.ok(1) : StageResult.failure(ErrorKind.TIMEOUT, "alone");
                } catch (InterruptedException e) {
                    return StageResult.failure(ErrorKind.INTERRUPTED, "interrupted");
                }
            }

            @Override
            public String name() { return "waiter"; }
        };
        StageResult r = stages.parallel("pair", waiter, waiter).run(WINDOW);
        assertTrue(r.isOk());
        assertEquals(2, r.recordsLoaded());
    }

    @Test
    void sequential_runs_all_and_requires_all() {
        AtomicInteger calls = new AtomicInteger();
        StageResult r = stages.sequential("s",
                fixed("a", StageResult.ok(1), calls),
                fixed("b", StageResult.failure(ErrorKind.LOADING, "b"), calls),
                fixed("c", StageResult.ok(1), calls)).run(WINDOW);
        assertFalse(r.isOk());
        assertEquals(3, calls.get());

        StageResult all = stages.sequential("s2",
                fixed("a", StageResult.ok(1), calls),
                fixed("c", StageResult.ok(2), calls)).run(WINDOW);
        assertTrue(all.isOk());
        assertEquals(3, all.recordsLoaded());
    }

    @Test
    void conditional_picks_branch_by_window() {
        AtomicInteger yes = new AtomicInteger();
        AtomicInteger no = new AtomicInteger();
        Stage whenTrue = fixed("yes", StageResult.ok(1), yes);
        Stage whenFalse = fixed("no", StageResult.ok(2), no);

        assertEquals(1, stages.conditional("c", TimeWindow::isBackfill, whenTrue, whenFalse)
                .run(TimeWindow.backfill(WINDOW.start(), WINDOW.end())).recordsLoaded());
        assertEquals(2, stages.conditional("c", TimeWindow::isBackfill, whenTrue, whenFalse).run(WINDOW).recordsLoaded());
        assertEquals(1, yes.get());
        assertEquals(1, no.get());
    }

    @Test
    void conditional_without_false_branch_is_a_no_op() {
        AtomicInteger calls = new AtomicInteger();
        StageResult r = stages.conditional("c", w -> false, fixed("yes", StageResult.ok(1), calls)).run(WINDOW);
        assertTrue(r.isOk());
        assertEquals(0, calls.get());
    }

    @Test
    void builder_chains_transformers_and_requires_parts() {
        RecordingLoader loader = new RecordingLoader();
        Stage stage = new PipelineBuilder()
                .name("built")
                .extract(w -> List.of(rec("btc")))
                .transform(records -> List.of(records.get(0).with("symbol", "BTC")))
                .transform(records -> List.of(records.get(0).with("source", "test")))
                .load(loader)
                .metrics(registry)
                .build();
        assertTrue(stage.run(WINDOW).isOk());
        assertEquals("test", loader.calls.get(0).get(0).get("source"));
        assertThrows(NullPointerException.class, () -> new PipelineBuilder().name("x").load(loader).build());
    }
}
