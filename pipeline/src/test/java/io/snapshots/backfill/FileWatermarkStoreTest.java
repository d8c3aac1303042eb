package io.snapshots.backfill;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class FileWatermarkStoreTest {
    private Path dir;

    @AfterEach
    void cleanup() throws Exception {
        if (dir == null) return;
        try (Stream<Path> s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    @Test
    void watermarks_survive_reopening() throws Exception {
        dir = Files.createTempDirectory("wm");
        Path file = dir.resolve("state/watermarks.json");
        FileWatermarkStore store = new FileWatermarkStore(file);
        assertTrue(store.get("cmc_prices_hourly").isEmpty());

        store.put("cmc_prices_hourly", Instant.parse("2024-05-10T12:00:00Z"));
        store.put("cmc_prices_daily", Instant.parse("2024-05-10T00:00:00Z"));

        FileWatermarkStore reopened = new FileWatermarkStore(file);
        assertEquals(Instant.parse("2024-05-10T12:00:00Z"), reopened.get("cmc_prices_hourly").orElseThrow());
        assertEquals(Instant.parse("2024-05-10T00:00:00Z"), reopened.get("cmc_prices_daily").orElseThrow());
        assertFalse(Files.exists(file.resolveSibling("watermarks.json.tmp")));
        assertTrue(Files.readString(file).contains("2024-05-10T12:00:00Z"));
    }

    @Test
    void context_resumes_from_persisted_watermark() throws Exception {
        dir = Files.createTempDirectory("wm");
        Path file = dir.resolve("watermarks.json");
        new BackfillContext("job", new FileWatermarkStore(file)).advanceWatermark(Instant.parse("2024-05-10T11:00:00Z"));

        BackfillContext restarted = new BackfillContext("job", new FileWatermarkStore(file));
        assertEquals(Instant.parse("2024-05-10T11:00:00Z"), restarted.lastWatermark().orElseThrow());
    }
}
