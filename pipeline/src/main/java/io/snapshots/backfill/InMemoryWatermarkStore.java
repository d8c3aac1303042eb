package io.snapshots.backfill;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryWatermarkStore implements WatermarkStore {
    private final Map<String, Instant> watermarks = new ConcurrentHashMap<>();

    @Override
    public Optional<Instant> get(String job) {
        return Optional.ofNullable(watermarks.get(job));
    }

    @Override
    public void put(String job, Instant watermark) {
        watermarks.put(job, watermark);
    }
}
