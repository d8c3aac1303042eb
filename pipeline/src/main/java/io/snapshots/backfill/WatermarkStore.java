package io.snapshots.backfill;

import java.time.Instant;
import java.util.Optional;

/**
 * Keeps the last successfully processed time per job so incremental runs resume after a restart.
 */
public interface WatermarkStore {
    Optional<Instant> get(String job);

    void put(String job, Instant watermark);
}
