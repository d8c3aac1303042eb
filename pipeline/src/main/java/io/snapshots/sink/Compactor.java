package io.snapshots.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically compacts versioned-append tables. A failed compaction is logged and retried on the next tick.
 */
public class Compactor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Compactor.class);

    private final List<VersionedAppendLoader> loaders;
    private final ScheduledExecutorService scheduler;

    public Compactor(List<VersionedAppendLoader> loaders) {
        this.loaders = List.copyOf(loaders);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "compactor");
            t.setDaemon(true);
            return t;
        });
    }

    public void start(Duration interval) {
        long ms = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::compactAll, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Compacting {} table(s) every {}", loaders.size(), interval);
    }

    /** One compaction pass over every table; returns the total number of rows removed. */
    public int compactAll() {
        int removed = 0;
        for (VersionedAppendLoader l : loaders) {
            try {
                removed += l.compact();
            } catch (RuntimeException e) {
                log.error("Compaction of {} failed", l.schema().table(), e);
            }
        }
        return removed;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
