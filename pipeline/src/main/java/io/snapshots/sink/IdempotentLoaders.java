package io.snapshots.sink;

import io.snapshots.metrics.Metrics;

import java.time.Clock;

/**
 * Picks the loader implementation from a table's {@link LoadStrategy}, so a key space only ever has one write path.
 */
public final class IdempotentLoaders {
    private IdempotentLoaders() {}

    public static IdempotentLoader forSchema(TableSchema schema, JdbcTarget target) {
        return forSchema(schema, target, JdbcLoaderSupport.DEFAULT_BATCH_SIZE, Metrics.noop(), Clock.systemUTC());
    }

    public static IdempotentLoader forSchema(TableSchema schema, JdbcTarget target, int batchSize, Metrics metrics, Clock clock) {
        return switch (schema.strategy()) {
            case DELETE_INSERT -> new DeleteInsertLoader(schema, target, batchSize, JdbcLoaderSupport.defaultRetryPolicy(), metrics, clock);
            case VERSIONED_APPEND -> new VersionedAppendLoader(schema, target, batchSize, JdbcLoaderSupport.defaultRetryPolicy(), metrics, clock);
        };
    }
}
