package io.snapshots.source;

import io.snapshots.core.Record;
import io.snapshots.core.TimeWindow;

import java.util.List;

/**
 * Fetches one page of at most {@code limit} records after skipping {@code offset} rows. Translating limit and
 * offset into the source's own paging (SQL LIMIT/OFFSET, HTTP start/limit, ...) is up to the implementation.
 */
@FunctionalInterface
public interface PageFetcher {
    List<Record> fetch(TimeWindow window, int limit, int offset) throws Exception;
}
