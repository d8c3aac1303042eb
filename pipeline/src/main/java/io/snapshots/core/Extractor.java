package io.snapshots.core;

import java.util.List;

/**
 * Pulls raw records for a time window from an external source.
 */
@FunctionalInterface
public interface Extractor {
    List<Record> extract(TimeWindow window) throws Exception;
}
