package io.snapshots.core;

import java.util.List;

/**
 * Writes a batch of records into the target store.
 */
@FunctionalInterface
public interface Loader {
    LoadResult load(List<Record> records) throws Exception;
}
