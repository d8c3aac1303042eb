package io.snapshots.core;

import java.util.List;

/**
 * Reshapes a batch of extracted records. May drop records; returning an empty list means nothing to load.
 */
@FunctionalInterface
public interface Transformer {
    List<Record> transform(List<Record> records) throws Exception;
}
