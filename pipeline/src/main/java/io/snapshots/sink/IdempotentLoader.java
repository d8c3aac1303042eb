package io.snapshots.sink;

import io.snapshots.core.Loader;

/**
 * A loader for which loading the same records twice leaves the table as after loading them once.
 */
public interface IdempotentLoader extends Loader {
    TableSchema schema();

    /** Creates the target table when it does not exist yet. */
    void createTableIfMissing() throws Exception;
}
