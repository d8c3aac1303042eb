package io.snapshots.error;

import io.snapshots.core.ErrorKind;

/** A write to the target store failed after its retries, or failed on a schema/type error. */
public class LoadingException extends PipelineException {
    public LoadingException(String message) {
        super(ErrorKind.LOADING, message);
    }

    public LoadingException(String message, Throwable cause) {
        super(ErrorKind.LOADING, message, cause);
    }
}
