package io.snapshots.error;

import io.snapshots.core.ErrorKind;

/** A record could not be reshaped. Per-record transformers drop the record and continue. */
public class TransformationException extends PipelineException {
    public TransformationException(String message) {
        super(ErrorKind.TRANSFORMATION, message);
    }

    public TransformationException(String message, Throwable cause) {
        super(ErrorKind.TRANSFORMATION, message, cause);
    }
}
