package io.snapshots.error;

import io.snapshots.core.ErrorKind;

/**
 * Base of the pipeline error taxonomy. Each subtype maps to one {@link ErrorKind}.
 */
public class PipelineException extends RuntimeException {
    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}
