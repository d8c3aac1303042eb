package io.snapshots.error;

import io.snapshots.core.ErrorKind;

/** Source unreachable, malformed response or pagination ceiling hit. */
public class ExtractionException extends PipelineException {
    public ExtractionException(String message) {
        super(ErrorKind.EXTRACTION, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION, message, cause);
    }
}
