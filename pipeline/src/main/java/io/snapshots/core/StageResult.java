package io.snapshots.core;

import io.snapshots.error.PipelineException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a stage run: either ok with the number of rows written, or a failure carrying its kind and
 * message so the caller can decide whether to escalate.
 */
public final class StageResult {
    private static final StageResult NOTHING = new StageResult(true, 0, null, null, null);

    private final boolean ok;
    private final int recordsLoaded;
    private final ErrorKind errorKind;
    private final String message;
    private final Throwable cause;

    private StageResult(boolean ok, int recordsLoaded, ErrorKind errorKind, String message, Throwable cause) {
        this.ok = ok;
        this.recordsLoaded = recordsLoaded;
        this.errorKind = errorKind;
        this.message = message;
        this.cause = cause;
    }

    public static StageResult ok(int recordsLoaded) {
        return recordsLoaded == 0 ? NOTHING : new StageResult(true, recordsLoaded, null, null, null);
    }

    public static StageResult nothingToDo() { return NOTHING; }

    public static StageResult failure(ErrorKind kind, String message) {
        return failure(kind, message, null);
    }

    public static StageResult failure(ErrorKind kind, String message, Throwable cause) {
        return new StageResult(false, 0, Objects.requireNonNull(kind, "kind"), message, cause);
    }

    /** Maps an exception raised inside a stage to a failure, keeping the kind of pipeline exceptions. */
    public static StageResult fromException(Throwable t) {
        if (t instanceof PipelineException pe) return failure(pe.kind(), pe.getMessage(), pe);
        if (t instanceof InterruptedException) return failure(ErrorKind.INTERRUPTED, "interrupted", t);
        String msg = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        return failure(ErrorKind.UNKNOWN, msg, t);
    }

    public boolean isOk() { return ok; }
    public int recordsLoaded() { return recordsLoaded; }
    public Optional<ErrorKind> errorKind() { return Optional.ofNullable(errorKind); }
    public String message() { return message; }
    public Optional<Throwable> cause() { return Optional.ofNullable(cause); }

    @Override
    public String toString() {
        return ok ? "Ok{recordsLoaded=" + recordsLoaded + "}" : "Err{" + errorKind + ": " + message + "}";
    }
}
