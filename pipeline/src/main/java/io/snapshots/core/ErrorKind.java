package io.snapshots.core;

public enum ErrorKind {
    CONFIGURATION,
    EXTRACTION,
    TRANSFORMATION,
    LOADING,
    TIMEOUT,
    INTERRUPTED,
    UNKNOWN
}
