package io.snapshots.error;

import io.snapshots.core.ErrorKind;

/** Bad schedule, bad time window or missing required setting. Never retried. */
public class ConfigurationException extends PipelineException {
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
