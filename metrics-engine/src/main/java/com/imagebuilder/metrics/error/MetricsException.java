package com.imagebuilder.metrics.error;

/**
 * Base type for failures raised by the metrics engine. All engine errors are unchecked and are
 * always surfaced to the caller; the presentation and CLI layers decide whether to abort.
 */
public class MetricsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public MetricsException(String message) {
        super(message);
    }

    public MetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
