package com.imagebuilder.metrics.error;

/**
 * Raised for non-positive periods or widths and for classifier thresholds below their minimum.
 */
public class InvalidWindowSpecException extends MetricsException {
    private static final long serialVersionUID = 1L;

    public InvalidWindowSpecException(String message) {
        super(message);
    }
}
