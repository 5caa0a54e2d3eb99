package com.imagebuilder.metrics.error;

/**
 * Raised when a window or aggregation function receives no timestamped records. A dataset with
 * records but an empty window yields a zero count instead.
 */
public class EmptyDatasetException extends MetricsException {
    private static final long serialVersionUID = 1L;

    public EmptyDatasetException(String operation) {
        super("Dataset has no timestamped records: " + operation);
    }
}
