package com.imagebuilder.metrics.ingest;

import com.imagebuilder.metrics.model.Dataset;

/**
 * Supplies a complete snapshot of build records.
 */
public interface BuildRecordSource {
    Dataset read();
}
