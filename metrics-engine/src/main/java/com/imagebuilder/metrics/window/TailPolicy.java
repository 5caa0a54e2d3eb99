package com.imagebuilder.metrics.window;

/**
 * What a fixed-period bucketing does with a final period that straddles the end of the range.
 */
public enum TailPolicy {
    /**
     * Emit a bucket only while {@code start + (k+1)P < end}. A tail period reaching or crossing
     * {@code end} is dropped, so records in it are not counted.
     */
    DROP_PARTIAL,

    /**
     * Emit a bucket while {@code start + kP < end}, keeping the tail period that straddles {@code end}.
     */
    INCLUDE_PARTIAL
}
