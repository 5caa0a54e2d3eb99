package com.imagebuilder.metrics.window;

import com.imagebuilder.metrics.model.BuildRecord;

import java.util.function.Function;

/**
 * Typed attribute selectors for distinct-value aggregation.
 */
public final class Attributes {
    public static final Function<BuildRecord, String> ORG_ID = BuildRecord::orgId;
    public static final Function<BuildRecord, String> JOB_ID = BuildRecord::jobId;
    public static final Function<BuildRecord, String> IMAGE_TYPE = BuildRecord::imageType;
    public static final Function<BuildRecord, String> ACCOUNT_NUMBER = BuildRecord::accountNumber;

    private Attributes() {}
}
