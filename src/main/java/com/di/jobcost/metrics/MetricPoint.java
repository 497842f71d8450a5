package com.di.jobcost.metrics;

import com.di.jobcost.tags.TagSet;
import lombok.Builder;
import lombok.Value;

/**
 * One gauge sample handed to a {@link MetricsSink}.
 */
@Value
@Builder
public class MetricPoint {
    public static final String GAUGE = "gauge";

    String metric;
    double value;
    /** Epoch seconds. */
    long timestamp;
    TagSet tags;
    @Builder.Default
    String type = GAUGE;
}
