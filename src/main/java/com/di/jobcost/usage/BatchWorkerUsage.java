package com.di.jobcost.usage;

import lombok.Builder;
import lombok.Value;

/**
 * Batch-worker usage: a fixed pool of workers of a single worker type (e.g. {@code G.1X}).
 */
@Value
public class BatchWorkerUsage implements ResourceUsageRecord {

    String region;
    /** Worker type key; its capacity multiplier comes from {@code jobcost.capacity.dpu-per-worker}. */
    String workerType;
    int workerCount;

    @Builder
    public BatchWorkerUsage(String region, String workerType, int workerCount) {
        if (workerCount < 0) {
            throw new IllegalArgumentException("workerCount must be >= 0, got " + workerCount);
        }
        this.region = region;
        this.workerType = workerType;
        this.workerCount = workerCount;
    }

    @Override
    public JobEnvironment getEnvironment() {
        return JobEnvironment.GLUE;
    }
}
