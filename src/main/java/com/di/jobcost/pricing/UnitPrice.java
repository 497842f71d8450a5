package com.di.jobcost.pricing;

import lombok.Builder;
import lombok.Value;

/**
 * Per-hour price of one resource class in one region. Immutable; cached for the life of the process.
 */
@Value
@Builder
public class UnitPrice {
    String region;
    String resourceClass;
    /** USD per DPU-hour (batch workers) or per instance-hour (cluster). */
    double pricePerHour;
    /** Cluster service fee per instance-hour; 0 for batch workers. */
    double feePerHour;
    PriceSource source;

    public double getTotalPerHour() {
        return pricePerHour + feePerHour;
    }

    public boolean isDegraded() {
        return source != PriceSource.STATIC_TABLE && source != PriceSource.CATALOG;
    }
}
