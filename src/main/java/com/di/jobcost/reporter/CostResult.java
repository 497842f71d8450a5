package com.di.jobcost.reporter;

import com.di.jobcost.tags.TagSet;
import com.di.jobcost.usage.JobEnvironment;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one cost computation. Computed fresh per call and never persisted.
 */
@Value
@Builder
public class CostResult {
    /** Total cost in USD. */
    double totalCost;
    /** Always true: cost is hourly price amortized over the run's duration. */
    @Builder.Default
    boolean hourlyAmortized = true;
    double durationSeconds;
    JobEnvironment jobEnvironment;
    /** Tags the metrics were emitted with; empty for estimates. */
    @Builder.Default
    TagSet tags = TagSet.empty();
    /** False when the sink failed or the call was an estimate. */
    boolean metricsSubmitted;
    /** True when at least one unit price came from a fallback path. */
    boolean pricingDegraded;
}
