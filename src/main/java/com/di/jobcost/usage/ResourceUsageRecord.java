package com.di.jobcost.usage;

/**
 * Resources consumed by one job run, as classified by the job-metadata collector.
 * Exactly one implementation is supplied per run; its {@link #getEnvironment()} selects the cost formula.
 */
public interface ResourceUsageRecord {

    /** Cloud region the job ran in (e.g. us-east-1). May be null when the collector could not detect it. */
    String getRegion();

    JobEnvironment getEnvironment();
}
