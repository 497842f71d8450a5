package com.di.jobcost.metrics;

import java.util.List;

/**
 * Destination for job-cost metrics.
 */
public interface MetricsSink {

    /**
     * True when {@link #submit} needs a non-blank credential. Reporters check this before computing cost.
     */
    default boolean requiresCredential() {
        return false;
    }

    /**
     * Submits the points as one batch.
     *
     * @param credential opaque API key; passed through, never inspected
     * @throws MetricSubmissionException when the backend rejects the batch or cannot be reached
     */
    void submit(List<MetricPoint> points, String credential);
}
