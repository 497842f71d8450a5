package com.di.jobcost.metrics;

/** The metrics backend rejected a batch or was unreachable. */
public class MetricSubmissionException extends RuntimeException {

    public MetricSubmissionException(String message) {
        super(message);
    }

    public MetricSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
