package com.di.jobcost.usage;

import java.util.Locale;

/**
 * Job execution environments the cost engine knows how to price.
 * The value is the {@code job_type} tag and the wire name used in requests.
 */
public enum JobEnvironment {

    /** Serverless batch workers billed per DPU-hour. */
    GLUE("glue"),

    /** Managed cluster billed per instance-hour plus a service fee. */
    EMR("emr");

    private final String value;

    JobEnvironment(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a wire name (case-insensitive).
     *
     * @throws IllegalArgumentException when the name is blank or not supported
     */
    public static JobEnvironment fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Job environment must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobEnvironment env : values()) {
            if (env.value.equals(normalized)) {
                return env;
            }
        }
        throw new IllegalArgumentException("Unsupported job environment: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
