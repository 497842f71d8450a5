package com.di.jobcost.exception;

/**
 * Thrown when a worker type has no capacity multiplier. The multiplier scales cost by an unbounded
 * factor, so the report fails instead of defaulting.
 *
 * <p>Mapped to 422 Unprocessable Entity by {@link GlobalExceptionHandler}.
 */
public class UnknownResourceClassException extends RuntimeException {

    private final String resourceClass;

    public UnknownResourceClassException(String resourceClass) {
        super("Unknown worker type: " + resourceClass);
        this.resourceClass = resourceClass;
    }

    public String getResourceClass() {
        return resourceClass;
    }
}
