package com.di.jobcost.exception;

/**
 * A required setting (metrics credential, job region) is missing or invalid.
 * Fatal for the report call; never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
