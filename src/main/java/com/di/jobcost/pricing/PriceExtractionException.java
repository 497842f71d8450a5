package com.di.jobcost.pricing;

/** A product document had no usable hourly on-demand USD price. */
public class PriceExtractionException extends RuntimeException {

    public PriceExtractionException(String message) {
        super(message);
    }

    public PriceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
