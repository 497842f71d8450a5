package com.di.jobcost.pricing;

/** Transport-level failure talking to the pricing catalog. Retried, then absorbed by {@link PriceCatalog}. */
public class PricingCatalogException extends RuntimeException {

    public PricingCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
