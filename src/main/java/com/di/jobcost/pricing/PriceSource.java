package com.di.jobcost.pricing;

/**
 * Where a {@link UnitPrice} came from. Anything other than {@link #STATIC_TABLE} or {@link #CATALOG}
 * means the lookup degraded and a warning was logged.
 */
public enum PriceSource {
    /** Configured static table hit. */
    STATIC_TABLE,
    /** Region missing from the DPU-hour table; baseline rate used. */
    DEFAULT_RATE,
    /** Live on-demand price from the remote pricing catalog. */
    CATALOG,
    /** Catalog failed; static instance table used. */
    STATIC_FALLBACK,
    /** No price anywhere; 0.0 used. */
    UNAVAILABLE
}
