package com.di.jobcost.formula;

import com.di.jobcost.pricing.UnitPrice;
import com.di.jobcost.usage.JobEnvironment;
import com.di.jobcost.usage.ResourceUsageRecord;

import java.util.Map;
import java.util.Set;

/**
 * Pure cost function for one job environment.
 *
 * <p>Callers first ask for {@link #resourceClasses(ResourceUsageRecord)}, resolve one {@link UnitPrice}
 * per class, then call {@link #compute}. Implementations hold no mutable state.
 *
 * @param <R> the usage record variant this formula prices
 */
public interface CostFormula<R extends ResourceUsageRecord> {

    JobEnvironment getEnvironment();

    Class<R> getUsageType();

    /**
     * Validates the record and returns the distinct resource classes that need a price.
     *
     * @throws com.di.jobcost.exception.UnknownResourceClassException if a class cannot be priced safely
     */
    Set<String> resourceClasses(R usage);

    /**
     * @param durationSeconds job runtime, {@code >= 0}
     * @param prices          one entry per class returned by {@link #resourceClasses}
     * @return cost in USD, never negative for non-negative inputs
     */
    double compute(R usage, double durationSeconds, Map<String, UnitPrice> prices);

    static double hours(double durationSeconds) {
        if (Double.isNaN(durationSeconds) || durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0, got " + durationSeconds);
        }
        return durationSeconds / 3600.0;
    }

    static UnitPrice requirePrice(Map<String, UnitPrice> prices, String resourceClass) {
        UnitPrice price = prices != null ? prices.get(resourceClass) : null;
        if (price == null) {
            throw new IllegalStateException("No unit price resolved for " + resourceClass);
        }
        return price;
    }
}
