package com.di.jobcost.pricing;

import lombok.Value;

/** Cache key: (region, resource class). */
@Value(staticConstructor = "of")
public class PriceKey {
    String region;
    String resourceClass;
}
