package com.di.jobcost.pricing;

import lombok.Builder;
import lombok.Value;

/**
 * Term-match filter sent to the pricing catalog: one on-demand compute product in one location.
 */
@Value
@Builder
public class ProductFilter {
    String serviceCode;
    String location;
    String instanceType;
    String operatingSystem;
    String preInstalledSoftware;
    String tenancy;
    int maxResults;

    static ProductFilter forInstance(PricingProperties properties, String region, String instanceType) {
        PricingProperties.Catalog catalog = properties.getCatalog();
        return ProductFilter.builder()
                .serviceCode(catalog.getServiceCode())
                .location(properties.locationFor(region))
                .instanceType(instanceType)
                .operatingSystem(catalog.getOperatingSystem())
                .preInstalledSoftware(catalog.getPreInstalledSoftware())
                .tenancy(catalog.getTenancy())
                .maxResults(catalog.getMaxResults())
                .build();
    }
}
