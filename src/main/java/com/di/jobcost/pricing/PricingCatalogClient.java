package com.di.jobcost.pricing;

import java.util.List;

/**
 * Remote pricing catalog. Returns the raw product documents (JSON) that match the filter.
 */
public interface PricingCatalogClient {

    /**
     * @return matching product JSON documents, possibly empty
     * @throws PricingCatalogException when the catalog cannot be reached or rejects the request
     */
    List<String> getProducts(ProductFilter filter);
}
