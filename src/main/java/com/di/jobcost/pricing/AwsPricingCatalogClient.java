package com.di.jobcost.pricing;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.pricing.AWSPricing;
import com.amazonaws.services.pricing.model.Filter;
import com.amazonaws.services.pricing.model.FilterType;
import com.amazonaws.services.pricing.model.GetProductsRequest;
import com.amazonaws.services.pricing.model.GetProductsResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link PricingCatalogClient} backed by the AWS Price List query API.
 * SDK exceptions are translated to {@link PricingCatalogException} so the retry policy sees one type.
 */
@Slf4j
public class AwsPricingCatalogClient implements PricingCatalogClient {

    private static final String FORMAT_VERSION = "aws_v1";

    private final AWSPricing pricing;

    public AwsPricingCatalogClient(AWSPricing pricing) {
        this.pricing = pricing;
    }

    @Override
    public List<String> getProducts(ProductFilter filter) {
        GetProductsRequest request = new GetProductsRequest()
                .withServiceCode(filter.getServiceCode())
                .withFormatVersion(FORMAT_VERSION)
                .withMaxResults(filter.getMaxResults())
                .withFilters(
                        termMatch("ServiceCode", filter.getServiceCode()),
                        termMatch("location", filter.getLocation()),
                        termMatch("instanceType", filter.getInstanceType()),
                        termMatch("operatingSystem", filter.getOperatingSystem()),
                        termMatch("preInstalledSw", filter.getPreInstalledSoftware()),
                        termMatch("tenancy", filter.getTenancy()));
        try {
            GetProductsResult result = pricing.getProducts(request);
            List<String> priceList = result.getPriceList();
            log.debug("[PRICING] Catalog returned {} product(s) for {} in {}",
                    priceList != null ? priceList.size() : 0, filter.getInstanceType(), filter.getLocation());
            return priceList != null ? priceList : List.of();
        } catch (AmazonServiceException e) {
            throw new PricingCatalogException("Pricing catalog rejected the request for "
                    + filter.getInstanceType() + " (" + e.getErrorCode() + ")", e);
        } catch (AmazonClientException e) {
            throw new PricingCatalogException("Pricing catalog unreachable for " + filter.getInstanceType(), e);
        }
    }

    private static Filter termMatch(String field, String value) {
        return new Filter().withType(FilterType.TERM_MATCH).withField(field).withValue(value);
    }
}
