package com.di.jobcost.pricing;

import com.di.jobcost.usage.JobEnvironment;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unit prices keyed by (region, resource class).
 *
 * <p>Worker types resolve through the static DPU-hour table. A region missing from that table falls
 * back to the baseline rate with a warning. Instance types are priced from the remote catalog under
 * a {@link RetryTemplate}. When the catalog fails, the static instance table is used. When that has no
 * entry either, the price is 0.0 and a warning is logged. No lookup path throws for a missing price.
 *
 * <p>Resolved prices are cached in bounded Caffeine caches with no expiry. Concurrent callers for the
 * same key share one lookup.
 */
@Slf4j
@Service
public class PriceCatalog {

    private final PricingProperties properties;
    private final PricingCatalogClient catalogClient;
    private final RetryTemplate retryTemplate;
    private final OnDemandPriceExtractor extractor;

    private final Cache<PriceKey, UnitPrice> workerTypePrices;
    private final Cache<PriceKey, UnitPrice> instancePrices;

    public PriceCatalog(PricingProperties properties,
                        PricingCatalogClient catalogClient,
                        RetryTemplate pricingRetryTemplate,
                        OnDemandPriceExtractor extractor) {
        this.properties = properties;
        this.catalogClient = catalogClient;
        this.retryTemplate = pricingRetryTemplate;
        this.extractor = extractor;
        this.workerTypePrices = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getWorkerTypeMaxSize())
                .build();
        this.instancePrices = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getInstanceTypeMaxSize())
                .build();
    }

    /**
     * Price for one resource class of the given environment: a worker type for {@link JobEnvironment#GLUE},
     * an instance type for {@link JobEnvironment#EMR}.
     */
    public UnitPrice getUnitPrice(JobEnvironment environment, String region, String resourceClass) {
        return switch (environment) {
            case GLUE -> getWorkerTypePrice(region, resourceClass);
            case EMR -> getInstancePrice(region, resourceClass);
        };
    }

    /** Price per DPU-hour for a worker type in a region. */
    public UnitPrice getWorkerTypePrice(String region, String workerType) {
        return workerTypePrices.get(PriceKey.of(region, workerType), this::lookupDpuHourPrice);
    }

    /** On-demand price per instance-hour, with the cluster service fee attached. */
    public UnitPrice getInstancePrice(String region, String instanceType) {
        return instancePrices.get(PriceKey.of(region, instanceType), this::lookupInstancePrice);
    }

    /** Cluster service fee per instance-hour; 0.0 for unknown combinations. */
    public double getServiceFee(String region, String instanceType) {
        return tableValue(properties.getServiceFees(), region, instanceType, 0.0);
    }

    // ------------------------------------------------------------------ //

    private UnitPrice lookupDpuHourPrice(PriceKey key) {
        Double price = key.getRegion() != null ? properties.getDpuHourPrice().get(key.getRegion()) : null;
        PriceSource source = PriceSource.STATIC_TABLE;
        if (price == null) {
            price = properties.getDefaultDpuHourPrice();
            source = PriceSource.DEFAULT_RATE;
            log.warn("[PRICING] No DPU-hour price for region {}; defaulting to {}", key.getRegion(), price);
        }
        return UnitPrice.builder()
                .region(key.getRegion())
                .resourceClass(key.getResourceClass())
                .pricePerHour(price)
                .feePerHour(0.0)
                .source(source)
                .build();
    }

    private UnitPrice lookupInstancePrice(PriceKey key) {
        String region = key.getRegion();
        String instanceType = key.getResourceClass();
        double fee = getServiceFee(region, instanceType);
        if (!properties.getCatalog().isEnabled()) {
            return staticInstancePrice(key, fee, PriceSource.STATIC_TABLE);
        }
        ProductFilter filter = ProductFilter.forInstance(properties, region, instanceType);
        AtomicInteger attempts = new AtomicInteger();
        List<String> products;
        try {
            products = retryTemplate.execute(context -> {
                attempts.incrementAndGet();
                return catalogClient.getProducts(filter);
            });
        } catch (RuntimeException e) {
            log.warn("[PRICING] Catalog lookup degraded for {} in {} after {} attempt(s): {}; using static table",
                    instanceType, region, attempts.get(), e.getMessage());
            return staticInstancePrice(key, fee, PriceSource.STATIC_FALLBACK);
        }
        if (products == null || products.isEmpty()) {
            log.warn("[PRICING] No catalog pricing found for {} in {}; using static table", instanceType, region);
            return staticInstancePrice(key, fee, PriceSource.STATIC_FALLBACK);
        }
        double price;
        try {
            price = extractor.extractHourlyUsd(products.get(0));
        } catch (PriceExtractionException e) {
            log.warn("[PRICING] Catalog price unreadable for {} in {}: {}; using static table",
                    instanceType, region, e.getMessage());
            return staticInstancePrice(key, fee, PriceSource.STATIC_FALLBACK);
        }
        log.info("[PRICING] Catalog price for {} in {}: {}", instanceType, region, price);
        return UnitPrice.builder()
                .region(region)
                .resourceClass(instanceType)
                .pricePerHour(price)
                .feePerHour(fee)
                .source(PriceSource.CATALOG)
                .build();
    }

    private UnitPrice staticInstancePrice(PriceKey key, double fee, PriceSource sourceOnHit) {
        Double price = tableValue(properties.getInstancePrices(), key.getRegion(), key.getResourceClass(), null);
        PriceSource source = sourceOnHit;
        if (price == null) {
            log.warn("[PRICING] Price unavailable for {} in {}; using 0.0", key.getResourceClass(), key.getRegion());
            price = 0.0;
            source = PriceSource.UNAVAILABLE;
        }
        return UnitPrice.builder()
                .region(key.getRegion())
                .resourceClass(key.getResourceClass())
                .pricePerHour(price)
                .feePerHour(fee)
                .source(source)
                .build();
    }

    private static Double tableValue(Map<String, Map<String, Double>> table, String region, String type,
                                     Double fallback) {
        if (region == null || type == null) {
            return fallback;
        }
        Map<String, Double> byType = table.get(region);
        if (byType == null) {
            return fallback;
        }
        Double value = byType.get(type);
        return value != null ? value : fallback;
    }
}
