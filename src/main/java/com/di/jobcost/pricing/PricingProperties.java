package com.di.jobcost.pricing;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binding for {@code jobcost.pricing.*}. Every price is configuration; the values shipped in
 * {@code application.yml} are illustrative and should be replaced from an authoritative source.
 *
 * <pre>
 * jobcost:
 *   pricing:
 *     default-dpu-hour-price: 0.44
 *     dpu-hour-price:
 *       us-east-1: 0.44
 *     instance-prices:
 *       us-east-1:
 *         "[m5.xlarge]": 0.192
 *     service-fees:
 *       us-east-1:
 *         "[m5.xlarge]": 0.022
 *     region-locations:
 *       us-east-1: US East (N. Virginia)
 *     catalog:
 *       enabled: true
 *     retry:
 *       max-attempts: 3
 *       initial-delay-ms: 1000
 *       multiplier: 2.0
 *     cache:
 *       worker-type-max-size: 32
 *       instance-type-max-size: 128
 * </pre>
 *
 * Keys containing dots (instance types) need the bracket form shown above.
 */
@Data
@ConfigurationProperties(prefix = "jobcost.pricing")
public class PricingProperties {

    /** Price per DPU-hour by region. */
    private Map<String, Double> dpuHourPrice = new LinkedHashMap<>();

    /** Used, with a warning, for regions missing from {@link #dpuHourPrice}. */
    private double defaultDpuHourPrice = 0.44;

    /** Static on-demand price per instance-hour: region -> instance type -> USD. Fallback for the catalog. */
    private Map<String, Map<String, Double>> instancePrices = new LinkedHashMap<>();

    /** Cluster service fee per instance-hour: region -> instance type -> USD. */
    private Map<String, Map<String, Double>> serviceFees = new LinkedHashMap<>();

    /** Region code -> location name used by the pricing catalog filters. */
    private Map<String, String> regionLocations = new LinkedHashMap<>();

    private String defaultLocation = "US East (N. Virginia)";

    @NestedConfigurationProperty
    private Catalog catalog = new Catalog();

    @NestedConfigurationProperty
    private Retry retry = new Retry();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    public String locationFor(String region) {
        String location = region != null ? regionLocations.get(region) : null;
        return location != null ? location : defaultLocation;
    }

    // ------------------------------------------------------------------ //

    @Data
    public static class Catalog {
        /** When false, instance prices come straight from {@code instance-prices}. */
        private boolean enabled = true;
        /** The pricing endpoint only exists in a few regions. */
        private String endpointRegion = "us-east-1";
        private String serviceCode = "AmazonEC2";
        private String operatingSystem = "Linux";
        private String preInstalledSoftware = "NA";
        private String tenancy = "Shared";
        private int maxResults = 10;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long initialDelayMs = 1000;
        private double multiplier = 2.0;
    }

    @Data
    public static class Cache {
        private int workerTypeMaxSize = 32;
        private int instanceTypeMaxSize = 128;
    }
}
