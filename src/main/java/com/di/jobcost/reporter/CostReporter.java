package com.di.jobcost.reporter;

import com.di.jobcost.exception.ConfigurationException;
import com.di.jobcost.formula.CostFormula;
import com.di.jobcost.formula.CostFormulaRegistry;
import com.di.jobcost.metrics.MetricPoint;
import com.di.jobcost.metrics.MetricsProperties;
import com.di.jobcost.metrics.MetricsSink;
import com.di.jobcost.pricing.PriceCatalog;
import com.di.jobcost.pricing.UnitPrice;
import com.di.jobcost.tags.TagBuilder;
import com.di.jobcost.tags.TagSet;
import com.di.jobcost.usage.ResourceUsageRecord;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point: prices a finished job run and emits its cost and duration as gauges.
 *
 * <p>Flow: pick the formula for the record's environment, resolve one unit price per resource class,
 * compute, build tags, submit {@code <prefix>.job.cost} and {@code <prefix>.job.duration}.
 *
 * <p>Failure policy:
 * <ul>
 *   <li>missing credential or region, unknown worker type: thrown before anything is emitted</li>
 *   <li>price lookup problems: absorbed by {@link PriceCatalog} (warning logged)</li>
 *   <li>metric submission failure: logged as an error; the computed cost is still returned</li>
 * </ul>
 */
@Slf4j
@Service
public class CostReporter {

    private static final String MDC_CUSTOMER = "customerId";
    private static final String MDC_JOB_TYPE = "jobType";

    private final CostFormulaRegistry formulas;
    private final PriceCatalog priceCatalog;
    private final TagBuilder tagBuilder;
    private final MetricsSink metricsSink;
    private final MetricsProperties metricsProperties;
    private final Clock clock;

    public CostReporter(CostFormulaRegistry formulas,
                        PriceCatalog priceCatalog,
                        TagBuilder tagBuilder,
                        MetricsSink metricsSink,
                        MetricsProperties metricsProperties,
                        Clock clock) {
        this.formulas = formulas;
        this.priceCatalog = priceCatalog;
        this.tagBuilder = tagBuilder;
        this.metricsSink = metricsSink;
        this.metricsProperties = metricsProperties;
        this.clock = clock;
    }

    /** Reports using the credential from {@code jobcost.metrics.datadog.api-key}. */
    public CostResult reportJobCost(String customerId, ResourceUsageRecord usage, double durationSeconds,
                                    boolean success) {
        return reportJobCost(customerId, usage, durationSeconds, success, null);
    }

    public CostResult reportJobCost(String customerId, ResourceUsageRecord usage, JobTimer timer, boolean success) {
        if (timer == null) {
            throw new IllegalArgumentException("Job timer must not be null");
        }
        return reportJobCost(customerId, usage, timer.elapsedSeconds(), success, null);
    }

    /**
     * @param apiKey metrics credential; when null the configured key is used
     * @throws ConfigurationException          credential (for sinks that need one) or region missing
     * @throws com.di.jobcost.exception.UnknownResourceClassException worker type has no capacity multiplier
     * @throws IllegalArgumentException        blank customer id, null record, negative or non-finite duration
     */
    public CostResult reportJobCost(String customerId, ResourceUsageRecord usage, double durationSeconds,
                                    boolean success, String apiKey) {
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("Customer id must not be blank");
        }
        String credential = resolveCredential(apiKey);

        MDC.put(MDC_CUSTOMER, customerId);
        MDC.put(MDC_JOB_TYPE, usage != null ? usage.getEnvironment().getValue() : "unknown");
        try {
            Computation computation = compute(usage, durationSeconds);
            TagSet tags = tagBuilder.buildTags(customerId, usage.getEnvironment(), usage, success);

            long timestamp = clock.instant().getEpochSecond();
            List<MetricPoint> points = List.of(
                    MetricPoint.builder().metric(metricsProperties.costMetricName())
                            .value(computation.cost()).timestamp(timestamp).tags(tags).build(),
                    MetricPoint.builder().metric(metricsProperties.durationMetricName())
                            .value(durationSeconds).timestamp(timestamp).tags(tags).build());
            boolean submitted = submit(points, credential);

            log.info("[COST] Job cost: ${} reported with tags: {}", String.format("%.4f", computation.cost()), tags);
            return CostResult.builder()
                    .totalCost(computation.cost())
                    .durationSeconds(durationSeconds)
                    .jobEnvironment(usage.getEnvironment())
                    .tags(tags)
                    .metricsSubmitted(submitted)
                    .pricingDegraded(computation.degraded())
                    .build();
        } finally {
            MDC.remove(MDC_CUSTOMER);
            MDC.remove(MDC_JOB_TYPE);
        }
    }

    /**
     * Computes the cost without tagging or emitting anything.
     */
    public CostResult estimateJobCost(ResourceUsageRecord usage, double durationSeconds) {
        Computation computation = compute(usage, durationSeconds);
        return CostResult.builder()
                .totalCost(computation.cost())
                .durationSeconds(durationSeconds)
                .jobEnvironment(usage.getEnvironment())
                .metricsSubmitted(false)
                .pricingDegraded(computation.degraded())
                .build();
    }

    // ------------------------------------------------------------------ //

    private Computation compute(ResourceUsageRecord usage, double durationSeconds) {
        if (usage == null) {
            throw new IllegalArgumentException("Resource usage record must not be null");
        }
        if (!Double.isFinite(durationSeconds) || durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be a finite value >= 0, got " + durationSeconds);
        }
        if (usage.getRegion() == null || usage.getRegion().isBlank()) {
            throw new ConfigurationException("Unable to determine region for " + usage.getEnvironment() + " job");
        }
        CostFormula<ResourceUsageRecord> formula = formulas.getFormula(usage);

        Map<String, UnitPrice> prices = new LinkedHashMap<>();
        boolean degraded = false;
        for (String resourceClass : formula.resourceClasses(usage)) {
            UnitPrice price = priceCatalog.getUnitPrice(usage.getEnvironment(), usage.getRegion(), resourceClass);
            prices.put(resourceClass, price);
            degraded |= price.isDegraded();
        }
        double cost = formula.compute(usage, durationSeconds, prices);
        return new Computation(Math.max(0.0, cost), degraded);
    }

    private String resolveCredential(String apiKey) {
        String credential = apiKey != null ? apiKey : metricsProperties.getDatadog().getApiKey();
        if (metricsSink.requiresCredential() && (credential == null || credential.isBlank())) {
            throw new ConfigurationException(
                    "Metrics API key must be provided as an argument or via the DATADOG_API_KEY environment variable");
        }
        return credential;
    }

    private boolean submit(List<MetricPoint> points, String credential) {
        try {
            metricsSink.submit(points, credential);
            return true;
        } catch (RuntimeException e) {
            log.error("[METRICS] Error sending job metrics {}: {}",
                    points.stream().map(MetricPoint::getMetric).toList(), e.getMessage(), e);
            return false;
        }
    }

    private record Computation(double cost, boolean degraded) {}
}
