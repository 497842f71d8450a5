package com.di.jobcost.config;

import com.amazonaws.services.pricing.AWSPricing;
import com.amazonaws.services.pricing.AWSPricingClientBuilder;
import com.di.jobcost.metrics.DatadogMetricsSink;
import com.di.jobcost.metrics.MetricsProperties;
import com.di.jobcost.metrics.MetricsSink;
import com.di.jobcost.metrics.MicrometerMetricsSink;
import com.di.jobcost.pricing.AwsPricingCatalogClient;
import com.di.jobcost.pricing.PricingCatalogClient;
import com.di.jobcost.pricing.PricingProperties;
import com.di.jobcost.pricing.PricingRetryTemplates;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Wiring for the external collaborators: pricing catalog client, retry template, metrics sink, clock.
 * The sink is chosen by {@code jobcost.metrics.sink} (datadog by default).
 */
@Slf4j
@Configuration
public class JobCostConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "pricingRetryTemplate")
    public RetryTemplate pricingRetryTemplate(PricingProperties properties) {
        PricingProperties.Retry retry = properties.getRetry();
        log.info("Pricing retry: maxAttempts={}, initialDelayMs={}, multiplier={}",
                retry.getMaxAttempts(), retry.getInitialDelayMs(), retry.getMultiplier());
        return PricingRetryTemplates.from(retry, new ThreadWaitSleeper());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public AWSPricing awsPricing(PricingProperties properties) {
        return AWSPricingClientBuilder.standard()
                .withRegion(properties.getCatalog().getEndpointRegion())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public PricingCatalogClient pricingCatalogClient(AWSPricing awsPricing) {
        return new AwsPricingCatalogClient(awsPricing);
    }

    @Bean
    @ConditionalOnProperty(name = "jobcost.metrics.sink", havingValue = "datadog", matchIfMissing = true)
    public MetricsSink datadogMetricsSink(RestClient.Builder restClientBuilder, MetricsProperties properties) {
        MetricsProperties.Datadog datadog = properties.getDatadog();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(datadog.getConnectTimeoutMs());
        requestFactory.setReadTimeout(datadog.getReadTimeoutMs());
        RestClient restClient = restClientBuilder
                .baseUrl(datadog.getSiteUrl())
                .requestFactory(requestFactory)
                .build();
        log.info("Metrics sink: Datadog at {}", datadog.getSiteUrl());
        return new DatadogMetricsSink(restClient, datadog.getAppKey());
    }

    @Bean
    @ConditionalOnProperty(name = "jobcost.metrics.sink", havingValue = "micrometer")
    public MetricsSink micrometerMetricsSink(MeterRegistry meterRegistry) {
        log.info("Metrics sink: Micrometer registry {}", meterRegistry.getClass().getSimpleName());
        return new MicrometerMetricsSink(meterRegistry);
    }
}
