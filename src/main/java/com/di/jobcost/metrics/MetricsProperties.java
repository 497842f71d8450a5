package com.di.jobcost.metrics;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Binding for {@code jobcost.metrics.*}.
 *
 * <pre>
 * jobcost:
 *   metrics:
 *     sink: datadog          # or micrometer
 *     prefix: aws            # aws.job.cost / aws.job.duration
 *     datadog:
 *       api-key: ${DATADOG_API_KEY:}
 *       app-key:
 *       site-url: https://api.datadoghq.com
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "jobcost.metrics")
public class MetricsProperties {

    private String sink = "datadog";

    private String prefix = "aws";

    @NestedConfigurationProperty
    private Datadog datadog = new Datadog();

    public String costMetricName() {
        return prefix + ".job.cost";
    }

    public String durationMetricName() {
        return prefix + ".job.duration";
    }

    @Data
    public static class Datadog {
        private String apiKey;
        /** Optional; sent as DD-APPLICATION-KEY when set. */
        private String appKey;
        private String siteUrl = "https://api.datadoghq.com";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
    }
}
