package com.di.jobcost.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts gauges to the Datadog v1 series endpoint. Every point in a batch goes in one request.
 */
@Slf4j
public class DatadogMetricsSink implements MetricsSink {

    static final String SERIES_PATH = "/api/v1/series";

    private final RestClient restClient;
    private final String appKey;

    public DatadogMetricsSink(RestClient restClient, String appKey) {
        this.restClient = restClient;
        this.appKey = appKey;
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    @Override
    public void submit(List<MetricPoint> points, String credential) {
        if (points == null || points.isEmpty()) {
            return;
        }
        Map<String, Object> payload = Map.of("series", toSeries(points));
        try {
            restClient.post()
                    .uri(SERIES_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        h.set("DD-API-KEY", credential);
                        if (appKey != null && !appKey.isBlank()) {
                            h.set("DD-APPLICATION-KEY", appKey);
                        }
                    })
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            log.info("[METRICS] Sent {} metric(s) to Datadog: {}", points.size(),
                    points.stream().map(MetricPoint::getMetric).toList());
        } catch (RestClientException e) {
            throw new MetricSubmissionException("Datadog rejected or did not accept the series: " + e.getMessage(), e);
        }
    }

    private static List<Map<String, Object>> toSeries(List<MetricPoint> points) {
        List<Map<String, Object>> series = new ArrayList<>(points.size());
        for (MetricPoint point : points) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("metric", point.getMetric());
            entry.put("points", List.of(List.of(point.getTimestamp(), point.getValue())));
            entry.put("tags", point.getTags() != null ? point.getTags().asList() : List.of());
            entry.put("type", point.getType());
            series.add(entry);
        }
        return series;
    }
}
