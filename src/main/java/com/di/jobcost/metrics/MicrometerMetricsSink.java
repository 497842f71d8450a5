package com.di.jobcost.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records job-cost points as gauges in the application {@link MeterRegistry}, for scraping through the
 * actuator. Each distinct (name, tags) pair gets one gauge holding the latest value.
 */
@Slf4j
public class MicrometerMetricsSink implements MetricsSink {

    private final MeterRegistry meterRegistry;
    private final Map<String, AtomicReference<Double>> latest = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void submit(List<MetricPoint> points, String credential) {
        if (points == null) {
            return;
        }
        for (MetricPoint point : points) {
            List<Tag> tags = toTags(point);
            String key = point.getMetric() + tags;
            try {
                latest.computeIfAbsent(key, k -> register(point.getMetric(), tags)).set(point.getValue());
            } catch (RuntimeException e) {
                throw new MetricSubmissionException("Could not record gauge " + point.getMetric(), e);
            }
            log.debug("[METRICS] Recorded gauge {}={} {}", point.getMetric(), point.getValue(), tags);
        }
    }

    private AtomicReference<Double> register(String name, List<Tag> tags) {
        AtomicReference<Double> holder = new AtomicReference<>(0.0);
        Gauge.builder(name, holder, AtomicReference::get)
                .description("Latest reported job " + (name.endsWith(".cost") ? "cost in USD" : "duration in seconds"))
                .tags(tags)
                .register(meterRegistry);
        return holder;
    }

    private static List<Tag> toTags(MetricPoint point) {
        List<Tag> tags = new ArrayList<>();
        if (point.getTags() != null) {
            point.getTags().asMap().forEach((k, v) -> tags.add(Tag.of(k, v.isEmpty() ? "none" : v)));
        }
        return tags;
    }
}
