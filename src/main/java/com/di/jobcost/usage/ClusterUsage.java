package com.di.jobcost.usage;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cluster usage: running instance count per instance type, plus the cluster release label if known.
 * Instance types are kept in lexicographic order so iteration (and logging) is deterministic.
 */
@Value
public class ClusterUsage implements ResourceUsageRecord {

    String region;
    Map<String, Integer> instanceCounts;
    String releaseLabel;

    @Builder
    public ClusterUsage(String region, @Singular Map<String, Integer> instanceCounts, String releaseLabel) {
        Map<String, Integer> counts = new TreeMap<>();
        if (instanceCounts != null) {
            instanceCounts.forEach((type, count) -> {
                if (type == null || type.isBlank()) {
                    throw new IllegalArgumentException("Instance type must not be blank");
                }
                int n = count != null ? count : 0;
                if (n < 0) {
                    throw new IllegalArgumentException("Instance count for " + type + " must be >= 0, got " + n);
                }
                counts.merge(type.trim(), n, Integer::sum);
            });
        }
        this.region = region;
        this.instanceCounts = Collections.unmodifiableMap(counts);
        this.releaseLabel = releaseLabel;
    }

    /** Instance types with at least one instance, in the same order as {@link #getInstanceCounts()}. */
    public Map<String, Integer> runningInstanceCounts() {
        Map<String, Integer> running = new TreeMap<>();
        instanceCounts.forEach((type, count) -> {
            if (count > 0) {
                running.put(type, count);
            }
        });
        return Collections.unmodifiableMap(running);
    }

    public Optional<String> findReleaseLabel() {
        return releaseLabel == null || releaseLabel.isBlank() ? Optional.empty() : Optional.of(releaseLabel);
    }

    @Override
    public JobEnvironment getEnvironment() {
        return JobEnvironment.EMR;
    }
}
