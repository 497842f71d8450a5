package com.di.jobcost.tags;

import com.di.jobcost.usage.BatchWorkerUsage;
import com.di.jobcost.usage.ClusterUsage;
import com.di.jobcost.usage.JobEnvironment;
import com.di.jobcost.usage.ResourceUsageRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the low-cardinality tag set attached to every job-cost metric.
 *
 * <p>Order is fixed: customer, job_type, status, region, then the environment tags. Batch workers add
 * {@code glue_worker_type}. Clusters add {@code emr_instance_types} (types with a running instance,
 * sorted, comma-joined, only when there are any) and {@code emr_release_label} (only when set).
 * Values come from bounded vocabularies
 * (ids, enums, type keys); job names and other free text are never tagged.
 */
@Component
public class TagBuilder {

    static final String UNKNOWN = "unknown";

    public TagSet buildTags(String customerId, JobEnvironment environment, ResourceUsageRecord usage, boolean success) {
        List<String> tags = new ArrayList<>();
        tags.add("customer:" + orUnknown(customerId));
        tags.add("job_type:" + (environment != null ? environment.getValue() : UNKNOWN));
        tags.add("status:" + (success ? "success" : "failed"));
        tags.add("region:" + orUnknown(usage != null ? usage.getRegion() : null));

        if (usage instanceof BatchWorkerUsage batch) {
            tags.add("glue_worker_type:" + orUnknown(batch.getWorkerType()));
        } else if (usage instanceof ClusterUsage cluster) {
            Set<String> running = cluster.runningInstanceCounts().keySet();
            if (!running.isEmpty()) {
                // sorted map keys
                tags.add("emr_instance_types:" + String.join(",", running));
            }
            cluster.findReleaseLabel().ifPresent(label -> tags.add("emr_release_label:" + label));
        }
        return TagSet.of(tags);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value.trim();
    }
}
