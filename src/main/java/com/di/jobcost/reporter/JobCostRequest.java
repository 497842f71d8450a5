package com.di.jobcost.reporter;

import com.di.jobcost.usage.BatchWorkerUsage;
import com.di.jobcost.usage.ClusterUsage;
import com.di.jobcost.usage.JobEnvironment;
import com.di.jobcost.usage.ResourceUsageRecord;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request body for POST /api/job-costs and /api/job-costs/estimate.
 * {@code jobType} selects which usage fields apply: glue uses workerType/workerCount,
 * emr uses instanceCounts/releaseLabel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCostRequest {

    /** Required for reporting; ignored by estimate. */
    private String customerId;

    @NotBlank
    private String jobType;

    private String region;

    private String workerType;
    @PositiveOrZero
    private Integer workerCount;

    private Map<String, Integer> instanceCounts;
    private String releaseLabel;

    @PositiveOrZero
    private double durationSeconds;

    @Builder.Default
    private boolean success = true;

    public ResourceUsageRecord toUsageRecord() {
        return switch (JobEnvironment.fromValue(jobType)) {
            case GLUE -> BatchWorkerUsage.builder()
                    .region(region)
                    .workerType(workerType)
                    .workerCount(workerCount != null ? workerCount : 1)
                    .build();
            case EMR -> ClusterUsage.builder()
                    .region(region)
                    .instanceCounts(instanceCounts != null ? instanceCounts : Map.of())
                    .releaseLabel(releaseLabel)
                    .build();
        };
    }
}
