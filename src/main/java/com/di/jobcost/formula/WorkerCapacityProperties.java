package com.di.jobcost.formula;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capacity units (DPUs) per worker, by worker type.
 *
 * <pre>
 * jobcost:
 *   capacity:
 *     dpu-per-worker:
 *       "[G.1X]": 1
 *       "[G.2X]": 2
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "jobcost.capacity")
public class WorkerCapacityProperties {

    private Map<String, Double> dpuPerWorker = new LinkedHashMap<>();
}
