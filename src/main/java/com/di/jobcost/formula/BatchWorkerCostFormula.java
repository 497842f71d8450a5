package com.di.jobcost.formula;

import com.di.jobcost.exception.UnknownResourceClassException;
import com.di.jobcost.pricing.UnitPrice;
import com.di.jobcost.usage.BatchWorkerUsage;
import com.di.jobcost.usage.JobEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * cost = workers x DPUs per worker x hours x price per DPU-hour.
 */
@Slf4j
@Component
public class BatchWorkerCostFormula implements CostFormula<BatchWorkerUsage> {

    private final WorkerCapacityProperties capacity;

    public BatchWorkerCostFormula(WorkerCapacityProperties capacity) {
        this.capacity = capacity;
    }

    @Override
    public JobEnvironment getEnvironment() {
        return JobEnvironment.GLUE;
    }

    @Override
    public Class<BatchWorkerUsage> getUsageType() {
        return BatchWorkerUsage.class;
    }

    @Override
    public Set<String> resourceClasses(BatchWorkerUsage usage) {
        dpuEquivalent(usage.getWorkerType());
        return Set.of(usage.getWorkerType());
    }

    /**
     * @throws UnknownResourceClassException for a worker type with no configured multiplier
     */
    public double dpuEquivalent(String workerType) {
        Double dpus = workerType != null ? capacity.getDpuPerWorker().get(workerType) : null;
        if (dpus == null || dpus <= 0) {
            throw new UnknownResourceClassException(workerType);
        }
        return dpus;
    }

    @Override
    public double compute(BatchWorkerUsage usage, double durationSeconds, Map<String, UnitPrice> prices) {
        double hours = CostFormula.hours(durationSeconds);
        double dpus = dpuEquivalent(usage.getWorkerType());
        UnitPrice price = CostFormula.requirePrice(prices, usage.getWorkerType());
        double cost = usage.getWorkerCount() * dpus * hours * price.getPricePerHour();
        log.info("[COST] Batch cost: {} workers of type {} ({} DPUs) for {} sec at ${} per DPU-hour => ${}",
                usage.getWorkerCount(), usage.getWorkerType(), dpus, durationSeconds,
                price.getPricePerHour(), String.format("%.4f", cost));
        return cost;
    }
}
